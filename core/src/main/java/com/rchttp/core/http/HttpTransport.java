package com.rchttp.core.http;

import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;

/** 실제 전송 계층(TCP/TLS/커넥션 풀). 테스트에서는 스크립트 구현으로 대체한다. */
@FunctionalInterface
public interface HttpTransport {
    /** future 취소 시 진행 중 교환을 중단해야 한다. */
    CompletableFuture<HttpResponse<byte[]>> sendAsync(HttpRequest request);
}
