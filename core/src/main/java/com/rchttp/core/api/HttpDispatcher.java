package com.rchttp.core.api;

import com.rchttp.core.context.RequestContext;
import com.rchttp.core.http.DispatchResponse;
import com.rchttp.core.http.OutboundRequest;
import com.rchttp.core.http.RequestBody;

import java.io.IOException;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 재시도/백오프/취소를 지원하는 HTTP 클라이언트 계약.
 *
 * 응답은 상태코드와 무관하게 반환된다(5xx 포함). 전송 실패는 IOException,
 * 컨텍스트 취소는 RequestCancelledException(IOException 하위)으로 던진다.
 */
public interface HttpDispatcher {

    DispatchResponse send(RequestContext ctx, OutboundRequest request) throws IOException, InterruptedException;

    DispatchResponse get(RequestContext ctx, String url) throws IOException, InterruptedException;

    DispatchResponse head(RequestContext ctx, String url) throws IOException, InterruptedException;

    DispatchResponse post(RequestContext ctx, String url, String contentType, RequestBody body)
            throws IOException, InterruptedException;

    DispatchResponse put(RequestContext ctx, String url, String contentType, RequestBody body)
            throws IOException, InterruptedException;

    /** application/x-www-form-urlencoded POST. 키 정렬 순서로 인코딩. */
    DispatchResponse postForm(RequestContext ctx, String url, Map<String, List<String>> form)
            throws IOException, InterruptedException;

    int getMaxRetries();

    Set<String> getNoRetryPaths();

    /** 설정만 바꾼 새 클라이언트. 원본은 그대로. */
    HttpDispatcher withTimeout(Duration timeout);

    HttpDispatcher withMaxRetries(int maxRetries);

    HttpDispatcher withNoRetryPaths(Collection<String> paths);
}
