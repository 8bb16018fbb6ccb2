package com.rchttp.core.http;

import com.rchttp.core.context.RequestContext;

/** 시도 1회 전송: (컨텍스트, 전송계층, 요청) → 결과. 첫 시도와 재시도 모두 같은 sender를 쓴다. */
@FunctionalInterface
public interface AttemptSender {
    AttemptOutcome send(RequestContext ctx, HttpTransport transport, OutboundRequest request)
            throws InterruptedException;
}
