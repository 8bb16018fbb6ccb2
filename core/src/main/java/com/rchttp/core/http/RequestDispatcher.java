package com.rchttp.core.http;

import com.rchttp.core.config.ClientConfig;
import com.rchttp.core.context.RequestContext;
import com.rchttp.core.correlation.RequestIdChain;

import java.util.Objects;

/**
 * 디스패치 오케스트레이터:
 *  헤더 주입 → 1차 전송 → 판정 → (허용 시) BackoffScheduler에 위임.
 * 요청 헤더 변경 외에는 부수효과 없음.
 */
public final class RequestDispatcher {

    private final ClientConfig config;
    private final HttpTransport transport;
    private final AttemptSender sender;
    private final RetryPolicy policy;
    private final BackoffScheduler scheduler;
    private final RequestIdChain requestIds;

    public RequestDispatcher(ClientConfig config,
                             HttpTransport transport,
                             AttemptSender sender,
                             RetryPolicy policy,
                             BackoffScheduler scheduler,
                             RequestIdChain requestIds) {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.requestIds = Objects.requireNonNull(requestIds, "requestIds");
    }

    public AttemptOutcome dispatch(RequestContext ctx, OutboundRequest request) throws InterruptedException {
        Objects.requireNonNull(ctx, "ctx");
        Objects.requireNonNull(request, "request");

        applyHeaders(ctx, request);

        AttemptOutcome first = sender.send(ctx, transport, request);
        // 취소 자체는 재시도하지 않는다
        if (ctx.isDone()) return AttemptOutcome.failed(ctx.cause());
        if (config.isRetryExempt(request.getPath())
                || config.getMaxRetries() <= 0
                || !policy.shouldRetry(first)) {
            return first;
        }
        return scheduler.run(ctx, config.getMaxRetries(), first,
                () -> sender.send(ctx, transport, request));
    }

    void applyHeaders(RequestContext ctx, OutboundRequest request) {
        // 상류 사용자 식별자: 이미 있으면 유지
        if (ctx.isUserPresent() && request.header(RequestIdChain.USER_IDENTITY_HEADER) == null) {
            request.setHeader(RequestIdChain.USER_IDENTITY_HEADER, ctx.getUser());
        }
        request.setHeader(RequestIdChain.REQUEST_ID_HEADER, requestIds.build(ctx.getRequestId()));
    }

    public ClientConfig getConfig() { return config; }
}
