package com.rchttp.core.http;

import com.rchttp.core.context.RequestContext;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * 기본 AttemptSender.
 * - 본문이 있으면 매 시도마다 RequestBody.open()으로 새로 읽는다.
 * - 전송 대기 중에도 컨텍스트 취소를 감시: 취소가 먼저면 진행 중 교환을 취소하고 cause 반환.
 */
public final class BodyReplayingSender implements AttemptSender {

    private final Duration requestTimeout;

    public BodyReplayingSender(Duration requestTimeout) {
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    @Override
    public AttemptOutcome send(RequestContext ctx, HttpTransport transport, OutboundRequest request)
            throws InterruptedException {
        if (ctx.isDone()) return AttemptOutcome.failed(ctx.cause());

        HttpRequest httpRequest;
        try {
            httpRequest = toHttpRequest(request);
        } catch (IOException e) {
            return AttemptOutcome.failed(e);
        }

        long start = System.nanoTime();
        CompletableFuture<HttpResponse<byte[]>> inflight = transport.sendAsync(httpRequest);
        // 실패해도 정상 완료되는 래퍼: anyOf가 예외로 끝나지 않게
        CompletableFuture<Object> settled = inflight.handle((r, e) -> r);
        try {
            CompletableFuture.anyOf(settled, ctx.done()).get();
        } catch (InterruptedException e) {
            inflight.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            throw new IllegalStateException("settled future failed", e.getCause());
        }

        if (ctx.isDone()) {
            inflight.cancel(true);
            return AttemptOutcome.failed(ctx.cause());
        }

        try {
            HttpResponse<byte[]> resp = inflight.get();
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            return AttemptOutcome.of(DispatchResponse.from(resp, elapsedMs));
        } catch (ExecutionException e) {
            return AttemptOutcome.failed(asIOException(e.getCause()));
        }
    }

    HttpRequest toHttpRequest(OutboundRequest request) throws IOException {
        HttpRequest.BodyPublisher publisher = HttpRequest.BodyPublishers.noBody();
        if (request.hasBody()) {
            // 이전 시도에서 소비된 스트림은 못 쓰므로 팩토리에서 다시 받는다
            try (InputStream in = request.getBody().open()) {
                publisher = HttpRequest.BodyPublishers.ofByteArray(in.readAllBytes());
            }
        }

        HttpRequest.Builder b = HttpRequest.newBuilder(request.getUrl())
                .timeout(requestTimeout)
                .method(request.getMethod(), publisher);
        for (Map.Entry<String, List<String>> h : request.headers().entrySet()) {
            for (String v : h.getValue()) b.header(h.getKey(), v);
        }
        return b.build();
    }

    private static IOException asIOException(Throwable t) {
        if (t instanceof IOException io) return io;
        return new IOException(t.getClass().getSimpleName() + ": " + t.getMessage(), t);
    }
}
