package com.rchttp.core.http;

import com.rchttp.core.context.RequestCancelledException;
import com.rchttp.core.context.RequestContext;
import com.rchttp.core.util.Sleeper;
import com.rchttp.core.util.StructuredLog;

import java.time.Duration;
import java.util.Objects;

/**
 * 재시도 루프: 대기(취소와 경쟁) → 재전송 → 판정.
 *
 * 종료 조건
 *  - 재시도 불필요한 결과 → 그 결과 반환(2xx든 4xx든)
 *  - 대기 중/전송 직후 컨텍스트 취소 → 취소 cause 반환(받은 응답은 버림)
 *  - maxAttempts 소진 → 마지막 시도 결과 그대로 반환(합성 에러 없음)
 */
public final class BackoffScheduler {

    private static final StructuredLog SLOG = StructuredLog.get(BackoffScheduler.class);

    /** 재시도 1회 전송. 요청 본문 재생은 구현 쪽 책임. */
    @FunctionalInterface
    public interface Attempt {
        AttemptOutcome send() throws InterruptedException;
    }

    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public BackoffScheduler(RetryPolicy policy, Sleeper sleeper) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * @param previous 루프 진입 전 마지막 결과. 루프가 한 번도 돌지 않으면 그대로 반환.
     * @param maxAttempts 추가로 보낼 수 있는 재시도 횟수
     */
    public AttemptOutcome run(RequestContext ctx, int maxAttempts, AttemptOutcome previous, Attempt attempt)
            throws InterruptedException {
        AttemptOutcome last = previous;
        for (int retry = 1; retry <= maxAttempts; retry++) {
            Duration delay = policy.nextDelay(retry);
            SLOG.debug("retry.scheduled", "retry", retry, "delayMs", delay.toMillis(), "previous", String.valueOf(last));
            try {
                sleeper.sleep(delay, ctx);
            } catch (RequestCancelledException e) {
                SLOG.debug("retry.cancelled", "retry", retry, "reason", e.getReason().name());
                return AttemptOutcome.failed(e);
            }

            last = attempt.send();
            // 전송과 동시에 취소됐다면 응답이 와도 취소가 우선
            if (ctx.isDone()) {
                SLOG.debug("retry.cancelled", "retry", retry, "reason", ctx.cause().getReason().name());
                return AttemptOutcome.failed(ctx.cause());
            }
            if (!policy.shouldRetry(last)) {
                return last;
            }
        }
        SLOG.debug("retry.exhausted", "retries", maxAttempts, "last", String.valueOf(last),
                "error", last.isFailure() ? last.getError().getClass().getSimpleName() : null);
        return last;
    }
}
