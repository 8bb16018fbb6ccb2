package com.rchttp.core.http;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 전송 실패/5xx/409에서만 재시도.
 * 지연: 2^n * base - jitter(1~4ms). base 20ms 기준 ≈ 40ms → 80ms → 160ms ...
 * 지터는 같은 경계에 여러 클라이언트가 동시에 몰리는 것을 흩뜨린다. 0 미만은 0으로 자른다.
 */
public final class DefaultRetryPolicy implements RetryPolicy {

    static final int MAX_JITTER_MS = 4;
    private static final int MAX_EXPONENT = 30; // 오버플로 방지
    /** 지연 상한: 밀리초 long으로 표현 가능한 최대값에서 포화 */
    static final Duration MAX_DELAY = Duration.ofMillis(Long.MAX_VALUE);

    private final Duration baseDelay;

    public DefaultRetryPolicy(Duration baseDelay) {
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
        if (baseDelay.isNegative()) throw new IllegalArgumentException("baseDelay must be >= 0");
    }

    @Override public boolean shouldRetry(AttemptOutcome outcome) {
        return RetryPredicate.isRetryable(outcome);
    }

    @Override public Duration nextDelay(int attempt) {
        if (attempt < 1) throw new IllegalArgumentException("attempt must be >= 1");
        long pow = 1L << Math.min(attempt, MAX_EXPONENT);       // 2,4,8...
        Duration raw = saturatedMultiply(baseDelay, pow);
        int jitterMs = ThreadLocalRandom.current().nextInt(1, MAX_JITTER_MS + 1);
        Duration d = raw.minusMillis(jitterMs);
        return d.isNegative() ? Duration.ZERO : d;
    }

    private static Duration saturatedMultiply(Duration base, long factor) {
        try {
            Duration d = base.multipliedBy(factor);
            return d.compareTo(MAX_DELAY) > 0 ? MAX_DELAY : d;
        } catch (ArithmeticException e) {
            return MAX_DELAY;
        }
    }

    public Duration getBaseDelay() { return baseDelay; }
}
