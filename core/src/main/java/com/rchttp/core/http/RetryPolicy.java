package com.rchttp.core.http;

import java.time.Duration;

/** 재시도 조건/지연을 결정하는 정책 */
public interface RetryPolicy {
    /** 직전 시도 결과가 재시도 대상인지. 이전 시도 이력은 보지 않는다. */
    boolean shouldRetry(AttemptOutcome outcome);
    /** n번째 재시도(1부터) 직전 대기 시간. 음수 불가. */
    Duration nextDelay(int attempt);
}
