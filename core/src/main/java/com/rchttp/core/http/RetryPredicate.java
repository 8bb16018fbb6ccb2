package com.rchttp.core.http;

/**
 * 시도 결과의 재시도 여부 판정(무상태 순수 함수).
 * 재시도: 전송 실패(응답 없음), 5xx, 409. 그 외(429 포함)는 최종 결과.
 */
public final class RetryPredicate {
    private RetryPredicate() {}

    public static boolean isRetryable(Throwable transportError, DispatchResponse response) {
        if (transportError != null) return true;
        if (response == null) return true;
        return isRetryableStatus(response.getStatusCode());
    }

    public static boolean isRetryable(AttemptOutcome outcome) {
        return isRetryable(outcome.getError(), outcome.getResponse());
    }

    public static boolean isRetryableStatus(int statusCode) {
        return statusCode >= 500 || statusCode == 409;
    }
}
