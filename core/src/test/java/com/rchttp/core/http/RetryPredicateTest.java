package com.rchttp.core.http;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpTimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class RetryPredicateTest {

    private static DispatchResponse status(int sc) {
        return DispatchResponse.builder().url(URI.create("http://x/")).statusCode(sc).build();
    }

    @Test
    void transport_failure_is_always_retryable() {
        assertTrue(RetryPredicate.isRetryable(new IOException("connection refused"), null));
        assertTrue(RetryPredicate.isRetryable(AttemptOutcome.failed(new HttpTimeoutException("request timed out"))));
    }

    @Test
    void retries_on_5xx_and_409_only() {
        int[] retryables = {409, 500, 502, 503, 504, 599};
        for (int sc : retryables) {
            assertTrue(RetryPredicate.isRetryable(null, status(sc)), "should retry on " + sc);
        }

        int[] finals = {100, 200, 201, 204, 301, 302, 304, 400, 401, 403, 404, 408, 410, 418, 499};
        for (int sc : finals) {
            assertFalse(RetryPredicate.isRetryable(null, status(sc)), "must not retry on " + sc);
        }
    }

    @Test
    void status_429_is_final_as_currently_designed() {
        // 429는 관례상 백프레셔 신호지만 현재 설계는 재시도하지 않는다(의도 여부 미확정)
        assertFalse(RetryPredicate.isRetryableStatus(429));
        assertFalse(RetryPredicate.isRetryable(AttemptOutcome.of(status(429))));
    }
}
