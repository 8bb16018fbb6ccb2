package com.rchttp.core.http;

import java.io.IOException;
import java.util.Objects;

/** 시도 1회의 결과: 응답 또는 전송 실패 중 정확히 하나. */
public final class AttemptOutcome {
    private final DispatchResponse response;
    private final IOException error;

    private AttemptOutcome(DispatchResponse response, IOException error) {
        this.response = response;
        this.error = error;
    }

    public static AttemptOutcome of(DispatchResponse response) {
        return new AttemptOutcome(Objects.requireNonNull(response, "response"), null);
    }

    public static AttemptOutcome failed(IOException error) {
        return new AttemptOutcome(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isFailure() { return error != null; }

    /** 실패면 null */
    public DispatchResponse getResponse() { return response; }

    /** 응답이 있으면 null */
    public IOException getError() { return error; }

    /** 응답을 돌려주거나 실패를 그대로 던진다 */
    public DispatchResponse getOrThrow() throws IOException {
        if (error != null) throw error;
        return response;
    }

    @Override public String toString() {
        return isFailure() ? "failed(" + error + ")" : "status(" + response.getStatusCode() + ")";
    }
}
