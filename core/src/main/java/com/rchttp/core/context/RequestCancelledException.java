package com.rchttp.core.context;

import java.io.IOException;

/** 컨텍스트 취소/데드라인 초과. 재시도 대상이 아니며 항상 다른 결과보다 우선한다. */
public class RequestCancelledException extends IOException {

    public enum Reason {
        CANCELED("context canceled"),
        DEADLINE_EXCEEDED("context deadline exceeded");

        private final String message;

        Reason(String message) { this.message = message; }

        public String message() { return message; }
    }

    private final Reason reason;

    public RequestCancelledException(Reason reason) {
        super(reason.message());
        this.reason = reason;
    }

    public Reason getReason() { return reason; }

    public boolean isDeadlineExceeded() { return reason == Reason.DEADLINE_EXCEEDED; }
}
