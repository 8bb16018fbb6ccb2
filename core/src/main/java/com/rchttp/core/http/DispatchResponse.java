package com.rchttp.core.http;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** 한 번의 시도에서 받은 응답(상태코드 + 헤더 + 본문). 5xx도 정상 반환값이다. */
public final class DispatchResponse {
    private final URI url;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final byte[] body;
    private final long responseTimeMs;

    private DispatchResponse(Builder b) {
        this.url = b.url;
        this.statusCode = b.statusCode;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(b.headers);
        this.body = (b.body == null) ? new byte[0] : b.body;
        this.responseTimeMs = b.responseTimeMs;
    }

    /** JDK 응답 매핑 */
    static DispatchResponse from(HttpResponse<byte[]> resp, long elapsedMs) {
        return builder()
                .url(resp.uri())
                .statusCode(resp.statusCode())
                .headers(resp.headers().map())
                .body(resp.body())
                .responseTimeMs(elapsedMs)
                .build();
    }

    public URI getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public long getResponseTimeMs() { return responseTimeMs; }

    public byte[] getBody() { return body.clone(); }
    public InputStream bodyStream() { return new ByteArrayInputStream(body); }
    public String bodyAsString() { return new String(body, StandardCharsets.UTF_8); }

    public String getContentType() { return header("Content-Type"); }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        List<String> vs = headers(name);
        return vs.isEmpty() ? null : vs.get(0);
    }

    /** 모든 헤더 값(대소문자 무시). 없으면 빈 리스트. */
    public List<String> headers(String name) {
        if (name == null) return List.of();
        for (var e : headers.entrySet()) {
            String k = e.getKey();
            if (k != null && k.equalsIgnoreCase(name)) {
                return (e.getValue() != null) ? e.getValue() : List.of();
            }
        }
        return List.of();
    }

    @Override public String toString() { return "DispatchResponse{" + statusCode + " " + url + "}"; }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI url;
        private int statusCode;
        private Map<String, List<String>> headers;
        private byte[] body;
        private long responseTimeMs;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder body(byte[] body) { this.body = body; return this; }
        public Builder body(String body) { this.body = body.getBytes(StandardCharsets.UTF_8); return this; }
        public Builder responseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; return this; }

        public DispatchResponse build() {
            Objects.requireNonNull(url, "url");
            return new DispatchResponse(this);
        }
    }
}
