package com.rchttp.core.http;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 나가는 요청: method + URL + 헤더(대소문자 무시) + 선택적 본문 팩토리.
 * 헤더는 디스패처가 변경한다(X-Request-Id 등). 메서드/URL/본문은 불변.
 */
public final class OutboundRequest {

    private final String method;
    private final URI url;
    private final Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final RequestBody body;

    private OutboundRequest(Builder b) {
        this.method = b.method;
        this.url = b.url;
        this.body = b.body;
        b.headers.forEach((k, v) -> this.headers.put(k, new ArrayList<>(v)));
    }

    public String getMethod() { return method; }
    public URI getUrl() { return url; }
    public RequestBody getBody() { return body; }

    /** 재시도 면제 판정에 쓰는 경로. 경로가 없으면 "". */
    public String getPath() {
        String p = url.getPath();
        return p == null ? "" : p;
    }

    /** 본문이 있고 비어있지 않을 때만 true (길이 미상은 있다고 본다) */
    public boolean hasBody() { return body != null && body.contentLength() != 0; }

    /** 첫 값. 없으면 null. */
    public String header(String name) {
        List<String> vs = headers.get(name);
        return (vs == null || vs.isEmpty()) ? null : vs.get(0);
    }

    public Map<String, List<String>> headers() { return Collections.unmodifiableMap(headers); }

    /** 기존 값을 덮어쓴다 */
    public void setHeader(String name, String value) {
        List<String> vs = new ArrayList<>(1);
        vs.add(Objects.requireNonNull(value, "value"));
        headers.put(Objects.requireNonNull(name, "name"), vs);
    }

    public void addHeader(String name, String value) {
        headers.computeIfAbsent(Objects.requireNonNull(name, "name"), k -> new ArrayList<>())
               .add(Objects.requireNonNull(value, "value"));
    }

    @Override public String toString() { return method + " " + url; }

    // ----- 빌더 -----
    public static Builder builder(String method, URI url) { return new Builder(method, url); }

    public static final class Builder {
        private final String method;
        private final URI url;
        private final Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private RequestBody body;

        private Builder(String method, URI url) {
            this.method = Objects.requireNonNull(method, "method").toUpperCase(Locale.ROOT);
            this.url = Objects.requireNonNull(url, "url");
        }

        public Builder header(String name, String value) {
            headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
            return this;
        }

        public Builder body(RequestBody body) { this.body = body; return this; }

        public OutboundRequest build() { return new OutboundRequest(this); }
    }
}
