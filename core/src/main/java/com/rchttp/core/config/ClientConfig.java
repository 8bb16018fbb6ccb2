package com.rchttp.core.config;

import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * 클라이언트 설정(rchttp.yml 매핑 대상). 생성 후 불변.
 * 값 변경은 toBuilder()로 새 인스턴스를 만든다. 여러 클라이언트가 한 인스턴스를 공유해도 안전.
 */
public final class ClientConfig {

    public static final int DEFAULT_MAX_RETRIES = 10;
    public static final Duration DEFAULT_BASE_RETRY_DELAY = Duration.ofMillis(20);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);

    private final int maxRetries;              // 0이면 재시도 없음
    private final Duration baseRetryDelay;     // 2^n 배수의 기준
    private final Set<String> noRetryPaths;    // 정확히 일치하는 경로만 면제
    private final Duration requestTimeout;     // 시도 1회 전체(연결 포함)
    private final Duration connectTimeout;
    private final boolean followRedirects;

    private ClientConfig(Builder b) {
        this.maxRetries = b.maxRetries;
        this.baseRetryDelay = b.baseRetryDelay;
        this.noRetryPaths = Set.copyOf(b.noRetryPaths);
        this.requestTimeout = b.requestTimeout;
        this.connectTimeout = b.connectTimeout;
        this.followRedirects = b.followRedirects;
    }

    public static ClientConfig defaults() { return builder().build(); }

    // ---------- getters ----------
    public int getMaxRetries() { return maxRetries; }
    public Duration getBaseRetryDelay() { return baseRetryDelay; }
    public Set<String> getNoRetryPaths() { return noRetryPaths; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public boolean isFollowRedirects() { return followRedirects; }

    public boolean isRetryExempt(String path) { return path != null && noRetryPaths.contains(path); }

    public Builder toBuilder() {
        return builder()
                .maxRetries(maxRetries)
                .baseRetryDelay(baseRetryDelay)
                .noRetryPaths(noRetryPaths)
                .requestTimeout(requestTimeout)
                .connectTimeout(connectTimeout)
                .followRedirects(followRedirects);
    }

    @Override public String toString() {
        return "ClientConfig{maxRetries=" + maxRetries
                + ", baseRetryDelay=" + baseRetryDelay
                + ", noRetryPaths=" + noRetryPaths
                + ", requestTimeout=" + requestTimeout
                + ", connectTimeout=" + connectTimeout
                + ", followRedirects=" + followRedirects + "}";
    }

    // ---------- builder ----------
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration baseRetryDelay = DEFAULT_BASE_RETRY_DELAY;
        private Set<String> noRetryPaths = Set.of();
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private boolean followRedirects = true;

        private Builder() {}

        public Builder maxRetries(int v) { this.maxRetries = v; return this; }
        public Builder baseRetryDelay(Duration v) { this.baseRetryDelay = v; return this; }
        public Builder baseRetryDelayMs(long ms) { this.baseRetryDelay = Duration.ofMillis(ms); return this; }
        public Builder requestTimeout(Duration v) { this.requestTimeout = v; return this; }
        public Builder requestTimeoutMs(long ms) { this.requestTimeout = Duration.ofMillis(ms); return this; }
        public Builder connectTimeout(Duration v) { this.connectTimeout = v; return this; }
        public Builder connectTimeoutMs(long ms) { this.connectTimeout = Duration.ofMillis(ms); return this; }
        public Builder followRedirects(boolean v) { this.followRedirects = v; return this; }

        public Builder noRetryPaths(Collection<String> paths) {
            this.noRetryPaths = (paths == null) ? Set.of() : Set.copyOf(paths);
            return this;
        }

        public ClientConfig build() {
            validate();
            return new ClientConfig(this);
        }

        private void validate() {
            if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
            Objects.requireNonNull(baseRetryDelay, "baseRetryDelay");
            if (baseRetryDelay.isNegative()) throw new IllegalArgumentException("baseRetryDelay must be >= 0");
            Objects.requireNonNull(requestTimeout, "requestTimeout");
            if (requestTimeout.isNegative() || requestTimeout.isZero())
                throw new IllegalArgumentException("requestTimeout must be > 0");
            Objects.requireNonNull(connectTimeout, "connectTimeout");
            if (connectTimeout.isNegative() || connectTimeout.isZero())
                throw new IllegalArgumentException("connectTimeout must be > 0");
        }
    }
}
