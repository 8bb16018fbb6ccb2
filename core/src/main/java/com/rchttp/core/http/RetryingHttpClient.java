package com.rchttp.core.http;

import com.rchttp.core.api.HttpDispatcher;
import com.rchttp.core.config.ClientConfig;
import com.rchttp.core.context.RequestContext;
import com.rchttp.core.correlation.RequestIdChain;
import com.rchttp.core.util.DefaultSleeper;
import com.rchttp.core.util.Sleeper;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * 기본 HttpDispatcher 구현: 요청 타임아웃 + 지수 백오프 재시도 + 컨텍스트 취소.
 * 설정은 불변. withXxx()는 전송 계층을 공유하는 새 클라이언트를 돌려준다.
 */
public class RetryingHttpClient implements HttpDispatcher {

    public static final String CONTENT_TYPE = "Content-Type";
    public static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";

    private final ClientConfig config;
    private final HttpTransport transport;
    private final Sleeper sleeper;
    private final RequestDispatcher dispatcher;

    /** 기본 설정 */
    public RetryingHttpClient() {
        this(ClientConfig.defaults());
    }

    public RetryingHttpClient(ClientConfig config) {
        this(config, new JdkHttpTransport(config));
    }

    public RetryingHttpClient(ClientConfig config, HttpTransport transport) {
        this(config, transport, new DefaultSleeper());
    }

    /** 테스트용: 전송 계층/대기 훅 주입 */
    public RetryingHttpClient(ClientConfig config, HttpTransport transport, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");

        RetryPolicy policy = new DefaultRetryPolicy(config.getBaseRetryDelay());
        this.dispatcher = new RequestDispatcher(
                config,
                transport,
                new BodyReplayingSender(config.getRequestTimeout()),
                policy,
                new BackoffScheduler(policy, sleeper),
                new RequestIdChain());
    }

    @Override
    public DispatchResponse send(RequestContext ctx, OutboundRequest request) throws IOException, InterruptedException {
        return dispatcher.dispatch(ctx, request).getOrThrow();
    }

    // ============ 편의 메서드: 요청만 만들고 send에 위임 ============

    @Override
    public DispatchResponse get(RequestContext ctx, String url) throws IOException, InterruptedException {
        return send(ctx, OutboundRequest.builder("GET", toUri(url)).build());
    }

    @Override
    public DispatchResponse head(RequestContext ctx, String url) throws IOException, InterruptedException {
        return send(ctx, OutboundRequest.builder("HEAD", toUri(url)).build());
    }

    @Override
    public DispatchResponse post(RequestContext ctx, String url, String contentType, RequestBody body)
            throws IOException, InterruptedException {
        return send(ctx, withBody("POST", url, contentType, body));
    }

    @Override
    public DispatchResponse put(RequestContext ctx, String url, String contentType, RequestBody body)
            throws IOException, InterruptedException {
        return send(ctx, withBody("PUT", url, contentType, body));
    }

    @Override
    public DispatchResponse postForm(RequestContext ctx, String url, Map<String, List<String>> form)
            throws IOException, InterruptedException {
        return post(ctx, url, FORM_CONTENT_TYPE, RequestBody.ofString(encodeForm(form)));
    }

    // ============ 설정 ============

    @Override public int getMaxRetries() { return config.getMaxRetries(); }

    @Override public Set<String> getNoRetryPaths() { return config.getNoRetryPaths(); }

    public ClientConfig getConfig() { return config; }

    @Override
    public RetryingHttpClient withTimeout(Duration timeout) {
        return new RetryingHttpClient(config.toBuilder().requestTimeout(timeout).build(), transport, sleeper);
    }

    @Override
    public RetryingHttpClient withMaxRetries(int maxRetries) {
        return new RetryingHttpClient(config.toBuilder().maxRetries(maxRetries).build(), transport, sleeper);
    }

    @Override
    public RetryingHttpClient withNoRetryPaths(Collection<String> paths) {
        return new RetryingHttpClient(config.toBuilder().noRetryPaths(paths).build(), transport, sleeper);
    }

    // ============ 내부 ============

    private static OutboundRequest withBody(String method, String url, String contentType, RequestBody body) {
        OutboundRequest.Builder b = OutboundRequest.builder(method, toUri(url)).body(body);
        if (contentType != null && !contentType.isBlank()) b.header(CONTENT_TYPE, contentType);
        return b.build();
    }

    private static URI toUri(String url) {
        Objects.requireNonNull(url, "url");
        return URI.create(url);
    }

    /** 키 정렬 후 k=v&k=v. 같은 키의 값은 입력 순서 유지. */
    static String encodeForm(Map<String, List<String>> form) {
        if (form == null || form.isEmpty()) return "";
        StringJoiner out = new StringJoiner("&");
        for (Map.Entry<String, List<String>> e : new TreeMap<>(form).entrySet()) {
            String k = URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8);
            List<String> vs = (e.getValue() == null) ? List.of() : e.getValue();
            for (String v : vs) {
                out.add(k + "=" + URLEncoder.encode(v == null ? "" : v, StandardCharsets.UTF_8));
            }
        }
        return out.toString();
    }
}
