package com.rchttp.testserver;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 느리거나 에러를 내는 하류 서버 시뮬레이터.
 *  - 모든 요청에 고정 statusCode + Responder JSON 에코(Content-Type은 text/plain)
 *  - JSON 본문에 DelayInstruction이 있으면 지정한 호출 번호에서만 응답 지연
 *  - 호출 횟수는 핸들러 진입 시 증가(지연 중인 호출도 집계됨)
 */
public final class TestServer implements AutoCloseable {

    public static final String JSON_CONTENT_TYPE = "application/json";
    public static final String FORM_ENCODED_TYPE = "application/x-www-form-urlencoded";
    public static final String CONTENT_TYPE_HEADER = "Content-Type";

    private static final Logger LOG = LoggerFactory.getLogger(TestServer.class);

    private final ObjectMapper om = new ObjectMapper();
    private final AtomicInteger calls = new AtomicInteger();
    private final int statusCode;
    private final HttpServer server;
    private final ExecutorService executor;

    private TestServer(int statusCode, int port) throws IOException {
        this.statusCode = statusCode;
        this.server = HttpServer.create(new InetSocketAddress("127.0.0.1", port), 0);
        // 지연 중인 핸들러가 다음 호출을 막지 않도록 풀 사용(데몬: JVM 종료 방해 금지)
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "test-server");
            t.setDaemon(true);
            return t;
        });
        server.createContext("/", this::handle);
        server.setExecutor(executor);
    }

    /** 임의 포트로 기동 */
    public static TestServer start(int statusCode) throws IOException {
        return start(statusCode, 0);
    }

    public static TestServer start(int statusCode, int port) throws IOException {
        TestServer ts = new TestServer(statusCode, port);
        ts.server.start();
        LOG.debug("test server up: {} status={}", ts.url(), statusCode);
        return ts;
    }

    public String url() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    public int getCalls() { return calls.get(); }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow(); // 지연 중인 sleep 중단
    }

    // ----------------------------------------------------------------

    private void handle(HttpExchange ex) throws IOException {
        int callNo = calls.incrementAndGet();
        try {
            String contentType = ex.getRequestHeaders().getFirst(CONTENT_TYPE_HEADER);
            byte[] body = readAll(ex.getRequestBody());

            Responder r = new Responder();
            r.method = ex.getRequestMethod();
            r.callCount = callNo;
            r.body = new String(body, StandardCharsets.UTF_8);
            r.headers = copyHeaders(ex);
            r.path = ex.getRequestURI().getPath();
            r.error = "";

            String out;
            try {
                if (JSON_CONTENT_TYPE.equals(contentType) && body.length > 0) {
                    DelayInstruction d = om.readValue(body, DelayInstruction.class);
                    if (d.hasDelay() && d.delayOnCall == callNo) {
                        Duration delay = DelayInstruction.parseDuration(d.delay);
                        LOG.debug("delaying call {} by {}", callNo, delay);
                        Thread.sleep(delay.toMillis());
                    }
                }
                out = om.writeValueAsString(r);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (IOException | IllegalArgumentException e) {
                out = errorOutput(contentType, e);
            }

            byte[] bytes = out.getBytes(StandardCharsets.UTF_8);
            ex.getResponseHeaders().set(CONTENT_TYPE_HEADER, "text/plain; charset=utf-8");
            if ("HEAD".equalsIgnoreCase(r.method)) {
                ex.sendResponseHeaders(statusCode, -1);
                return;
            }
            ex.sendResponseHeaders(statusCode, bytes.length);
            try (OutputStream os = ex.getResponseBody()) {
                os.write(bytes);
            }
        } catch (IOException e) {
            // 클라이언트가 먼저 끊은 경우(타임아웃/취소)
            LOG.debug("call {} aborted: {}", callNo, e.getMessage());
        } finally {
            ex.close();
        }
    }

    private static Map<String, List<String>> copyHeaders(HttpExchange ex) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        ex.getRequestHeaders().forEach((k, v) -> headers.put(k, List.copyOf(v)));
        return headers;
    }

    private static String errorOutput(String contentType, Exception e) {
        String msg = String.valueOf(e.getMessage());
        if (!JSON_CONTENT_TYPE.equals(contentType)) return msg;
        return "{\"error\":\"" + msg.replace("\"", "`") + "\"}";
    }

    private static byte[] readAll(InputStream in) throws IOException {
        try (in) {
            return in.readAllBytes();
        }
    }

    /** 수동 확인용: java TestServer [status] [port] */
    public static void main(String[] args) throws Exception {
        int status = args.length > 0 ? Integer.parseInt(args[0]) : 200;
        int port = args.length > 1 ? Integer.parseInt(args[1]) : 8080;
        TestServer ts = start(status, port);
        LOG.info("test server on {} (status {})", ts.url(), status);
        Runtime.getRuntime().addShutdownHook(new Thread(ts::close));
        new CountDownLatch(1).await();
    }
}
