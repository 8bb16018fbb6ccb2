package com.rchttp.testserver;

import static org.assertj.core.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

class TestServerTest {

    private final ObjectMapper om = new ObjectMapper();
    private final HttpClient http = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();

    private HttpResponse<String> post(TestServer ts, String path, String contentType, String body, Duration timeout)
            throws Exception {
        HttpRequest req = HttpRequest.newBuilder(URI.create(ts.url() + path))
                .timeout(timeout)
                .header(TestServer.CONTENT_TYPE_HEADER, contentType)
                .header("X-Request-Id", "abc")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return http.send(req, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void echoesRequestWithConfiguredStatus() throws Exception {
        try (TestServer ts = TestServer.start(418)) {
            HttpResponse<String> resp = post(ts, "/echo", "text/plain", "hello", Duration.ofSeconds(5));

            assertThat(resp.statusCode()).isEqualTo(418);
            assertThat(resp.headers().firstValue("Content-Type")).contains("text/plain; charset=utf-8");
            Responder r = om.readValue(resp.body(), Responder.class);
            assertThat(r.method).isEqualTo("POST");
            assertThat(r.body).isEqualTo("hello");
            assertThat(r.path).isEqualTo("/echo");
            assertThat(r.callCount).isEqualTo(1);
            assertThat(r.error).isEmpty();
            assertThat(r.header("x-request-id")).isEqualTo("abc");
            assertThat(r.headerValues("missing")).isEmpty();
        }
    }

    @Test
    void delaysOnlyTheNamedCall() throws Exception {
        try (TestServer ts = TestServer.start(200)) {
            String delay = DelayInstruction.json("1s", 1);

            assertThatThrownBy(() -> post(ts, "/", TestServer.JSON_CONTENT_TYPE, delay, Duration.ofMillis(100)))
                    .isInstanceOf(HttpTimeoutException.class);

            HttpResponse<String> second = post(ts, "/", TestServer.JSON_CONTENT_TYPE, delay, Duration.ofSeconds(5));
            assertThat(second.statusCode()).isEqualTo(200);
            assertThat(om.readValue(second.body(), Responder.class).callCount).isEqualTo(2);
            assertThat(ts.getCalls()).isEqualTo(2);
        }
    }

    @Test
    void badDelayIsReportedAsJsonError() throws Exception {
        try (TestServer ts = TestServer.start(200)) {
            HttpResponse<String> resp = post(ts, "/", TestServer.JSON_CONTENT_TYPE,
                    DelayInstruction.json("soon", 1), Duration.ofSeconds(5));

            Responder r = om.readValue(resp.body(), Responder.class);
            assertThat(r.error).contains("invalid duration: soon");
            assertThat(r.body).isNull();
        }
    }

    @Test
    void parsesDurations() {
        assertThat(DelayInstruction.parseDuration("250ms")).isEqualTo(Duration.ofMillis(250));
        assertThat(DelayInstruction.parseDuration("1s")).isEqualTo(Duration.ofSeconds(1));
        assertThat(DelayInstruction.parseDuration("2m")).isEqualTo(Duration.ofMinutes(2));
        assertThat(DelayInstruction.parseDuration(" 40 ")).isEqualTo(Duration.ofMillis(40));
        assertThatThrownBy(() -> DelayInstruction.parseDuration("1h"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
