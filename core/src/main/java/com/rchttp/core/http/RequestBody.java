package com.rchttp.core.http;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * 재전송 가능한 요청 본문(body factory).
 * 시도마다 open()으로 새 스트림을 받아야 한다. 이전 시도에서 소비된 스트림은 재사용 불가.
 */
public interface RequestBody {

    /** 매 호출마다 독립적으로 읽을 수 있는 새 스트림 */
    InputStream open() throws IOException;

    /** 바이트 길이. 모르면 -1. */
    long contentLength();

    static RequestBody ofBytes(byte[] bytes) {
        byte[] copy = Objects.requireNonNull(bytes, "bytes").clone();
        return new RequestBody() {
            @Override public InputStream open() { return new ByteArrayInputStream(copy); }
            @Override public long contentLength() { return copy.length; }
        };
    }

    static RequestBody ofString(String s) { return ofString(s, StandardCharsets.UTF_8); }

    static RequestBody ofString(String s, Charset cs) {
        return ofBytes(Objects.requireNonNull(s, "s").getBytes(cs));
    }

    /** 길이를 모르는 팩토리(파일 등). 매 open()이 처음부터 다시 읽어야 한다. */
    static RequestBody of(StreamFactory factory) {
        Objects.requireNonNull(factory, "factory");
        return new RequestBody() {
            @Override public InputStream open() throws IOException { return factory.open(); }
            @Override public long contentLength() { return -1; }
        };
    }

    @FunctionalInterface
    interface StreamFactory {
        InputStream open() throws IOException;
    }
}
