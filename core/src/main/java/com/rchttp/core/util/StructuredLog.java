package com.rchttp.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * 재시도 이벤트용 한 줄 JSON 로거(SLF4J DEBUG).
 * 형식: {"ts":..,"comp":..,"event":..,k:v...}. DEBUG가 꺼져 있으면 문자열을 만들지 않는다.
 */
public final class StructuredLog {
    private final Logger log;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.log = LoggerFactory.getLogger(cls);
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    /** kvs: key1, value1, key2, value2 ... */
    public void debug(String event, Object... kvs) {
        if (log.isDebugEnabled()) log.debug(line(event, kvs));
    }

    String line(String event, Object... kvs) {
        JsonLine out = new JsonLine()
                .field("ts", Instant.now().toString())
                .field("comp", comp)
                .field("thread", Thread.currentThread().getName())
                .field("event", event);
        int n = (kvs == null) ? 0 : kvs.length;
        for (int i = 0; i + 1 < n; i += 2) {
            out.field(String.valueOf(kvs[i]), kvs[i + 1]);
        }
        if (n % 2 == 1) out.field("_kv_mismatch", true);
        return out.close();
    }

    /** 필드를 순서대로 이어붙이는 최소 JSON 객체 빌더 */
    private static final class JsonLine {
        private final StringBuilder sb = new StringBuilder(128).append('{');
        private boolean first = true;

        JsonLine field(String key, Object value) {
            if (!first) sb.append(',');
            first = false;
            quote(key);
            sb.append(':');
            if (value == null) sb.append("null");
            else if (value instanceof Number || value instanceof Boolean) sb.append(value);
            else quote(String.valueOf(value));
            return this;
        }

        String close() {
            return sb.append('}').toString();
        }

        private void quote(String s) {
            sb.append('"');
            for (int i = 0; i < s.length(); i++) {
                char c = s.charAt(i);
                if (c == '"' || c == '\\') sb.append('\\').append(c);
                else if (c == '\n') sb.append("\\n");
                else if (c == '\r') sb.append("\\r");
                else if (c == '\t') sb.append("\\t");
                else if (c < 0x20) sb.append(String.format("\\u%04x", (int) c));
                else sb.append(c);
            }
            sb.append('"');
        }
    }
}
