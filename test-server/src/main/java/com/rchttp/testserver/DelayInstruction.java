package com.rchttp.testserver;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.Locale;

/**
 * JSON 요청 본문으로 받는 지연 지시: {"delay":"1s","delay_on_call":2}
 * delay 형식: "250ms", "1s", "2m" (단위 없는 숫자는 ms)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DelayInstruction {
    @JsonProperty("delay")         public String delay;
    @JsonProperty("delay_on_call") public int delayOnCall;

    public boolean hasDelay() { return delay != null && !delay.isBlank(); }

    /** delay_on_call 번째 호출 1건을 delay만큼 늦추는 JSON 본문 */
    public static String json(String delay, int delayOnCall) {
        return "{\"delay\":\"" + delay + "\",\"delay_on_call\":" + delayOnCall + "}";
    }

    public static Duration parseDuration(String s) {
        String v = s.trim().toLowerCase(Locale.ROOT);
        try {
            if (v.endsWith("ms")) return Duration.ofMillis(Long.parseLong(v.substring(0, v.length() - 2)));
            if (v.endsWith("s"))  return Duration.ofSeconds(Long.parseLong(v.substring(0, v.length() - 1)));
            if (v.endsWith("m"))  return Duration.ofMinutes(Long.parseLong(v.substring(0, v.length() - 1)));
            return Duration.ofMillis(Long.parseLong(v));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid duration: " + s, e);
        }
    }
}
