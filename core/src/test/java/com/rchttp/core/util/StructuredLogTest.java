package com.rchttp.core.util;

import static org.assertj.core.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class StructuredLogTest {

    private final ObjectMapper om = new ObjectMapper();
    private final StructuredLog log = StructuredLog.get(StructuredLogTest.class);

    @Test
    void buildsOneParsableJsonLine() throws Exception {
        String line = log.line("retry.scheduled",
                "retry", 2, "delayMs", 38L, "url", "http://x/\"q\"\n\\", "exempt", false);

        assertThat(line).doesNotContain("\n");
        JsonNode n = om.readTree(line);
        assertThat(n.get("comp").asText()).isEqualTo("StructuredLogTest");
        assertThat(n.get("event").asText()).isEqualTo("retry.scheduled");
        assertThat(n.get("ts").asText()).isNotBlank();
        assertThat(n.get("retry").asInt()).isEqualTo(2);
        assertThat(n.get("delayMs").asLong()).isEqualTo(38L);
        assertThat(n.get("url").asText()).isEqualTo("http://x/\"q\"\n\\");
        assertThat(n.get("exempt").isBoolean()).isTrue();
    }

    @Test
    void oddKeyValueCountIsFlagged() throws Exception {
        JsonNode n = om.readTree(log.line("e", "dangling"));
        assertThat(n.get("_kv_mismatch").asBoolean()).isTrue();
        assertThat(n.has("dangling")).isFalse();
    }

    @Test
    void noKeyValuesStillGivesValidJson() throws Exception {
        JsonNode n = om.readTree(log.line("retry.exhausted"));
        assertThat(n.get("event").asText()).isEqualTo("retry.exhausted");
        assertThat(n.has("_kv_mismatch")).isFalse();
    }

    @Test
    void controlCharactersAreEscaped() throws Exception {
        JsonNode n = om.readTree(log.line("e", "raw", "a\u0001b\tc"));
        assertThat(n.get("raw").asText()).isEqualTo("a\u0001b\tc");
    }

    @Test
    void nullValuesAreJsonNull() throws Exception {
        JsonNode n = om.readTree(log.line("e", "error", null));
        assertThat(n.get("error").isNull()).isTrue();
    }
}
