package com.seccrawl.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredLogTest {

    private static final ObjectMapper M = new ObjectMapper();

    @Test
    void formats_event_as_json_line() throws Exception {
        String line = StructuredLog.format("INFO", "SiteCrawler", "page-collected", null,
                "url", "https://ex.com/\"q\"", "pageNo", 3, "ok", true);

        JsonNode n = M.readTree(line);
        assertThat(line).doesNotContain("\n");
        assertThat(n.get("lvl").asText()).isEqualTo("INFO");
        assertThat(n.get("comp").asText()).isEqualTo("SiteCrawler");
        assertThat(n.get("event").asText()).isEqualTo("page-collected");
        assertThat(n.get("url").asText()).isEqualTo("https://ex.com/\"q\"");
        assertThat(n.get("pageNo").asInt()).isEqualTo(3);
        assertThat(n.get("ok").asBoolean()).isTrue();
        assertThat(n.has("ts")).isTrue();
    }

    @Test
    void odd_kvs_and_errors_are_flagged() throws Exception {
        String line = StructuredLog.format("ERROR", "X", "boom", new IllegalStateException("bad"), "dangling");

        JsonNode n = M.readTree(line);
        assertThat(n.get("_kv_mismatch").asBoolean()).isTrue();
        assertThat(n.get("error").asText()).isEqualTo("IllegalStateException");
        assertThat(n.get("message").asText()).isEqualTo("bad");
    }
}
