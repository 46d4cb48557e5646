package com.compliancegate.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredLogTest {

    private final StructuredLog slog = StructuredLog.get(StructuredLogTest.class);
    private final ObjectMapper om = new ObjectMapper();

    @Test
    void jsonLine_carriesEventAndTypedFields() throws Exception {
        JsonNode n = om.readTree(slog.toJson(Level.INFO, "report-write", null,
                "path", "a/b.md", "written", true, "exitCode", 1, "error", null));

        assertThat(n.path("event").asText()).isEqualTo("report-write");
        assertThat(n.path("lvl").asText()).isEqualTo("INFO");
        assertThat(n.path("comp").asText()).isEqualTo("StructuredLogTest");
        assertThat(n.path("written").isBoolean()).isTrue();
        assertThat(n.path("exitCode").asInt()).isEqualTo(1);
        assertThat(n.path("error").isNull()).isTrue();
        assertThat(n.has("_kv_mismatch")).isFalse();
    }

    @Test
    void oddKeyValues_andThrowable_areFlagged() throws Exception {
        JsonNode n = om.readTree(slog.toJson(Level.SEVERE, "artifact-read-failed",
                new IllegalStateException("broken"), "name"));

        assertThat(n.path("_kv_mismatch").asBoolean()).isTrue();
        assertThat(n.path("error").asText()).isEqualTo("IllegalStateException");
        assertThat(n.path("message").asText()).isEqualTo("broken");
    }

    @Test
    void threadFactory_namesDaemonThreads() {
        NamedThreadFactory f = new NamedThreadFactory("artifact-reader");
        Thread t1 = f.newThread(() -> {});
        Thread t2 = f.newThread(() -> {});

        assertThat(t1.getName()).isEqualTo("artifact-reader-1");
        assertThat(t2.getName()).isEqualTo("artifact-reader-2");
        assertThat(t1.isDaemon()).isTrue();
    }
}
