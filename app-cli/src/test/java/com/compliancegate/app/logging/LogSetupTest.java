package com.compliancegate.app.logging;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.assertj.core.api.Assertions.assertThat;

class LogSetupTest {

    @Test
    void levelOf_parsesCaseInsensitively_andFallsBackToInfo() {
        assertThat(LogSetup.levelOf("fine")).isEqualTo(Level.FINE);
        assertThat(LogSetup.levelOf(" WARNING ")).isEqualTo(Level.WARNING);
        assertThat(LogSetup.levelOf("loud")).isEqualTo(Level.INFO);
        assertThat(LogSetup.levelOf(null)).isEqualTo(Level.INFO);
    }

    @Test
    void lineFormatter_singleLine_withStackWhenThrown() {
        LogSetup.LineFormatter f = new LogSetup.LineFormatter();

        LogRecord r = new LogRecord(Level.WARNING, "Report sink ''{0}'' failed");
        r.setParameters(new Object[]{"console"});
        r.setLoggerName("com.compliancegate.core.service.ComplianceRunService");
        String line = f.format(r);
        assertThat(line).contains("[WARNING]", "ComplianceRunService - Report sink 'console' failed")
                .endsWith(System.lineSeparator());

        LogRecord withError = new LogRecord(Level.SEVERE, "boom");
        withError.setThrown(new IllegalStateException("bad state"));
        assertThat(f.format(withError)).contains("java.lang.IllegalStateException: bad state");
    }

    @Test
    void init_isIdempotent() {
        LogSetup.init();
        int handlers = LogSetup.handlers().length;
        LogSetup.init();

        assertThat(LogSetup.handlers()).hasSize(handlers);
    }
}
