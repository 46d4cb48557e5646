package com.compliancegate.core.report;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** CI step summary 파일(GITHUB_STEP_SUMMARY)에 보고서를 덧붙인다. */
public final class StepSummarySink implements ReportSink {

    public static final String ENV_KEY = "GITHUB_STEP_SUMMARY";

    private final Path file;

    public StepSummarySink(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    /** 환경 변수가 없거나 비어 있으면 empty */
    public static Optional<StepSummarySink> fromEnvironment(Map<String, String> env) {
        String v = env.get(ENV_KEY);
        if (v == null || v.isBlank()) return Optional.empty();
        return Optional.of(new StepSummarySink(Path.of(v.trim())));
    }

    public Path file() { return file; }

    @Override
    public String name() { return "step-summary"; }

    @Override
    public void emit(String document) throws IOException {
        String body = document.endsWith("\n") ? document : document + "\n";
        Files.writeString(file, body, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }
}
