package com.compliancegate.core.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * 실행 설정 (compliance-gate.yml 매핑 대상). 순수 설정 보관용.
 * 환경 변수 오버라이드는 {@link GateConfigLoader} 가 적용한다.
 */
public final class GateConfig {

    public static final String DEFAULT_REPORT_FILE = "compliance-report.md";
    public static final String DEFAULT_JSON_FILE = "compliance-report.json";

    /** YAML `output:` 섹션 */
    public static final class Output {
        private String reportFile = DEFAULT_REPORT_FILE;
        private String jsonFile = DEFAULT_JSON_FILE;
        /** Markdown 외에 JSON 사이드카도 쓸지 (기본 false) */
        private boolean alsoJson = false;
        /** GITHUB_STEP_SUMMARY 가 있으면 거기에도 덧붙일지 (기본 true) */
        private boolean stepSummary = true;

        public String getReportFile() { return reportFile; }
        public Output setReportFile(String v) { this.reportFile = v; return this; }

        public String getJsonFile() { return jsonFile; }
        public Output setJsonFile(String v) { this.jsonFile = v; return this; }

        public boolean isAlsoJson() { return alsoJson; }
        public Output setAlsoJson(boolean v) { this.alsoJson = v; return this; }

        public boolean isStepSummary() { return stepSummary; }
        public Output setStepSummary(boolean v) { this.stepSummary = v; return this; }
    }

    private Path artifactDir = Path.of("artifacts");
    private int readConcurrency = 5;   // 산출물 5개를 한 번에
    private final Output output = new Output();

    // ---------- getters ----------
    public Path getArtifactDir() { return artifactDir; }
    public int getReadConcurrency() { return readConcurrency; }
    public Output output() { return output; }

    public Path reportPath() { return artifactDir.resolve(output.getReportFile()); }
    public Path jsonReportPath() { return artifactDir.resolve(output.getJsonFile()); }

    // ---------- fluent setters ----------
    public GateConfig setArtifactDir(Path artifactDir) { this.artifactDir = artifactDir; return this; }
    public GateConfig setReadConcurrency(int v) { this.readConcurrency = v; return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(artifactDir, "artifactDir");
        if (readConcurrency < 1) throw new IllegalArgumentException("readConcurrency must be >= 1");
        requireFileName(output.getReportFile(), "output.reportFile");
        requireFileName(output.getJsonFile(), "output.jsonFile");
        if (output.getReportFile().equals(output.getJsonFile())) {
            throw new IllegalArgumentException("output.jsonFile must differ from output.reportFile");
        }
    }

    private static void requireFileName(String name, String key) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException(key + " must not be blank");
        if (name.contains("/") || name.contains("\\")) {
            throw new IllegalArgumentException(key + " must be a plain file name: " + name);
        }
    }

    public static GateConfig defaults() { return new GateConfig(); }
}
