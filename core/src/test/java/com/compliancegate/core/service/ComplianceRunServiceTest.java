package com.compliancegate.core.service;

import com.compliancegate.core.config.GateConfig;
import com.compliancegate.core.control.ComplianceEvaluator;
import com.compliancegate.core.model.ControlId;
import com.compliancegate.core.model.ControlStatus;
import com.compliancegate.core.model.ControlVerdict;
import com.compliancegate.core.model.PipelineContext;
import com.compliancegate.core.model.WriteOutcome;
import com.compliancegate.core.report.ReportSink;
import com.compliancegate.core.report.ReportWriter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ComplianceRunServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T21:34:00Z"), ZoneOffset.UTC);
    private static final String CLEAN_TRIVY = "{\"Results\":[{\"Target\":\"app\",\"Vulnerabilities\":[]}]}";

    @TempDir Path tmp;

    /** 받은 본문을 그대로 모아두는 sink */
    static final class CapturingSink implements ReportSink {
        final List<String> documents = new ArrayList<>();

        @Override public String name() { return "capture"; }
        @Override public void emit(String document) { documents.add(document); }
    }

    /** 첫 기록은 실제로 하고, 그 다음 기록부터는 실패를 돌려주는 writer */
    static final class FirstWriteOnlyWriter extends ReportWriter {
        int calls;

        @Override
        public WriteOutcome write(Path target, String content) {
            calls++;
            return calls == 1 ? super.write(target, content) : WriteOutcome.failure(target, "disk full");
        }
    }

    private final CapturingSink sink = new CapturingSink();

    private RunResult run(GateConfig cfg) throws InterruptedException {
        return new ComplianceRunService(cfg, CLOCK, PipelineContext.unavailable(), List.of(sink)).run();
    }

    private GateConfig configFor(Path dir) {
        return GateConfig.defaults().setArtifactDir(dir);
    }

    private void writeAllClean(Path dir) throws IOException {
        Files.createDirectories(dir);
        Files.writeString(dir.resolve("gitleaks.json"), "[]");
        Files.writeString(dir.resolve("trivy-fs.json"), CLEAN_TRIVY);
        Files.writeString(dir.resolve("trivy-image.json"), CLEAN_TRIVY);
        Files.writeString(dir.resolve("dockle.json"), "{\"details\":[]}");
        Files.writeString(dir.resolve("sbom.json"), "{\"bomFormat\":\"CycloneDX\"}");
    }

    private static ControlVerdict verdict(RunResult r, ControlId id) {
        return r.report().verdicts().stream().filter(v -> v.id() == id).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("산출물이 하나도 없으면: 디렉터리 생성, SEC-01..05 FAIL, SEC-06 PASS, exit 1")
    void noArtifacts_failsClosed() throws Exception {
        Path dir = tmp.resolve("artifacts");

        RunResult r = run(configFor(dir));

        assertThat(dir).isDirectory();
        assertThat(r.exitCode()).isEqualTo(RunResult.EXIT_FAILED);
        assertThat(r.reportWritten()).isTrue();
        assertThat(r.report().verdicts()).extracting(ControlVerdict::status).containsExactly(
                ControlStatus.FAIL, ControlStatus.FAIL, ControlStatus.FAIL,
                ControlStatus.FAIL, ControlStatus.FAIL, ControlStatus.PASS);
        assertThat(verdict(r, ControlId.SEC_01).details()).isEqualTo("gitleaks.json not found");
        assertThat(r.document()).contains("**FAIL**", "### Failing Controls");
    }

    @Test
    void allClean_passes_andFileMatchesSinkDocument() throws Exception {
        Path dir = tmp.resolve("artifacts");
        writeAllClean(dir);

        RunResult r = run(configFor(dir));

        assertThat(r.exitCode()).isEqualTo(RunResult.EXIT_OK);
        assertThat(r.succeeded()).isTrue();
        assertThat(r.report().overallStatus()).isEqualTo(ControlStatus.PASS);
        assertThat(verdict(r, ControlId.SEC_06).details())
                .isEqualTo("Report generated at " + dir.resolve("compliance-report.md"));

        String onDisk = Files.readString(dir.resolve("compliance-report.md"), StandardCharsets.UTF_8);
        assertThat(onDisk).isEqualTo(r.document());
        assertThat(sink.documents).containsExactly(r.document());
        assertThat(onDisk).contains("Generated at: `2025-03-01T21:34:00.000Z`", "**PASS**")
                .doesNotContain("Failing Controls");
    }

    @Test
    void criticalVulnerability_failsOnlySec04() throws Exception {
        Path dir = tmp.resolve("artifacts");
        writeAllClean(dir);
        Files.writeString(dir.resolve("trivy-image.json"),
                "{\"Results\":[{\"Vulnerabilities\":[{\"Severity\":\"CRITICAL\"},{\"Severity\":\"HIGH\"}]}]}");

        RunResult r = run(configFor(dir));

        assertThat(r.exitCode()).isEqualTo(RunResult.EXIT_FAILED);
        assertThat(r.report().failing()).extracting(ControlVerdict::id).containsExactly(ControlId.SEC_04);
        assertThat(verdict(r, ControlId.SEC_02).status()).isEqualTo(ControlStatus.PASS);
        assertThat(r.document()).contains("- SEC-04: CRITICAL vulnerabilities detected.");
    }

    @Test
    void secretsFoundAndInvalidSbom_failTheirControls() throws Exception {
        Path dir = tmp.resolve("artifacts");
        writeAllClean(dir);
        Files.writeString(dir.resolve("gitleaks.json"), "[{\"RuleID\":\"aws-key\"},{\"RuleID\":\"github-pat\"}]");
        Files.writeString(dir.resolve("sbom.json"), "{not json");

        RunResult r = run(configFor(dir));

        assertThat(r.report().failing()).extracting(ControlVerdict::id)
                .containsExactly(ControlId.SEC_01, ControlId.SEC_05);
        assertThat(verdict(r, ControlId.SEC_01).details()).isEqualTo("Gitleaks detected 2 potential secret(s)");
        assertThat(verdict(r, ControlId.SEC_05).details()).startsWith("sbom.json is not valid JSON (Invalid JSON: ");
    }

    @Test
    @DisplayName("보고서 쓰기 실패: SEC-06 FAIL, exit 1, 최종 본문은 sink 로 나간다")
    void reportWriteFailure_failsSec06_andSinksGetFinalDocument() throws Exception {
        Path dir = tmp.resolve("artifacts");
        writeAllClean(dir);
        // 같은 이름의 비어있지 않은 디렉터리가 자리를 막는다
        Files.createDirectories(dir.resolve("compliance-report.md").resolve("blocker"));

        RunResult r = run(configFor(dir));

        assertThat(r.reportWritten()).isFalse();
        assertThat(r.exitCode()).isEqualTo(RunResult.EXIT_FAILED);
        ControlVerdict sec06 = verdict(r, ControlId.SEC_06);
        assertThat(sec06.status()).isEqualTo(ControlStatus.FAIL);
        assertThat(sec06.details()).isEqualTo("Failed to generate report at " + dir.resolve("compliance-report.md"));
        assertThat(sink.documents).containsExactly(r.document());
        assertThat(r.document()).contains("| SEC-06 | FAIL |", "- SEC-06: Failed to generate report at");
    }

    @Test
    void alsoJson_writesSidecarWithSameVerdicts() throws Exception {
        Path dir = tmp.resolve("artifacts");
        writeAllClean(dir);
        GateConfig cfg = configFor(dir);
        cfg.output().setAlsoJson(true);

        RunResult r = run(cfg);

        JsonNode json = new ObjectMapper().readTree(dir.resolve("compliance-report.json").toFile());
        assertThat(json.path("overallStatus").asText()).isEqualTo("PASS");
        assertThat(json.path("controls")).hasSize(6);
        assertThat(json.path("controls").get(5).path("details").asText())
                .isEqualTo(verdict(r, ControlId.SEC_06).details());
    }

    @Test
    void failingSink_doesNotChangeOutcome() throws Exception {
        Path dir = tmp.resolve("artifacts");
        writeAllClean(dir);
        ReportSink broken = new ReportSink() {
            @Override public String name() { return "broken"; }
            @Override public void emit(String document) throws IOException { throw new IOException("closed"); }
        };

        RunResult r = new ComplianceRunService(configFor(dir), CLOCK, PipelineContext.unavailable(),
                List.of(broken, sink)).run();

        assertThat(r.exitCode()).isEqualTo(RunResult.EXIT_OK);
        assertThat(sink.documents).hasSize(1);
    }

    @Test
    void singleReaderThread_stillReadsEverything() throws Exception {
        Path dir = tmp.resolve("artifacts");
        writeAllClean(dir);

        RunResult r = run(configFor(dir).setReadConcurrency(1));

        assertThat(r.exitCode()).isEqualTo(RunResult.EXIT_OK);
    }

    @Test
    @DisplayName("최종 본문 덮어쓰기 실패: 첫 본문이 남고 기록은 성공으로 본다")
    void rewriteFailure_keepsInitialFile_andStillCountsAsWritten() throws Exception {
        Path dir = tmp.resolve("artifacts");
        writeAllClean(dir);
        FirstWriteOnlyWriter writer = new FirstWriteOnlyWriter();

        RunResult r = new ComplianceRunService(configFor(dir), CLOCK, PipelineContext.unavailable(),
                List.of(sink), new ComplianceEvaluator(), writer).run();

        assertThat(writer.calls).isEqualTo(2);
        assertThat(r.reportWritten()).isTrue();
        assertThat(r.exitCode()).isEqualTo(RunResult.EXIT_OK);
        ControlVerdict sec06 = verdict(r, ControlId.SEC_06);
        assertThat(sec06.status()).isEqualTo(ControlStatus.PASS);
        assertThat(sec06.details()).isEqualTo("Report generated at " + dir.resolve("compliance-report.md"));

        String onDisk = Files.readString(dir.resolve("compliance-report.md"), StandardCharsets.UTF_8);
        assertThat(onDisk).contains("| SEC-06 | PASS | Compliance report generated |")
                .isNotEqualTo(r.document());
        assertThat(sink.documents).containsExactly(r.document());
        assertThat(r.document()).contains("| SEC-06 | PASS | Report generated at ");
    }
}
