package com.compliancegate.core.service;

import com.compliancegate.core.config.GateConfig;
import com.compliancegate.core.control.ComplianceEvaluator;
import com.compliancegate.core.control.Evidence;
import com.compliancegate.core.control.rules.ReportPersistedRule;
import com.compliancegate.core.io.ArtifactReader;
import com.compliancegate.core.model.Artifact;
import com.compliancegate.core.model.ArtifactReadResult;
import com.compliancegate.core.model.ComplianceReport;
import com.compliancegate.core.model.ControlStatus;
import com.compliancegate.core.model.ControlVerdict;
import com.compliancegate.core.model.PipelineContext;
import com.compliancegate.core.model.WriteOutcome;
import com.compliancegate.core.report.JsonReportRenderer;
import com.compliancegate.core.report.MarkdownReportRenderer;
import com.compliancegate.core.report.ReportSink;
import com.compliancegate.core.report.ReportWriter;
import com.compliancegate.core.util.NamedThreadFactory;
import com.compliancegate.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * 실행 오케스트레이터:
 *  - 디렉터리 보장 → 산출물 5개 병렬 읽기(배리어) → 요약/평가 → 렌더/기록 → sink 출력 → 종료코드
 *  - SEC-06 은 가정값(PASS)으로 먼저 기록한 뒤, 실제 쓰기 결과로 최종 본문을 다시 렌더한다.
 *    첫 기록이 성공했으면 최종 본문으로 덮어쓰고, 실패했으면 최종 본문은 sink 로만 나간다.
 *  - 종료코드 0 = 보고서 기록 성공 AND 전체 PASS
 */
public final class ComplianceRunService {

    private static final Logger LOG = LoggerFactory.getLogger(ComplianceRunService.class);
    private static final StructuredLog SLOG = StructuredLog.get(ComplianceRunService.class);

    private final GateConfig config;
    private final Clock clock;
    private final PipelineContext pipelineContext;
    private final List<ReportSink> sinks;

    private final ArtifactReader reader;
    private final ComplianceEvaluator evaluator;
    private final ReportPersistedRule persistedRule = new ReportPersistedRule();
    private final MarkdownReportRenderer markdown = new MarkdownReportRenderer();
    private final JsonReportRenderer json = new JsonReportRenderer();
    private final ReportWriter writer;

    public ComplianceRunService(GateConfig config, Clock clock, PipelineContext pipelineContext, List<ReportSink> sinks) {
        this(config, clock, pipelineContext, sinks, new ComplianceEvaluator(), new ReportWriter());
    }

    /** DI/테스트용 */
    public ComplianceRunService(GateConfig config,
                                Clock clock,
                                PipelineContext pipelineContext,
                                List<ReportSink> sinks,
                                ComplianceEvaluator evaluator,
                                ReportWriter writer) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.pipelineContext = Objects.requireNonNull(pipelineContext, "pipelineContext");
        this.sinks = List.copyOf(Objects.requireNonNull(sinks, "sinks"));
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.reader = new ArtifactReader(config.getArtifactDir());
    }

    public RunResult run() throws InterruptedException {
        Path dir = config.getArtifactDir();
        Instant generatedAt = clock.instant();
        LOG.info("Compliance evaluation start: artifactDir={}", dir.toAbsolutePath());
        SLOG.info("run-start", "artifactDir", dir.toAbsolutePath(), "generatedAt", generatedAt);

        ensureDir(dir);

        // ---- 1) 읽기 (모두 끝나야 평가 시작) ----
        Map<Artifact, ArtifactReadResult> reads = readAll();

        // ---- 2) 요약 + 평가 ----
        Evidence evidence = Evidence.collect(reads);
        List<ControlVerdict> verdicts = evaluator.evaluate(evidence);

        // ---- 3) 가정값 SEC-06 으로 렌더 후 기록 ----
        Path reportPath = config.reportPath();
        ComplianceReport tentative = report(generatedAt, verdicts, persistedRule.tentative());
        WriteOutcome outcome = writer.write(reportPath, markdown.render(tentative));

        // ---- 4) 실제 결과로 최종 렌더 ----
        ComplianceReport finalReport = report(generatedAt, verdicts, persistedRule.evaluate(outcome));
        String document = markdown.render(finalReport);
        if (outcome.written()) {
            WriteOutcome rewrite = writer.write(reportPath, document);
            if (!rewrite.written()) {
                // 첫 본문은 이미 남아 있으므로 기록 자체는 성공으로 본다
                LOG.warn("Final report could not replace the initial one at {}; file keeps the initial rendering", reportPath);
            }
        }
        SLOG.info("report-write", "path", reportPath.toAbsolutePath(), "written", outcome.written(),
                "error", outcome.errorOpt().orElse(null));

        if (config.output().isAlsoJson()) {
            writeJsonSidecar(finalReport);
        }

        // ---- 5) 보조 채널 ----
        for (ReportSink sink : sinks) {
            emit(sink, document);
        }

        // ---- 6) 종료코드 ----
        ControlStatus overall = finalReport.overallStatus();
        int exitCode = (outcome.written() && overall == ControlStatus.PASS) ? RunResult.EXIT_OK : RunResult.EXIT_FAILED;

        LOG.info("Compliance evaluation done. overall={}, failing={}, reportWritten={}, exitCode={}",
                overall, finalReport.failing().size(), outcome.written(), exitCode);
        SLOG.info("run-done", "overall", overall, "failing", finalReport.failing().size(),
                "reportWritten", outcome.written(), "exitCode", exitCode);

        return new RunResult(finalReport, document, outcome.written(), exitCode);
    }

    /* =========================
       단계별 헬퍼
       ========================= */

    private ComplianceReport report(Instant generatedAt, List<ControlVerdict> evidenceVerdicts, ControlVerdict sec06) {
        List<ControlVerdict> all = new ArrayList<>(evidenceVerdicts.size() + 1);
        all.addAll(evidenceVerdicts);
        all.add(sec06);
        return new ComplianceReport(generatedAt, pipelineContext, all);
    }

    /** best-effort: 실패해도 로그만 남기고 진행 (읽기/쓰기 단계에서 FAIL 로 드러난다) */
    private static void ensureDir(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to ensure directory {}: {}", dir, e.toString());
        }
    }

    private Map<Artifact, ArtifactReadResult> readAll() throws InterruptedException {
        Artifact[] artifacts = Artifact.values();
        int threads = Math.min(config.getReadConcurrency(), artifacts.length);
        ExecutorService exec = Executors.newFixedThreadPool(threads, new NamedThreadFactory("artifact-reader"));

        Map<Artifact, Future<ArtifactReadResult>> futures = new EnumMap<>(Artifact.class);
        try {
            for (Artifact a : artifacts) {
                futures.put(a, exec.submit(() -> reader.read(a)));
            }

            Map<Artifact, ArtifactReadResult> out = new EnumMap<>(Artifact.class);
            for (Artifact a : artifacts) {
                ArtifactReadResult r = await(a, futures.get(a));
                out.put(a, r);
                SLOG.info("artifact-read", "name", r.name(), "found", r.found(), "parsed", r.parsed());
            }
            return out;
        } finally {
            exec.shutdownNow();
            exec.awaitTermination(10, TimeUnit.SECONDS);
        }
    }

    private ArtifactReadResult await(Artifact a, Future<ArtifactReadResult> f) throws InterruptedException {
        try {
            return f.get();
        } catch (ExecutionException e) {
            // reader 는 예외를 내지 않지만, 결함이 있어도 해당 산출물만 "읽기 실패" 로 처리
            Throwable cause = (e.getCause() != null ? e.getCause() : e);
            LOG.warn("Artifact read task failed: {} ({})", a.fileName(), cause.toString());
            SLOG.error("artifact-read-failed", cause, "name", a.fileName());
            Path path = config.getArtifactDir().resolve(a.fileName());
            return ArtifactReadResult.unreadable(a.fileName(), path, cause.toString());
        }
    }

    private void writeJsonSidecar(ComplianceReport report) {
        Path path = config.jsonReportPath();
        try {
            WriteOutcome o = writer.write(path, json.render(report));
            if (!o.written()) LOG.warn("JSON report not written: {}", path);
        } catch (IOException e) {
            LOG.warn("JSON report rendering failed: {}", e.toString());
        }
    }

    private static void emit(ReportSink sink, String document) {
        try {
            sink.emit(document);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Report sink '{}' failed: {}", sink.name(), e.toString());
        }
    }
}
