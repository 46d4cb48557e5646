package com.compliancegate.app;

import com.compliancegate.app.logging.LogSetup;
import com.compliancegate.core.config.GateConfig;
import com.compliancegate.core.config.GateConfigLoader;
import com.compliancegate.core.model.PipelineContext;
import com.compliancegate.core.report.ConsoleReportSink;
import com.compliancegate.core.report.ReportSink;
import com.compliancegate.core.report.StepSummarySink;
import com.compliancegate.core.service.ComplianceRunService;
import com.compliancegate.core.service.RunResult;

import java.io.PrintStream;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * CLI 진입점. 종료코드가 파이프라인 게이트의 유일한 신호:
 * 0 = 보고서 기록 + 모든 컨트롤 PASS, 1 = 그 외 (예상치 못한 오류 포함).
 */
public final class ComplianceGateMain {
    private static final Logger LOG = Logger.getLogger(ComplianceGateMain.class.getName());

    private ComplianceGateMain() {}

    public static void main(String[] args) {
        if (Arrays.asList(args).contains("--help") || Arrays.asList(args).contains("-h")) {
            printUsage(System.out);
            return;
        }

        LogSetup.init();
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.log(Level.SEVERE, "\n==== Uncaught: " + t.getName() + " ====", e));

        int code = execute(System.getenv(), System.out, Clock.systemUTC());
        System.exit(code);
    }

    /** main 의 본체 (System.exit 없음) */
    static int execute(Map<String, String> env, PrintStream out, Clock clock) {
        try {
            GateConfig cfg = GateConfigLoader.load(GateConfigLoader.locate(env), env);
            PipelineContext ctx = PipelineContext.fromEnvironment(env);

            List<ReportSink> sinks = new ArrayList<>(2);
            sinks.add(new ConsoleReportSink(out));
            if (cfg.output().isStepSummary()) {
                StepSummarySink.fromEnvironment(env).ifPresent(sinks::add);
            }

            RunResult result = new ComplianceRunService(cfg, clock, ctx, sinks).run();
            return result.exitCode();

        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOG.log(Level.SEVERE, "Compliance evaluation interrupted", ie);
            return RunResult.EXIT_FAILED;
        } catch (Exception e) {
            // 설정 오류, 결함 등: 조용한 성공은 없다
            LOG.log(Level.SEVERE, "Unexpected error in compliance gate", e);
            return RunResult.EXIT_FAILED;
        }
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: compliance-gate");
        out.println();
        out.println("Evaluates scanner artifacts and writes compliance-report.md.");
        out.println("Environment:");
        out.println("  ARTIFACT_DIR              artifact directory (default ./artifacts)");
        out.println("  COMPLIANCE_GATE_CONFIG    YAML config path (default ./compliance-gate.yml)");
        out.println("  GITHUB_SHA, GITHUB_REF, GITHUB_REPOSITORY, GITHUB_RUN_ID, GITHUB_SERVER_URL");
        out.println("  GITHUB_STEP_SUMMARY       also append the report to this file");
        out.println("Exit status: 0 when the report is written and every control passes, 1 otherwise.");
    }
}
