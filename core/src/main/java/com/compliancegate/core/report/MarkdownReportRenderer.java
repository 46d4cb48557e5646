package com.compliancegate.core.report;

import com.compliancegate.core.model.ComplianceReport;
import com.compliancegate.core.model.ControlVerdict;
import com.compliancegate.core.model.PipelineContext;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * 보고서 → Markdown. 순수 함수: 같은 입력이면 바이트 단위로 같은 출력.
 * 줄 구분은 플랫폼과 무관하게 '\n'.
 */
public final class MarkdownReportRenderer {

    /** 밀리초까지 고정된 UTC ISO-8601 (예: 2025-03-01T21:34:00.000Z) */
    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    public String render(ComplianceReport report) {
        List<String> lines = new ArrayList<>(40);
        PipelineContext ctx = report.pipelineContext();

        lines.add("# Compliance Report");
        lines.add("");
        lines.add("Generated at: `" + timestamp(report.generatedAt()) + "`");
        lines.add("");

        lines.add("## Pipeline Context");
        lines.add("");
        lines.add("- Commit: `" + ctx.commit() + "`");
        lines.add("- Ref: `" + ctx.ref() + "`");
        lines.add("- Repository: `" + ctx.repository() + "`");
        lines.add("- Run URL: " + ctx.runUrl());
        lines.add("");

        lines.add("## Control Summary");
        lines.add("");
        lines.add("| Control | Status | Details |");
        lines.add("|---------|--------|---------|");
        for (ControlVerdict v : report.verdicts()) {
            lines.add("| " + v.id().code() + " | " + v.status() + " | " + escapeCell(v.details()) + " |");
        }

        lines.add("");
        lines.add("## Overall Status");
        lines.add("");
        lines.add("**" + report.overallStatus() + "**");
        lines.add("");

        List<ControlVerdict> failing = report.failing();
        if (!failing.isEmpty()) {
            lines.add("### Failing Controls");
            lines.add("");
            for (ControlVerdict v : failing) {
                lines.add("- " + v.id().code() + ": " + singleLine(v.details()));
            }
            lines.add("");
        }

        return String.join("\n", lines);
    }

    public static String timestamp(Instant t) {
        return TS_FMT.format(t);
    }

    /** 표 셀: '|' 는 '\|' 로, 줄바꿈은 공백으로 (행이 깨지지 않게) */
    static String escapeCell(String text) {
        if (text == null) return "";
        return singleLine(text).replace("|", "\\|");
    }

    private static String singleLine(String text) {
        return text.replace("\r\n", " ").replace('\r', ' ').replace('\n', ' ');
    }
}
