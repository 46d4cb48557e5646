package com.compliancegate.core.report;

import com.compliancegate.core.model.ComplianceReport;
import com.compliancegate.core.model.ControlStatus;
import com.compliancegate.core.model.ControlVerdict;
import com.compliancegate.core.model.PipelineContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Instant;
import java.util.List;

/**
 * 보고서 → JSON (기계 소비용 사이드카).
 * Markdown 과 같은 판정/순서를 담고, 시각은 ISO-8601 문자열.
 */
public final class JsonReportRenderer {

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public String render(ComplianceReport report) throws JsonProcessingException {
        List<Control> controls = report.verdicts().stream()
                .map(JsonReportRenderer::toControl)
                .toList();
        List<String> failing = report.failing().stream().map(v -> v.id().code()).toList();
        Document doc = new Document(report.generatedAt(), report.pipelineContext(), controls,
                report.overallStatus(), failing);
        return om.writeValueAsString(doc);
    }

    private static Control toControl(ControlVerdict v) {
        return new Control(v.id().code(), v.id().title(), v.status(), v.details());
    }

    // 직렬화 전용 DTO
    record Document(Instant generatedAt,
                    PipelineContext pipeline,
                    List<Control> controls,
                    ControlStatus overallStatus,
                    List<String> failingControls) {}

    record Control(String id, String title, ControlStatus status, String details) {}
}
