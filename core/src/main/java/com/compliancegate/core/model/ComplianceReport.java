package com.compliancegate.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * 한 번의 실행 결과 보고서.
 * overallStatus 는 저장하지 않고 호출할 때마다 verdicts 에서 다시 계산한다.
 */
public record ComplianceReport(Instant generatedAt, PipelineContext pipelineContext, List<ControlVerdict> verdicts) {

    public ComplianceReport {
        Objects.requireNonNull(generatedAt, "generatedAt");
        Objects.requireNonNull(pipelineContext, "pipelineContext");
        verdicts = List.copyOf(Objects.requireNonNull(verdicts, "verdicts"));
    }

    public ControlStatus overallStatus() {
        return overallStatus(verdicts);
    }

    public List<ControlVerdict> failing() {
        return verdicts.stream().filter(v -> !v.passed()).toList();
    }

    public static ControlStatus overallStatus(List<ControlVerdict> verdicts) {
        return verdicts.stream().allMatch(ControlVerdict::passed) ? ControlStatus.PASS : ControlStatus.FAIL;
    }
}
