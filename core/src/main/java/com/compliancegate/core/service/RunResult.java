package com.compliancegate.core.service;

import com.compliancegate.core.model.ComplianceReport;

import java.util.Objects;

/**
 * 한 번의 실행 결과.
 * document 는 실제 쓰기 결과(SEC-06)가 반영된 최종 본문이며 모든 sink 에 나간 것과 같다.
 */
public record RunResult(ComplianceReport report, String document, boolean reportWritten, int exitCode) {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;

    public RunResult {
        Objects.requireNonNull(report, "report");
        Objects.requireNonNull(document, "document");
    }

    public boolean succeeded() { return exitCode == EXIT_OK; }
}
