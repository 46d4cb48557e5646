package com.compliancegate.core.control.rules;

import com.compliancegate.core.control.ControlRule;
import com.compliancegate.core.control.Evidence;
import com.compliancegate.core.model.ArtifactReadResult;
import com.compliancegate.core.model.ControlId;
import com.compliancegate.core.model.ControlVerdict;
import com.compliancegate.core.model.HardeningSummary;

import java.util.List;
import java.util.Optional;

/**
 * SEC-03: Dockle 결과에 상위 3 레벨(FATAL, ERROR, WARN) 발견이 없어야 PASS.
 * 유효 JSON 인데 레벨을 못 읽으면 정보성으로 보고 PASS (제품 검토 대상).
 */
public final class ImageHardeningRule implements ControlRule {

    /** FATL 은 구버전 Dockle 의 FATAL 표기 */
    static final List<String> BLOCKING_LEVELS = List.of("FATAL", "FATL", "ERROR", "WARN");

    @Override
    public ControlId id() { return ControlId.SEC_03; }

    @Override
    public ControlVerdict evaluate(Evidence evidence) {
        ArtifactReadResult r = evidence.hardening();
        Optional<String> issue = ArtifactIssues.describe(r);
        if (issue.isPresent()) return ControlVerdict.fail(id(), issue.get());

        Optional<HardeningSummary> summary = evidence.hardeningSummary();
        if (summary.isEmpty()) {
            return ControlVerdict.pass(id(),
                    r.name() + " present and valid (unable to infer finding levels; treating as informational)");
        }

        HardeningSummary s = summary.get();
        int blocking = BLOCKING_LEVELS.stream().mapToInt(s::count).sum();
        String parts = s.describeNonZero();
        String summaryText = parts.isEmpty() ? "no findings" : parts;

        if (blocking > 0) {
            return ControlVerdict.fail(id(), "Dockle reported hardening issues (" + summaryText + ")");
        }
        return ControlVerdict.pass(id(), "Dockle scan clean (" + summaryText + ")");
    }
}
