package com.compliancegate.core.control.rules;

import com.compliancegate.core.control.ControlRule;
import com.compliancegate.core.control.Evidence;
import com.compliancegate.core.model.ControlId;
import com.compliancegate.core.model.ControlVerdict;

import java.util.ArrayList;
import java.util.List;

/**
 * SEC-02: Trivy FS / image 결과가 둘 다 있고 유효한 JSON 이면 PASS.
 * 내용(건수)은 판정에 쓰지 않고 details 에만 싣는다.
 */
public final class ScanCoverageRule implements ControlRule {

    @Override
    public ControlId id() { return ControlId.SEC_02; }

    @Override
    public ControlVerdict evaluate(Evidence evidence) {
        List<String> issues = new ArrayList<>(2);
        ArtifactIssues.describe(evidence.vulnFs()).ifPresent(issues::add);
        ArtifactIssues.describe(evidence.vulnImage()).ifPresent(issues::add);
        if (!issues.isEmpty()) {
            return ControlVerdict.fail(id(), String.join("; ", issues));
        }

        String fsText = evidence.fsSummary()
                .map(s -> s.describe("FS"))
                .orElse("Trivy FS: summary unavailable (unexpected JSON structure)");
        String imageText = evidence.imageSummary()
                .map(s -> s.describe("Image"))
                .orElse("Trivy image: summary unavailable (unexpected JSON structure)");

        return ControlVerdict.pass(id(),
                evidence.vulnFs().name() + " and " + evidence.vulnImage().name()
                        + " present and valid. " + fsText + "; " + imageText);
    }
}
