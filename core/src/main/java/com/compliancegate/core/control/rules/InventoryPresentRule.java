package com.compliancegate.core.control.rules;

import com.compliancegate.core.control.ControlRule;
import com.compliancegate.core.control.Evidence;
import com.compliancegate.core.model.ControlId;
import com.compliancegate.core.model.ControlVerdict;

/** SEC-05: SBOM 파일 존재 + 유효 JSON (내용은 보지 않음) */
public final class InventoryPresentRule implements ControlRule {

    @Override
    public ControlId id() { return ControlId.SEC_05; }

    @Override
    public ControlVerdict evaluate(Evidence evidence) {
        return ArtifactIssues.describe(evidence.sbom())
                .map(issue -> ControlVerdict.fail(id(), issue))
                .orElseGet(() -> ControlVerdict.pass(id(), evidence.sbom().name() + " present and valid (SBOM generated)"));
    }
}
