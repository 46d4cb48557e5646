package com.compliancegate.core.control.rules;

import com.compliancegate.core.control.ControlRule;
import com.compliancegate.core.control.Evidence;
import com.compliancegate.core.model.ControlId;
import com.compliancegate.core.model.ControlVerdict;
import com.compliancegate.core.model.Severity;
import com.compliancegate.core.model.VulnerabilitySummary;

import java.util.ArrayList;
import java.util.List;

/** SEC-04: 두 Trivy 결과 모두 요약 가능하고 CRITICAL 합계가 0 이어야 PASS */
public final class NoCriticalVulnerabilitiesRule implements ControlRule {

    @Override
    public ControlId id() { return ControlId.SEC_04; }

    @Override
    public ControlVerdict evaluate(Evidence evidence) {
        List<String> problems = new ArrayList<>(2);
        if (!evidence.vulnFs().usable()) problems.add("Trivy FS scan missing or invalid");
        if (!evidence.vulnImage().usable()) problems.add("Trivy image scan missing or invalid");
        if (!problems.isEmpty()) {
            return ControlVerdict.fail(id(), String.join("; ", problems));
        }

        if (evidence.fsSummary().isEmpty() || evidence.imageSummary().isEmpty()) {
            return ControlVerdict.fail(id(), "Unable to interpret Trivy JSON structure to count vulnerabilities");
        }

        VulnerabilitySummary fs = evidence.fsSummary().get();
        VulnerabilitySummary img = evidence.imageSummary().get();
        int critical = fs.count(Severity.CRITICAL) + img.count(Severity.CRITICAL);
        String counts = fs.describe("FS") + "; " + img.describe("Image");

        if (critical > 0) {
            return ControlVerdict.fail(id(), "CRITICAL vulnerabilities detected. " + counts);
        }
        return ControlVerdict.pass(id(), "No CRITICAL vulnerabilities in Trivy scans. " + counts);
    }
}
