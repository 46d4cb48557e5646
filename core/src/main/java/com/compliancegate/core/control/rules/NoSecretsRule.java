package com.compliancegate.core.control.rules;

import com.compliancegate.core.control.ControlRule;
import com.compliancegate.core.control.Evidence;
import com.compliancegate.core.model.ArtifactReadResult;
import com.compliancegate.core.model.ControlId;
import com.compliancegate.core.model.ControlVerdict;
import com.compliancegate.core.summary.SecretCount;

import java.util.Optional;

/** SEC-01: Gitleaks 결과가 있고, 건수를 확정할 수 있고, 0 건이어야 PASS */
public final class NoSecretsRule implements ControlRule {

    @Override
    public ControlId id() { return ControlId.SEC_01; }

    @Override
    public ControlVerdict evaluate(Evidence evidence) {
        ArtifactReadResult r = evidence.secrets();
        Optional<String> issue = ArtifactIssues.describe(r);
        if (issue.isPresent()) return ControlVerdict.fail(id(), issue.get());

        SecretCount sc = evidence.secretCount().orElseGet(SecretCount::unknownStructure);
        if (!sc.determined()) {
            return ControlVerdict.fail(id(),
                    "Unable to determine findings in " + r.name() + ": " + sc.errorOpt().orElse(SecretCount.UNKNOWN_STRUCTURE));
        }

        long count = sc.count();
        if (count > 0) {
            return ControlVerdict.fail(id(), "Gitleaks detected " + count + " potential secret(s)");
        }
        return ControlVerdict.pass(id(), "No secrets detected by Gitleaks (0 findings)");
    }
}
