package com.compliancegate.core.control;

import com.compliancegate.core.model.Artifact;
import com.compliancegate.core.model.ControlId;
import com.compliancegate.core.model.ControlStatus;
import com.compliancegate.core.model.ControlVerdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ComplianceEvaluatorTest {

    private final ComplianceEvaluator evaluator = new ComplianceEvaluator();

    @Test
    void evaluatesFiveEvidenceControls_inFixedOrder() {
        List<ControlVerdict> v = evaluator.evaluate(EvidenceFixtures.allClean().build());

        assertThat(v).extracting(ControlVerdict::id)
                .containsExactly(ControlId.SEC_01, ControlId.SEC_02, ControlId.SEC_03, ControlId.SEC_04, ControlId.SEC_05);
        assertThat(v).allMatch(ControlVerdict::passed);
    }

    @Test
    @DisplayName("증거가 전부 없으면 다섯 컨트롤 모두 FAIL (fail-closed)")
    void allMissing_failsEveryControl() {
        List<ControlVerdict> v = evaluator.evaluate(EvidenceFixtures.allMissing().build());

        assertThat(v).hasSize(5).allMatch(x -> x.status() == ControlStatus.FAIL);
    }

    @Test
    void allInvalid_failsEveryControl() {
        EvidenceFixtures f = EvidenceFixtures.allMissing();
        for (Artifact a : Artifact.values()) f.invalid(a);

        assertThat(evaluator.evaluate(f.build())).allMatch(x -> x.status() == ControlStatus.FAIL);
    }

    @Test
    void throwingRule_becomesFailVerdict_andOthersStillRun() {
        ControlRule broken = new ControlRule() {
            @Override public ControlId id() { return ControlId.SEC_01; }
            @Override public ControlVerdict evaluate(Evidence evidence) { throw new IllegalStateException("boom"); }
        };
        ControlRule nullRule = new ControlRule() {
            @Override public ControlId id() { return ControlId.SEC_02; }
            @Override public ControlVerdict evaluate(Evidence evidence) { return null; }
        };
        ComplianceEvaluator e = new ComplianceEvaluator(List.of(broken, nullRule));

        List<ControlVerdict> v = e.evaluate(EvidenceFixtures.allClean().build());

        assertThat(v).hasSize(2);
        assertThat(v.get(0).status()).isEqualTo(ControlStatus.FAIL);
        assertThat(v.get(0).details()).startsWith("Evaluation error: ").contains("boom");
        assertThat(v.get(1).status()).isEqualTo(ControlStatus.FAIL);
    }
}
