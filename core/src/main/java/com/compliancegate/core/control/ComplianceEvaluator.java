package com.compliancegate.core.control;

import com.compliancegate.core.control.rules.ImageHardeningRule;
import com.compliancegate.core.control.rules.InventoryPresentRule;
import com.compliancegate.core.control.rules.NoCriticalVulnerabilitiesRule;
import com.compliancegate.core.control.rules.NoSecretsRule;
import com.compliancegate.core.control.rules.ScanCoverageRule;
import com.compliancegate.core.model.ControlVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 증거 기반 컨트롤(SEC-01..SEC-05)을 고정 순서로 평가한다.
 * SEC-06 은 보고서 쓰기 결과가 필요하므로 오케스트레이터가 따로 붙인다.
 */
public final class ComplianceEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(ComplianceEvaluator.class);

    private final List<ControlRule> rules;

    public ComplianceEvaluator() {
        this(List.of(
                new NoSecretsRule(),
                new ScanCoverageRule(),
                new ImageHardeningRule(),
                new NoCriticalVulnerabilitiesRule(),
                new InventoryPresentRule()));
    }

    /** 테스트/확장용 */
    public ComplianceEvaluator(List<ControlRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    public List<ControlVerdict> evaluate(Evidence evidence) {
        Objects.requireNonNull(evidence, "evidence");
        List<ControlVerdict> out = new ArrayList<>(rules.size());
        for (ControlRule rule : rules) {
            out.add(evaluateOne(rule, evidence));
        }
        return List.copyOf(out);
    }

    private static ControlVerdict evaluateOne(ControlRule rule, Evidence evidence) {
        try {
            ControlVerdict v = rule.evaluate(evidence);
            if (v == null) {
                return ControlVerdict.fail(rule.id(), "Evaluation error: rule returned no verdict");
            }
            LOG.debug("{} -> {}", rule.id().code(), v.status());
            return v;
        } catch (RuntimeException e) {
            // 규칙 결함도 판정 불가 → FAIL
            LOG.error("Control {} evaluation failed", rule.id().code(), e);
            return ControlVerdict.fail(rule.id(), "Evaluation error: " + e);
        }
    }
}
