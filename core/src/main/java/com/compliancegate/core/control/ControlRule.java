package com.compliancegate.core.control;

import com.compliancegate.core.model.ControlId;
import com.compliancegate.core.model.ControlVerdict;

/**
 * 컨트롤 규칙 최소 계약: 증거를 받아 판정 1개를 돌려주는 순수 함수.
 * 증거가 없거나 모호하면 FAIL (fail-closed).
 */
public interface ControlRule {
    ControlId id();

    ControlVerdict evaluate(Evidence evidence);
}
