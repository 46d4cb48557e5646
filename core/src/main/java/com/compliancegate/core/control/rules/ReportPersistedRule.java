package com.compliancegate.core.control.rules;

import com.compliancegate.core.model.ControlId;
import com.compliancegate.core.model.ControlVerdict;
import com.compliancegate.core.model.WriteOutcome;

/**
 * SEC-06: 보고서가 실제로 파일에 기록됐는지.
 * 증거가 아니라 쓰기 결과에 의존하므로 {@code ControlRule} 이 아니다.
 */
public final class ReportPersistedRule {

    public ControlId id() { return ControlId.SEC_06; }

    /** 첫 쓰기 전에 파일 본문에 들어가는 가정값 */
    public ControlVerdict tentative() {
        return ControlVerdict.pass(id(), "Compliance report generated");
    }

    public ControlVerdict evaluate(WriteOutcome outcome) {
        if (outcome == null) {
            return ControlVerdict.fail(id(), "Report not yet generated");
        }
        if (outcome.written()) {
            return ControlVerdict.pass(id(), "Report generated at " + outcome.path());
        }
        return ControlVerdict.fail(id(), "Failed to generate report at " + outcome.path());
    }
}
