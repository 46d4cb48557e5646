package com.compliancegate.core.model;

import java.util.Objects;

/** 컨트롤 1개의 판정. details 는 원본 산출물을 다시 열지 않고도 원인을 알 수 있는 한 줄 요약. */
public record ControlVerdict(ControlId id, ControlStatus status, String details) {

    public ControlVerdict {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
        details = (details == null ? "" : details);
    }

    public static ControlVerdict pass(ControlId id, String details) {
        return new ControlVerdict(id, ControlStatus.PASS, details);
    }

    public static ControlVerdict fail(ControlId id, String details) {
        return new ControlVerdict(id, ControlStatus.FAIL, details);
    }

    public boolean passed() { return status == ControlStatus.PASS; }
}
