package com.compliancegate.core.model;

/** 고정 컨트롤 6종. 선언 순서 = 평가 순서 = 보고서 순서. */
public enum ControlId {
    SEC_01("SEC-01", "No secrets committed"),
    SEC_02("SEC-02", "Vulnerability scan coverage"),
    SEC_03("SEC-03", "Image hardening"),
    SEC_04("SEC-04", "No critical vulnerabilities"),
    SEC_05("SEC-05", "Software inventory present"),
    SEC_06("SEC-06", "Compliance report persisted");

    private final String code;
    private final String title;

    ControlId(String code, String title) {
        this.code = code;
        this.title = title;
    }

    public String code() { return code; }
    public String title() { return title; }
}
