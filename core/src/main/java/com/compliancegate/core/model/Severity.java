package com.compliancegate.core.model;

import java.util.Locale;

/** 취약점 심각도 (보고서 출력 순서 그대로) */
public enum Severity {
    CRITICAL, HIGH, MEDIUM, LOW, UNKNOWN;

    /** 대소문자 무시. null/빈값/모르는 라벨은 UNKNOWN 으로 접는다. */
    public static Severity fromLabel(String label) {
        if (label == null || label.isBlank()) return UNKNOWN;
        String s = label.toUpperCase(Locale.ROOT);
        for (Severity v : values()) {
            if (v.name().equals(s)) return v;
        }
        return UNKNOWN;
    }
}
