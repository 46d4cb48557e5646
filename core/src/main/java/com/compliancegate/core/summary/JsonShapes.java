package com.compliancegate.core.summary;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;
import java.util.Optional;

/** 느슨한 스캐너 JSON 을 다룰 때 쓰는 형태 판별 헬퍼 */
final class JsonShapes {
    private JsonShapes() {}

    static boolean isObject(JsonNode n) { return n != null && n.isObject(); }

    static boolean isArray(JsonNode n) { return n != null && n.isArray(); }

    /** 객체의 배열 필드. 필드가 없거나 배열이 아니면 empty. */
    static Optional<JsonNode> arrayField(JsonNode obj, String field) {
        if (!isObject(obj)) return Optional.empty();
        JsonNode v = obj.get(field);
        return isArray(v) ? Optional.of(v) : Optional.empty();
    }

    /**
     * 레벨/심각도 라벨 추출 (대문자).
     * null, 빈 문자열, false, 0, 객체/배열은 라벨이 아니다.
     */
    static Optional<String> label(JsonNode obj, String field) {
        if (!isObject(obj)) return Optional.empty();
        JsonNode v = obj.get(field);
        if (v == null || !v.isValueNode() || v.isNull()) return Optional.empty();
        if (v.isBoolean() && !v.booleanValue()) return Optional.empty();
        if (v.isNumber() && v.doubleValue() == 0d) return Optional.empty();
        String s = v.asText();
        if (s == null || s.isBlank()) return Optional.empty();
        return Optional.of(s.toUpperCase(Locale.ROOT));
    }
}
