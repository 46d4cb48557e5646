package com.compliancegate.core.summary;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Gitleaks JSON 의 발견 건수 추론. 버전/리포트 포맷마다 모양이 달라
 * 아래 순서대로 처음 맞는 형태를 쓴다.
 */
public final class SecretFindingCounter {

    public enum Variant {
        BARE_ARRAY(null),
        FINDINGS_ARRAY("findings"),
        LEAKS_ARRAY("Leaks"),
        LOWERCASE_LEAKS_ARRAY("leaks"),
        RESULTS_ARRAY("results"),
        /** {"total": N}. 소수는 올림, 음수는 건수로 보지 않음 */
        TOTAL_FIELD("total");

        private final String field;

        Variant(String field) { this.field = field; }

        Optional<Long> decode(JsonNode data) {
            switch (this) {
                case BARE_ARRAY:
                    return JsonShapes.isArray(data) ? Optional.of((long) data.size()) : Optional.empty();
                case TOTAL_FIELD: {
                    if (!JsonShapes.isObject(data)) return Optional.empty();
                    JsonNode total = data.get(field);
                    if (total == null || !total.isNumber()) return Optional.empty();
                    double v = total.doubleValue();
                    if (Double.isNaN(v) || v < 0) return Optional.empty();
                    return Optional.of((long) Math.ceil(v));
                }
                default:
                    return JsonShapes.arrayField(data, field).map(a -> (long) a.size());
            }
        }
    }

    public SecretCount count(JsonNode data) {
        if (data == null) return SecretCount.unknownStructure();
        for (Variant v : Variant.values()) {
            Optional<Long> n = v.decode(data);
            if (n.isPresent()) return SecretCount.of(n.get(), v);
        }
        return SecretCount.unknownStructure();
    }
}
