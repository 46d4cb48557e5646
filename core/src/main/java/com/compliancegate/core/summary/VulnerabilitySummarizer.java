package com.compliancegate.core.summary;

import com.compliancegate.core.model.Severity;
import com.compliancegate.core.model.VulnerabilitySummary;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Trivy JSON → 심각도 히스토그램.
 * 인식 가능한 스키마를 우선순위대로 시도하고, 아무것도 맞지 않으면 empty (0 건과 구분).
 */
public final class VulnerabilitySummarizer {

    /** 인식하는 Trivy 출력 형태 (우선순위 순) */
    public enum Variant {
        /** {"Results":[{"Vulnerabilities":[{"Severity":"HIGH"}, ...]}, ...]} */
        RESULTS_ARRAY {
            @Override
            Optional<VulnerabilitySummary> decode(JsonNode data) {
                Optional<JsonNode> results = JsonShapes.arrayField(data, "Results");
                if (results.isEmpty()) return Optional.empty();

                Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
                for (Severity s : Severity.values()) counts.put(s, 0);

                for (JsonNode result : results.get()) {
                    Optional<JsonNode> vulns = JsonShapes.arrayField(result, "Vulnerabilities");
                    if (vulns.isEmpty()) continue;
                    for (JsonNode vuln : vulns.get()) {
                        Severity sev = JsonShapes.label(vuln, "Severity")
                                .map(Severity::fromLabel)
                                .orElse(Severity.UNKNOWN);
                        counts.merge(sev, 1, Integer::sum);
                    }
                }
                return Optional.of(VulnerabilitySummary.of(counts));
            }
        };

        abstract Optional<VulnerabilitySummary> decode(JsonNode data);
    }

    public Optional<VulnerabilitySummary> summarize(JsonNode data) {
        if (data == null) return Optional.empty();
        for (Variant v : Variant.values()) {
            Optional<VulnerabilitySummary> s = v.decode(data);
            if (s.isPresent()) return s;
        }
        return Optional.empty();
    }
}
