package com.compliancegate.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Trivy 결과의 심각도 히스토그램. total 은 항상 counts 합계. */
public record VulnerabilitySummary(int total, Map<Severity, Integer> counts) {

    public VulnerabilitySummary {
        Objects.requireNonNull(counts, "counts");
        EnumMap<Severity, Integer> copy = new EnumMap<>(Severity.class);
        for (Severity s : Severity.values()) copy.put(s, counts.getOrDefault(s, 0));
        int sum = copy.values().stream().mapToInt(Integer::intValue).sum();
        if (total != sum) {
            throw new IllegalArgumentException("total " + total + " != sum of counts " + sum);
        }
        counts = Collections.unmodifiableMap(copy);
    }

    public static VulnerabilitySummary of(Map<Severity, Integer> counts) {
        int sum = counts.values().stream().mapToInt(Integer::intValue).sum();
        return new VulnerabilitySummary(sum, counts);
    }

    public int count(Severity s) { return counts.getOrDefault(s, 0); }

    /** 예: "Trivy FS: total 3, CRITICAL: 1, HIGH: 2, MEDIUM: 0, LOW: 0, UNKNOWN: 0" */
    public String describe(String label) {
        String parts = Stream.of(Severity.values())
                .map(s -> s.name() + ": " + count(s))
                .collect(Collectors.joining(", "));
        return "Trivy " + label + ": total " + total + ", " + parts;
    }
}
