package com.compliancegate.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Dockle 레벨별 집계. 레벨은 대문자 정규화된 자유 문자열(FATAL, WARN, INFO, PASS ...).
 * counts 가 비어 있으면 "인식은 됐고 발견 없음" 이다.
 */
public record HardeningSummary(Map<String, Integer> counts) {

    public HardeningSummary {
        Objects.requireNonNull(counts, "counts");
        counts = Collections.unmodifiableMap(new LinkedHashMap<>(counts));
    }

    public static HardeningSummary empty() { return new HardeningSummary(Map.of()); }

    public int count(String level) { return counts.getOrDefault(level, 0); }

    public boolean isEmpty() { return counts.isEmpty(); }

    /** 0 보다 큰 레벨만, 처음 본 순서대로 "LEVEL: n" 나열. 없으면 빈 문자열. */
    public String describeNonZero() {
        return counts.entrySet().stream()
                .filter(e -> e.getValue() > 0)
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining(", "));
    }
}
