package com.compliancegate.core.summary;

import com.compliancegate.core.model.HardeningSummary;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Dockle JSON → 레벨별 집계.
 * 적용 가능한 형태는 모두 집계에 합산한다. 하나도 적용되지 않으면 empty,
 * 적용됐는데 건수가 0 이면 빈 HardeningSummary.
 */
public final class HardeningSummarizer {

    public enum Variant {
        /** [{"level":"WARN","details":[{"level":"INFO"}]}, ...] */
        FINDING_ARRAY {
            @Override boolean applies(JsonNode data) { return JsonShapes.isArray(data); }

            @Override void collect(JsonNode data, Map<String, Integer> counts) {
                for (JsonNode item : data) {
                    JsonShapes.label(item, "level").ifPresent(l -> bump(counts, l));
                    JsonShapes.arrayField(item, "details").ifPresent(details -> {
                        for (JsonNode d : details) {
                            JsonShapes.label(d, "level").ifPresent(l -> bump(counts, l));
                        }
                    });
                }
            }
        },
        /** {"details":[{"code":"CIS-DI-0001","level":"WARN"}, ...]} */
        DETAILS_OBJECT {
            @Override boolean applies(JsonNode data) { return JsonShapes.arrayField(data, "details").isPresent(); }

            @Override void collect(JsonNode data, Map<String, Integer> counts) {
                for (JsonNode d : data.get("details")) {
                    JsonShapes.label(d, "level").ifPresent(l -> bump(counts, l));
                }
            }
        },
        /** {"level":"FATAL", ...} */
        LEVEL_OBJECT {
            @Override boolean applies(JsonNode data) { return JsonShapes.label(data, "level").isPresent(); }

            @Override void collect(JsonNode data, Map<String, Integer> counts) {
                JsonShapes.label(data, "level").ifPresent(l -> bump(counts, l));
            }
        };

        abstract boolean applies(JsonNode data);

        abstract void collect(JsonNode data, Map<String, Integer> counts);

        private static void bump(Map<String, Integer> counts, String level) {
            counts.merge(level, 1, Integer::sum);
        }
    }

    public Optional<HardeningSummary> summarize(JsonNode data) {
        if (data == null) return Optional.empty();

        Map<String, Integer> counts = new LinkedHashMap<>();
        boolean recognized = false;
        for (Variant v : Variant.values()) {
            if (!v.applies(data)) continue;
            recognized = true;
            v.collect(data, counts);
        }
        if (!recognized) return Optional.empty();
        return Optional.of(counts.isEmpty() ? HardeningSummary.empty() : new HardeningSummary(counts));
    }
}
