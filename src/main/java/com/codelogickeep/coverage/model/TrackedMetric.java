package com.codelogickeep.coverage.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Metrics persisted in the coverage history and analysed for trends and regressions.
 */
public enum TrackedMetric {
    LINE_COVERAGE("line_coverage"),
    BRANCH_COVERAGE("branch_coverage"),
    FUNCTION_COVERAGE("function_coverage"),
    OVERALL_SCORE("overall_score");

    private final String key;

    TrackedMetric(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public static Optional<TrackedMetric> fromKey(String key) {
        for (TrackedMetric metric : values()) {
            if (metric.key.equals(key)) {
                return Optional.of(metric);
            }
        }
        return Optional.empty();
    }
}
