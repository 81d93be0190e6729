package com.codelogickeep.coverage.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A tracked metric whose latest value dropped below its recent average by more than the threshold.
 *
 * @param severity "high" when the drop exceeds 10%, otherwise "medium"
 */
public record Regression(
        @JsonProperty("metric") TrackedMetric metric,
        @JsonProperty("current_value") double currentValue,
        @JsonProperty("recent_average") double recentAverage,
        @JsonProperty("percentage_drop") double percentageDrop,
        @JsonProperty("severity") String severity
) {
}
