package com.codelogickeep.coverage.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Least-squares trend of one tracked metric over a period.
 *
 * @param confidence R-squared of the fit
 */
public record TrendAnalysis(
        @JsonProperty("direction") TrendDirection direction,
        @JsonProperty("slope") double slope,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("current_value") double currentValue,
        @JsonProperty("change_percentage") double changePercent,
        @JsonProperty("data_points") int sampleCount
) {

    public static TrendAnalysis withoutData(TrendDirection direction, int sampleCount) {
        return new TrendAnalysis(direction, 0.0, 0.0, 0.0, 0.0, sampleCount);
    }
}
