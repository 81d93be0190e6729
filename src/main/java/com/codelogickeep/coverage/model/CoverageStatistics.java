package com.codelogickeep.coverage.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Dashboard aggregates of the coverage history over a period.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CoverageStatistics(
        @JsonProperty("period_days") int periodDays,
        @JsonProperty("data_points") int dataPoints,
        @JsonProperty("first_timestamp") String firstTimestamp,
        @JsonProperty("last_timestamp") String lastTimestamp,
        @JsonProperty("statistics") Map<String, MetricStatistics> statistics,
        @JsonProperty("error") String error
) {

    public static CoverageStatistics unavailable(int periodDays) {
        return new CoverageStatistics(periodDays, 0, null, null, Map.of(),
                "No data available for the specified period");
    }

    public boolean isAvailable() {
        return error == null;
    }
}
