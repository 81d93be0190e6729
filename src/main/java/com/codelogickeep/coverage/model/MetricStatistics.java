package com.codelogickeep.coverage.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MetricStatistics(
        @JsonProperty("current") double current,
        @JsonProperty("average") double average,
        @JsonProperty("median") double median,
        @JsonProperty("min") double min,
        @JsonProperty("max") double max,
        @JsonProperty("std_dev") double stdDev,
        @JsonProperty("trend") TrendAnalysis trend
) {
}
