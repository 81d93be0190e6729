package com.codelogickeep.coverage.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Condensed view of one analysis run, embedded in the JSON report and printed by the CLI.
 */
public record CoverageSummary(
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("metrics") Metrics metrics,
        @JsonProperty("gaps") Gaps gaps,
        @JsonProperty("files") Files files,
        @JsonProperty("trend") Trend trend
) {

    public record Metrics(
            @JsonProperty("line_coverage") double lineCoverage,
            @JsonProperty("branch_coverage") double branchCoverage,
            @JsonProperty("function_coverage") double functionCoverage,
            @JsonProperty("overall_score") double overallScore,
            @JsonProperty("effective_coverage") double effectiveCoverage,
            @JsonProperty("test_quality") double testQuality
    ) {
    }

    public record Gaps(
            @JsonProperty("total") int total,
            @JsonProperty("critical") int critical,
            @JsonProperty("high") int high,
            @JsonProperty("by_type") Map<String, Integer> byType
    ) {
    }

    public record Files(
            @JsonProperty("well_covered") int wellCovered,
            @JsonProperty("poorly_covered") int poorlyCovered,
            @JsonProperty("uncovered") int uncovered
    ) {
    }

    public record Trend(
            @JsonProperty("direction") TrendDirection direction,
            @JsonProperty("percentage") double percentage
    ) {
    }
}
