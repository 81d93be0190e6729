package com.codelogickeep.coverage.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * One historical coverage measurement. Never mutated once recorded.
 *
 * @param timestamp        ISO-8601 instant of the measurement
 * @param lineCoverage     line coverage percentage
 * @param branchCoverage   branch coverage percentage
 * @param functionCoverage function coverage percentage
 * @param overallScore     composite quality score
 * @param testCount        number of tests reported by the test-count probe
 * @param commitId         optional VCS commit
 * @param branchName       optional VCS branch
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"timestamp", "line_coverage", "branch_coverage", "function_coverage", "overall_score",
        "test_count", "commit_hash", "branch_name"})
public record CoverageTrend(
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("line_coverage") double lineCoverage,
        @JsonProperty("branch_coverage") double branchCoverage,
        @JsonProperty("function_coverage") double functionCoverage,
        @JsonProperty("overall_score") double overallScore,
        @JsonProperty("test_count") int testCount,
        @JsonProperty("commit_hash") String commitId,
        @JsonProperty("branch_name") String branchName
) {

    /**
     * Parsed timestamp; a trailing "Z" and explicit offsets are both accepted.
     */
    public Instant instant() {
        return OffsetDateTime.parse(timestamp).toInstant();
    }

    /**
     * Value of a tracked metric by its history key.
     */
    public double valueOf(TrackedMetric metric) {
        return switch (metric) {
            case LINE_COVERAGE -> lineCoverage;
            case BRANCH_COVERAGE -> branchCoverage;
            case FUNCTION_COVERAGE -> functionCoverage;
            case OVERALL_SCORE -> overallScore;
        };
    }
}
