package com.codelogickeep.coverage.report;

import com.codelogickeep.coverage.model.RegressionReport;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * In-memory pass/fail payload for CI systems; never written to disk by the reporter.
 *
 * @param status pass, fail or error
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CiReport(
        @JsonProperty("status") String status,
        @JsonProperty("overall_score") Double overallScore,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("quality_gates") Map<String, GateCheck> qualityGates,
        @JsonProperty("regression_check") RegressionReport regressionCheck,
        @JsonProperty("metrics") Map<String, Object> metrics,
        @JsonProperty("message") String message
) {

    public static CiReport error(String message) {
        return new CiReport("error", null, null, null, null, null, message);
    }

    public boolean passed() {
        return "pass".equals(status);
    }

    public record GateCheck(
            @JsonProperty("current") double current,
            @JsonProperty("threshold") double threshold,
            @JsonProperty("passed") boolean passed,
            @JsonProperty("difference") double difference
    ) {
    }
}
