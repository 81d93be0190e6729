package com.codelogickeep.coverage.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RegressionReport(
        @JsonProperty("has_regression") boolean hasRegression,
        @JsonProperty("regressions") List<Regression> regressions,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("commit_hash") String commitId,
        @JsonProperty("message") String message
) {

    public static RegressionReport insufficientData() {
        return new RegressionReport(false, List.of(), null, null,
                "Insufficient data for regression analysis");
    }

    public static RegressionReport skipped() {
        return new RegressionReport(false, List.of(), null, null, "Regression check not run");
    }
}
