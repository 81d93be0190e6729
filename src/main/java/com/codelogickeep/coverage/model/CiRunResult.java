package com.codelogickeep.coverage.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Verdict of one CI coverage run, the machine contract printed with {@code --json}.
 * Exit code 1 iff an error-severity gate failed, a regression failed the run, or the
 * run itself errored.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CiRunResult(
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("status") RunStatus status,
        @JsonProperty("exit_code") int exitCode,
        @JsonProperty("commit_hash") String commitId,
        @JsonProperty("branch_name") String branchName,
        @JsonProperty("metrics") Map<String, Object> metrics,
        @JsonProperty("quality_gates") GateTally qualityGates,
        @JsonProperty("regression_check") RegressionReport regressionCheck,
        @JsonProperty("reports") Map<String, String> reports,
        @JsonProperty("summary") String summary,
        @JsonProperty("message") String message
) {

    public static CiRunResult error(String timestamp, String message) {
        return new CiRunResult(timestamp, RunStatus.ERROR, 1, null, null, null, null, null, null, null, message);
    }

    /**
     * Gate results of a run, with counts.
     *
     * @param failed   failed error-severity gates
     * @param warnings failed warning-severity gates
     */
    public record GateTally(
            @JsonProperty("total") int total,
            @JsonProperty("passed") int passed,
            @JsonProperty("failed") int failed,
            @JsonProperty("warnings") int warnings,
            @JsonProperty("results") List<GateOutcome> results
    ) {

        public static GateTally of(List<QualityGateResult> results) {
            int passed = 0;
            int failed = 0;
            int warnings = 0;
            List<GateOutcome> outcomes = new ArrayList<>();
            for (QualityGateResult result : results) {
                if (result.passed()) {
                    passed++;
                } else if (result.isFailedError()) {
                    failed++;
                } else if (result.isFailedWarning()) {
                    warnings++;
                }
                outcomes.add(GateOutcome.of(result));
            }
            return new GateTally(results.size(), passed, failed, warnings, List.copyOf(outcomes));
        }
    }

    public record GateOutcome(
            @JsonProperty("name") String name,
            @JsonProperty("metric") String metric,
            @JsonProperty("threshold") double threshold,
            @JsonProperty("current") double current,
            @JsonProperty("status") String status,
            @JsonProperty("difference") double difference,
            @JsonProperty("severity") GateSeverity severity,
            @JsonProperty("message") String message
    ) {

        static GateOutcome of(QualityGateResult result) {
            QualityGate gate = result.gate();
            return new GateOutcome(gate.name(), gate.metric(), gate.threshold(), result.currentValue(),
                    result.status(), result.difference(), gate.severity(), result.message());
        }

        public boolean passed() {
            return "PASS".equals(status);
        }
    }
}
