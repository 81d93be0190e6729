package com.codelogickeep.coverage.model;

/**
 * Outcome of evaluating one {@link QualityGate}.
 */
public record QualityGateResult(
        QualityGate gate,
        double currentValue,
        boolean passed,
        double difference,
        String message
) {

    public String status() {
        return passed ? "PASS" : "FAIL";
    }

    public boolean isFailedError() {
        return !passed && gate.severity() == GateSeverity.ERROR;
    }

    public boolean isFailedWarning() {
        return !passed && gate.severity() == GateSeverity.WARNING;
    }
}
