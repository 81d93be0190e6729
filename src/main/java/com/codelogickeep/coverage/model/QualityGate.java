package com.codelogickeep.coverage.model;

/**
 * A named threshold rule applied to one coverage metric.
 *
 * @param name      display name, e.g. "MinimumLineCoverage"
 * @param metric    metric key resolved through {@link CoverageMetric#fromKey(String)}
 * @param threshold threshold compared with the measured value
 * @param operator  comparison to apply
 * @param enabled   disabled gates always pass
 * @param severity  error gates fail the run, warning gates only downgrade it
 */
public record QualityGate(
        String name,
        String metric,
        double threshold,
        GateOperator operator,
        boolean enabled,
        GateSeverity severity
) {

    public QualityGate {
        if (operator == null) {
            operator = GateOperator.GTE;
        }
        if (severity == null) {
            severity = GateSeverity.ERROR;
        }
    }

    public static QualityGate of(String name, String metric, double threshold,
                                 GateOperator operator, GateSeverity severity) {
        return new QualityGate(name, metric, threshold, operator, true, severity);
    }

    public boolean evaluate(double value) {
        if (!enabled) {
            return true;
        }
        return operator.test(value, threshold);
    }

    public QualityGate disabled() {
        return new QualityGate(name, metric, threshold, operator, false, severity);
    }
}
