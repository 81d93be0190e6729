package com.codelogickeep.coverage.config;

import com.codelogickeep.coverage.exception.CoverageGateException;
import com.codelogickeep.coverage.model.CoverageMetric;
import com.codelogickeep.coverage.model.GateOperator;
import com.codelogickeep.coverage.model.GateSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Validates a merged {@link AppConfig} before any analysis runs.
 */
public class ConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(ConfigValidator.class);

    private static final Set<String> SCORERS = Set.of("fixed", "assertion-density");
    private static final Set<String> PROBES = Set.of("surefire", "process", "none");

    private ConfigValidator() {
    }

    /**
     * @throws CoverageGateException with {@code CONFIG_INVALID} listing every problem found
     */
    public static void validate(AppConfig config) {
        if (config == null) {
            throw new CoverageGateException(
                    CoverageGateException.ErrorCode.CONFIG_INVALID,
                    "Configuration is null",
                    "No configuration loaded");
        }

        List<String> errors = new ArrayList<>();
        validateAnalysis(config.getAnalysis(), errors);
        validateTracking(config.getTracking(), errors);
        validateReporting(config.getReporting(), errors);
        validateCi(config.getCi(), errors);
        validateProbe(config.getProbe(), errors);

        if (!errors.isEmpty()) {
            String errorMessage = "Configuration validation failed:\n  - " + String.join("\n  - ", errors);
            throw new CoverageGateException(
                    CoverageGateException.ErrorCode.CONFIG_INVALID,
                    errorMessage,
                    "Check coverage-gate.yml or command line parameters");
        }

        log.debug("Configuration validation passed");
    }

    private static void validateAnalysis(AppConfig.AnalysisConfig analysis, List<String> errors) {
        if (isNullOrEmpty(analysis.getSourceDir())) {
            errors.add("analysis.source-dir: must not be empty");
        }
        if (isNullOrEmpty(analysis.getJacocoReport())) {
            errors.add("analysis.jacoco-report: must not be empty");
        }
        if (analysis.getTestQualityScorer() == null
                || !SCORERS.contains(analysis.getTestQualityScorer().toLowerCase(Locale.ROOT))) {
            errors.add("analysis.test-quality-scorer: '" + analysis.getTestQualityScorer()
                    + "' is not one of " + SCORERS);
        }
        if (!inPercentRange(analysis.getTestQualityBaseline())) {
            errors.add("analysis.test-quality-baseline: must be within [0, 100]");
        }
    }

    private static void validateTracking(AppConfig.TrackingConfig tracking, List<String> errors) {
        if (tracking.getMaxHistory() <= 0) {
            errors.add("tracking.max-history: must be positive");
        }
        if (tracking.getRegressionThreshold() < 0) {
            errors.add("tracking.regression-threshold: must not be negative");
        }
        if (tracking.getKeepDays() <= 0) {
            errors.add("tracking.keep-days: must be positive");
        }
    }

    private static void validateReporting(AppConfig.ReportingConfig reporting, List<String> errors) {
        if (reporting.getMaxSuggestions() < 0) {
            errors.add("reporting.max-suggestions: must not be negative");
        }
    }

    private static void validateCi(AppConfig.CiConfig ci, List<String> errors) {
        if (!inPercentRange(ci.getMinLineCoverage())) {
            errors.add("ci.min-line-coverage: must be within [0, 100]");
        }
        if (ci.getGates() == null) {
            return;
        }
        for (AppConfig.GateConfig gate : ci.getGates()) {
            String label = "ci.gates[" + (gate.getName() != null ? gate.getName() : "?") + "]";
            if (isNullOrEmpty(gate.getName())) {
                errors.add(label + ".name: must not be empty");
            }
            try {
                GateOperator.fromValue(gate.getOperator());
            } catch (IllegalArgumentException e) {
                errors.add(label + ".operator: " + e.getMessage());
            }
            try {
                GateSeverity.fromValue(gate.getSeverity());
            } catch (IllegalArgumentException e) {
                errors.add(label + ".severity: " + e.getMessage());
            }
            Optional<CoverageMetric> metric = CoverageMetric.fromKey(gate.getMetric());
            if (metric.isEmpty()) {
                log.warn("{}: unknown metric '{}', the gate will fail when evaluated", label, gate.getMetric());
            } else if (metric.get().isPercentage() && !inPercentRange(gate.getThreshold())) {
                errors.add(label + ".threshold: " + gate.getThreshold() + " is outside [0, 100]");
            }
        }
    }

    private static void validateProbe(AppConfig.ProbeConfig probe, List<String> errors) {
        String type = probe.getType() != null ? probe.getType().toLowerCase(Locale.ROOT) : null;
        if (type == null || !PROBES.contains(type)) {
            errors.add("probe.type: '" + probe.getType() + "' is not one of " + PROBES);
            return;
        }
        if (type.equals("process") && (probe.getCommand() == null || probe.getCommand().isEmpty())) {
            errors.add("probe.command: required when probe.type is 'process'");
        }
        if (probe.getTimeoutSeconds() <= 0) {
            errors.add("probe.timeout-seconds: must be positive");
        }
    }

    private static boolean inPercentRange(double value) {
        return value >= 0.0 && value <= 100.0;
    }

    private static boolean isNullOrEmpty(String value) {
        return value == null || value.trim().isEmpty();
    }
}
