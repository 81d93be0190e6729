package com.codelogickeep.coverage.model;

import java.util.Locale;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Gate-addressable metrics of {@link CoverageQualityMetrics}, keyed by the names used
 * in configuration and in the CI payload.
 */
public enum CoverageMetric {
    LINE_COVERAGE("line_coverage", true, CoverageQualityMetrics::getLineCoveragePercent),
    BRANCH_COVERAGE("branch_coverage", true, CoverageQualityMetrics::getBranchCoveragePercent),
    FUNCTION_COVERAGE("function_coverage", true, CoverageQualityMetrics::getFunctionCoveragePercent),
    EFFECTIVE_COVERAGE("effective_coverage", true, CoverageQualityMetrics::getEffectiveCoverageScore),
    TEST_QUALITY("test_quality", true, CoverageQualityMetrics::getTestQualityScore),
    COVERAGE_DENSITY("coverage_density", false, CoverageQualityMetrics::getCoverageDensity),
    OVERALL_SCORE("overall_score", true, CoverageQualityMetrics::getOverallScore),
    CRITICAL_GAPS("critical_gaps", false, m -> m.getCriticalGaps()),
    HIGH_PRIORITY_GAPS("high_priority_gaps", false, m -> m.getHighPriorityGaps()),
    TOTAL_GAPS("total_gaps", false, m -> m.getTotalGaps()),
    TREND_PERCENTAGE("trend_percentage", false, CoverageQualityMetrics::getTrendPercentage),
    WELL_COVERED_FILES("well_covered_files", false, m -> m.getWellCoveredFiles()),
    POORLY_COVERED_FILES("poorly_covered_files", false, m -> m.getPoorlyCoveredFiles()),
    UNCOVERED_FILES("uncovered_files", false, m -> m.getUncoveredFiles());

    private final String key;
    private final boolean percentage;
    private final ToDoubleFunction<CoverageQualityMetrics> accessor;

    CoverageMetric(String key, boolean percentage, ToDoubleFunction<CoverageQualityMetrics> accessor) {
        this.key = key;
        this.percentage = percentage;
        this.accessor = accessor;
    }

    public String getKey() {
        return key;
    }

    /** True when the metric is a percentage bounded by [0, 100]. */
    public boolean isPercentage() {
        return percentage;
    }

    public double valueOf(CoverageQualityMetrics metrics) {
        return accessor.applyAsDouble(metrics);
    }

    /**
     * Resolves a metric key. Accepts the field-style aliases
     * ({@code line_coverage_percent}, {@code effective_coverage_score}, ...) as well.
     */
    public static Optional<CoverageMetric> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        if (normalized.endsWith("_percent")) {
            normalized = normalized.substring(0, normalized.length() - "_percent".length());
        } else if (normalized.endsWith("_score") && !normalized.equals("overall_score")) {
            normalized = normalized.substring(0, normalized.length() - "_score".length());
        }
        for (CoverageMetric metric : values()) {
            if (metric.key.equals(normalized)) {
                return Optional.of(metric);
            }
        }
        return Optional.empty();
    }
}
