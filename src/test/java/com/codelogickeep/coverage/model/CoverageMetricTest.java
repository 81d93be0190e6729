package com.codelogickeep.coverage.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CoverageMetricTest {

    @ParameterizedTest
    @CsvSource({
            "line_coverage, LINE_COVERAGE",
            "line_coverage_percent, LINE_COVERAGE",
            "Line-Coverage, LINE_COVERAGE",
            "effective_coverage_score, EFFECTIVE_COVERAGE",
            "test_quality_score, TEST_QUALITY",
            "overall_score, OVERALL_SCORE",
            "critical_gaps, CRITICAL_GAPS"
    })
    @DisplayName("fromKey should resolve keys and their field-style aliases")
    void fromKey_shouldResolveAliases(String key, CoverageMetric expected) {
        assertEquals(Optional.of(expected), CoverageMetric.fromKey(key));
    }

    @Test
    @DisplayName("fromKey should return empty for unknown or missing keys")
    void fromKey_shouldRejectUnknown() {
        assertTrue(CoverageMetric.fromKey("mutation_score").isEmpty());
        assertTrue(CoverageMetric.fromKey(null).isEmpty());
    }

    @Test
    @DisplayName("valueOf should read the matching metric")
    void valueOf_shouldReadMetric() {
        CoverageQualityMetrics metrics = CoverageQualityMetrics.builder()
                .lineCoveragePercent(82.5)
                .criticalGaps(3)
                .uncoveredFiles(2)
                .build();

        assertEquals(82.5, CoverageMetric.LINE_COVERAGE.valueOf(metrics));
        assertEquals(3.0, CoverageMetric.CRITICAL_GAPS.valueOf(metrics));
        assertEquals(2.0, CoverageMetric.UNCOVERED_FILES.valueOf(metrics));
        assertEquals(metrics.getOverallScore(), CoverageMetric.OVERALL_SCORE.valueOf(metrics));
    }

    @Test
    @DisplayName("only bounded metrics should be flagged as percentages")
    void isPercentage_shouldDistinguishCounts() {
        assertTrue(CoverageMetric.BRANCH_COVERAGE.isPercentage());
        assertFalse(CoverageMetric.TOTAL_GAPS.isPercentage());
        assertFalse(CoverageMetric.COVERAGE_DENSITY.isPercentage());
    }
}
