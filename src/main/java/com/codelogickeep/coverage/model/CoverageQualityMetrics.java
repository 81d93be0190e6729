package com.codelogickeep.coverage.model;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregate snapshot of coverage health for one analysis run.
 * All percentages lie in [0, 100]; {@code coverageDensity} is a ratio in [0, 1].
 */
@Value
@Builder
public class CoverageQualityMetrics {

    private static final double COVERAGE_WEIGHT = 0.4;
    private static final double QUALITY_WEIGHT = 0.3;
    private static final double GAPS_WEIGHT = 0.2;
    private static final double TREND_WEIGHT = 0.1;

    double lineCoveragePercent;
    double branchCoveragePercent;
    double functionCoveragePercent;

    /** Complexity-weighted line coverage */
    double effectiveCoverageScore;
    double testQualityScore;
    /** Executed lines per non-comment source line */
    double coverageDensity;

    int criticalGaps;
    int highPriorityGaps;
    int mediumPriorityGaps;
    int lowPriorityGaps;
    int totalGaps;

    @Builder.Default
    TrendDirection coverageTrend = TrendDirection.STABLE;
    double trendPercentage;

    /** False for the placeholder returned when no coverage data is loaded */
    @Builder.Default
    boolean measured = true;

    int wellCoveredFiles;
    int poorlyCoveredFiles;
    int uncoveredFiles;

    /**
     * Composite quality score in [0, 100]: coverage 40%, test quality 30%,
     * gap penalty 20% and trend 10%. Zero when nothing was measured.
     */
    public double getOverallScore() {
        if (!measured) {
            return 0.0;
        }
        double coverageScore = (lineCoveragePercent + branchCoveragePercent) / 2;
        double gapsScore = Math.max(0, 100 - (criticalGaps * 10 + highPriorityGaps * 5));
        double trendScore = 50 + trendPercentage;

        double score = coverageScore * COVERAGE_WEIGHT
                + testQualityScore * QUALITY_WEIGHT
                + gapsScore * GAPS_WEIGHT
                + trendScore * TREND_WEIGHT;
        return Math.max(0.0, Math.min(100.0, score));
    }

    /**
     * Metrics value returned when no coverage data is loaded; every score is zero.
     */
    public static CoverageQualityMetrics empty() {
        return CoverageQualityMetrics.builder()
                .coverageTrend(TrendDirection.STABLE)
                .measured(false)
                .build();
    }
}
