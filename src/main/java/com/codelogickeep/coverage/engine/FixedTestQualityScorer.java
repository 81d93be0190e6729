package com.codelogickeep.coverage.engine;

/**
 * Returns a configured baseline regardless of the test sources.
 */
public class FixedTestQualityScorer implements TestQualityScorer {

    public static final double DEFAULT_BASELINE = 75.0;

    private final double baseline;

    public FixedTestQualityScorer() {
        this(DEFAULT_BASELINE);
    }

    public FixedTestQualityScorer(double baseline) {
        this.baseline = baseline;
    }

    @Override
    public double score() {
        return baseline;
    }
}
