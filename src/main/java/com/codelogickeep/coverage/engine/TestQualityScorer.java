package com.codelogickeep.coverage.engine;

/**
 * Scores the quality of the existing test suite on a 0 to 100 scale.
 */
@FunctionalInterface
public interface TestQualityScorer {

    double score();
}
