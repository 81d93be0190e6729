package com.codelogickeep.coverage.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Raw coverage of one source file as read from the coverage data source.
 *
 * @param path            resolved source path
 * @param executedLines   lines with at least one executed instruction
 * @param missingLines    instrumented lines never executed
 * @param coveredBranches branch arcs taken at least once
 * @param missedBranches  branch arcs never taken
 */
public record FileCoverage(
        Path path,
        SortedSet<Integer> executedLines,
        SortedSet<Integer> missingLines,
        int coveredBranches,
        int missedBranches
) {

    public FileCoverage {
        executedLines = Collections.unmodifiableSortedSet(new TreeSet<>(executedLines));
        missingLines = Collections.unmodifiableSortedSet(new TreeSet<>(missingLines));
    }

    public int instrumentedLines() {
        return executedLines.size() + missingLines.size();
    }

    public int totalBranches() {
        return coveredBranches + missedBranches;
    }

    /** Line coverage percentage, 0 when nothing is instrumented. */
    public double lineCoveragePercent() {
        int total = instrumentedLines();
        return total == 0 ? 0.0 : executedLines.size() * 100.0 / total;
    }
}
