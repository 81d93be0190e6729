package com.codelogickeep.coverage.tools;

import com.codelogickeep.coverage.exception.CoverageGateException;
import com.codelogickeep.coverage.model.FileCoverage;

import java.util.List;

/**
 * Read-only provider of per-file line and branch coverage.
 */
public interface CoverageDataSource {

    /**
     * Reads the coverage of every instrumented file.
     *
     * @throws CoverageGateException when the underlying data is missing or unreadable
     */
    List<FileCoverage> read();

    /** Where the data comes from, for log and error messages. */
    String describe();
}
