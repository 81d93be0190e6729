package com.codelogickeep.coverage.report;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Artifacts written by one report run, keyed by kind ({@code html}, {@code json},
 * {@code coverage_trends}, {@code quality_score}). Carries an error instead when the
 * coverage data could not be loaded.
 */
public record ReportResult(Map<String, Path> artifacts, String error) {

    public static final String LOAD_FAILED = "Failed to load coverage data";

    public ReportResult {
        artifacts = Collections.unmodifiableMap(new LinkedHashMap<>(artifacts));
    }

    public static ReportResult failed(String error) {
        return new ReportResult(Map.of(), error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
