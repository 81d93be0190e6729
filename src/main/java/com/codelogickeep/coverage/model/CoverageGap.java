package com.codelogickeep.coverage.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * One region of source code not exercised by any test.
 */
@Data
@Builder
public class CoverageGap {
    /** Path of the source file, as reported by the coverage data source */
    private String filePath;

    private int lineStart;

    private int lineEnd;

    private GapType gapType;

    private Severity severity;

    /** Innermost enclosing method or constructor, null at class or file level */
    private String functionName;

    /** Innermost enclosing type, null outside any type */
    private String className;

    private int complexityScore;

    @Builder.Default
    private List<String> suggestedTests = new ArrayList<>();

    /** "Class.method", "Class", "method" or "" depending on which scopes are known. */
    public String getScopeLabel() {
        if (className != null && functionName != null) {
            return className + "." + functionName;
        }
        if (className != null) {
            return className;
        }
        return functionName != null ? functionName : "";
    }
}
