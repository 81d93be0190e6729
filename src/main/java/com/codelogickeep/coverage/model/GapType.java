package com.codelogickeep.coverage.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of un-exercised code a {@link CoverageGap} represents.
 */
public enum GapType {
    UNCOVERED_LINES("uncovered_lines"),
    MISSING_BRANCH("missing_branch"),
    EXCEPTION_HANDLING("exception_handling"),
    UNCOVERED_FUNCTION("uncovered_function"),
    UNCOVERED_CLASS("uncovered_class"),
    ERROR_PATH("error_path");

    private final String value;

    GapType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Human readable label, e.g. "Missing Branch".
     */
    public String getLabel() {
        StringBuilder sb = new StringBuilder();
        for (String word : value.split("_")) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return sb.toString();
    }
}
