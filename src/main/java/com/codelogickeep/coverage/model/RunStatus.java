package com.codelogickeep.coverage.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall verdict of a CI coverage run.
 */
public enum RunStatus {
    SUCCESS("success"),
    WARNING("warning"),
    FAILURE("failure"),
    ERROR("error");

    private final String value;

    RunStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
