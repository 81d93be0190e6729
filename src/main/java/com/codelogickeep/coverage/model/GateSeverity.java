package com.codelogickeep.coverage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum GateSeverity {
    ERROR("error"),
    WARNING("warning");

    private final String value;

    GateSeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static GateSeverity fromValue(String value) {
        if (value == null) {
            return ERROR;
        }
        for (GateSeverity severity : values()) {
            if (severity.value.equalsIgnoreCase(value.trim())) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown gate severity: " + value + " (expected error or warning)");
    }
}
