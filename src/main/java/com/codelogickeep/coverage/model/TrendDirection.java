package com.codelogickeep.coverage.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrendDirection {
    IMPROVING("improving"),
    STABLE("stable"),
    DECLINING("declining"),
    INSUFFICIENT_DATA("insufficient_data"),
    NO_DATA("no_data");

    private final String value;

    TrendDirection(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
