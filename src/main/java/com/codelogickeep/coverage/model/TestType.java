package com.codelogickeep.coverage.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TestType {
    UNIT("unit"),
    INTEGRATION("integration"),
    EDGE_CASE("edge_case"),
    ERROR_HANDLING("error_handling");

    private final String value;

    TestType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
