package com.codelogickeep.coverage.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Priority {
    HIGH("high", 3),
    MEDIUM("medium", 2),
    LOW("low", 1);

    private final String value;
    private final int rank;

    Priority(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getRank() {
        return rank;
    }
}
