package com.codelogickeep.coverage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Comparison applied by a {@link QualityGate} between the measured value and its threshold.
 */
public enum GateOperator {
    GTE("gte") {
        @Override
        public boolean test(double value, double threshold) {
            return value >= threshold;
        }
    },
    LTE("lte") {
        @Override
        public boolean test(double value, double threshold) {
            return value <= threshold;
        }
    },
    EQ("eq") {
        @Override
        public boolean test(double value, double threshold) {
            return Math.abs(value - threshold) < EQ_TOLERANCE;
        }
    };

    /** Floating point slack for {@link #EQ}. */
    public static final double EQ_TOLERANCE = 0.01;

    private final String value;

    GateOperator(String value) {
        this.value = value;
    }

    public abstract boolean test(double value, double threshold);

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static GateOperator fromValue(String value) {
        if (value == null) {
            return GTE;
        }
        for (GateOperator op : values()) {
            if (op.value.equalsIgnoreCase(value.trim())) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown gate operator: " + value + " (expected gte, lte or eq)");
    }
}
