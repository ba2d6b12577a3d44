package com.kotsin.insights.trend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TrendDirection {
    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable");

    private final String value;

    TrendDirection(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static TrendDirection fromValue(String value) {
        for (TrendDirection direction : values()) {
            if (direction.value.equalsIgnoreCase(value)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown trend direction: " + value);
    }
}
