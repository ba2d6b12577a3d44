package com.kotsin.insights.driver.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DriverDirection {
    POSITIVE("positive"),
    NEGATIVE("negative");

    private final String value;

    DriverDirection(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Sign of the correlation; r = 0 counts as positive.
     */
    public static DriverDirection fromCorrelation(double r) {
        return r >= 0 ? POSITIVE : NEGATIVE;
    }

    @JsonCreator
    public static DriverDirection fromValue(String value) {
        for (DriverDirection direction : values()) {
            if (direction.value.equalsIgnoreCase(value)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown driver direction: " + value);
    }
}
