package com.kotsin.insights.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Anomaly scoring method.
 */
public enum DetectionMethod {

    /**
     * Iterative Extreme Studentized Deviate test (default)
     */
    ESD("esd"),

    /**
     * Fixed z-score threshold
     */
    ZSCORE("zscore");

    private final String value;

    DetectionMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse a method name; unknown or missing names fall back to {@link #ESD}.
     */
    @JsonCreator
    public static DetectionMethod fromValue(String value) {
        if (value != null) {
            for (DetectionMethod method : values()) {
                if (method.value.equalsIgnoreCase(value.trim())) {
                    return method;
                }
            }
        }
        return ESD;
    }
}
