package com.kotsin.insights.driver.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Driver scoring method.
 */
public enum DriverMethod {

    /**
     * |r| weighted by relative feature variance (default)
     */
    IMPORTANCE("importance"),

    /**
     * Plain |r|
     */
    CORRELATION("correlation");

    private final String value;

    DriverMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse a method name; unknown or missing names fall back to {@link #IMPORTANCE}.
     */
    @JsonCreator
    public static DriverMethod fromValue(String value) {
        if (value != null) {
            for (DriverMethod method : values()) {
                if (method.value.equalsIgnoreCase(value.trim())) {
                    return method;
                }
            }
        }
        return IMPORTANCE;
    }
}
