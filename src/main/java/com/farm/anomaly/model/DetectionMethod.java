package com.farm.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Detection methods, declared in evaluation order. Findings in a report
 * always follow this order.
 */
public enum DetectionMethod {
    ZSCORE("zscore"),
    IQR("iqr"),
    CHANGE_RATE("change_rate"),
    THRESHOLD("threshold");

    private final String value;

    DetectionMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static DetectionMethod fromValue(String value) {
        for (DetectionMethod method : values()) {
            if (method.value.equalsIgnoreCase(value) || method.name().equalsIgnoreCase(value)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown detection method: " + value);
    }
}
