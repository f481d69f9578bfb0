package com.farm.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ThresholdStatus {
    BELOW_CRITICAL("below_critical"),
    ABOVE_CRITICAL("above_critical");

    private final String value;

    ThresholdStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ThresholdStatus fromValue(String value) {
        for (ThresholdStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown threshold status: " + value);
    }
}
