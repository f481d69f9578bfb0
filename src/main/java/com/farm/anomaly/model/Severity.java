package com.farm.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    NORMAL("normal"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Severity depends only on how many detection methods fired:
     * 0 = normal, 1 = medium, 2 = high, 3 or more = critical.
     */
    public static Severity fromFindingCount(int count) {
        if (count >= 3) return CRITICAL;
        if (count == 2) return HIGH;
        if (count == 1) return MEDIUM;
        return NORMAL;
    }

    @JsonCreator
    public static Severity fromValue(String value) {
        for (Severity severity : values()) {
            if (severity.value.equalsIgnoreCase(value) || severity.name().equalsIgnoreCase(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + value);
    }
}
