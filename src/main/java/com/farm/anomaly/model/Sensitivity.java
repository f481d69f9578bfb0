package com.farm.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Escalation sensitivity tier. Higher sensitivity escalates lower severities.
 */
public enum Sensitivity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    Sensitivity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolves a configured sensitivity name. Anything unrecognized, including
     * null or blank, resolves to {@link #MEDIUM}.
     */
    public static Sensitivity fromValue(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        String trimmed = value.trim();
        for (Sensitivity sensitivity : values()) {
            if (sensitivity.value.equalsIgnoreCase(trimmed)) {
                return sensitivity;
            }
        }
        return MEDIUM;
    }
}
