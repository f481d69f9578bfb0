package com.farm.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NutrientLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    NutrientLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * LOW below {@code low}, HIGH above {@code high}, MEDIUM otherwise (bounds inclusive).
     */
    public static NutrientLevel of(double amount, double low, double high) {
        if (amount < low) return LOW;
        if (amount > high) return HIGH;
        return MEDIUM;
    }

    @JsonCreator
    public static NutrientLevel fromValue(String value) {
        for (NutrientLevel level : values()) {
            if (level.value.equalsIgnoreCase(value) || level.name().equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown nutrient level: " + value);
    }
}
