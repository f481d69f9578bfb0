package com.farm.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PhClass {
    ACIDIC("acidic"),
    NEUTRAL("neutral"),
    ALKALINE("alkaline");

    private final String value;

    PhClass(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Acidic below 6, alkaline above 8, neutral in between (bounds inclusive).
     */
    public static PhClass fromPh(double ph) {
        if (ph < 6.0) return ACIDIC;
        if (ph > 8.0) return ALKALINE;
        return NEUTRAL;
    }

    @JsonCreator
    public static PhClass fromValue(String value) {
        for (PhClass phClass : values()) {
            if (phClass.value.equalsIgnoreCase(value) || phClass.name().equalsIgnoreCase(value)) {
                return phClass;
            }
        }
        throw new IllegalArgumentException("Unknown pH class: " + value);
    }
}
