package com.overseer.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Rule severity. Declaration order is the ranking order, most severe first.
 */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    /**
     * True when this severity ranks above the other one.
     */
    public boolean outranks(Severity other) {
        return other == null || ordinal() < other.ordinal();
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    /**
     * Lenient parse; unknown or missing values fall back to LOW.
     */
    @JsonCreator
    public static Severity fromString(String value) {
        if (value == null || value.isBlank()) {
            return LOW;
        }
        for (Severity s : values()) {
            if (s.name().equalsIgnoreCase(value.trim())) {
                return s;
            }
        }
        return LOW;
    }
}
