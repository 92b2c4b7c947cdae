package com.overseer.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SupervisorKind {
    ROUTER,
    COORDINATOR,
    SPECIALIST;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    /**
     * Returns null for a blank value so validation can report it; unknown names map to SPECIALIST.
     */
    @JsonCreator
    public static SupervisorKind fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (SupervisorKind k : values()) {
            if (k.name().equalsIgnoreCase(value.trim())) {
                return k;
            }
        }
        return SPECIALIST;
    }
}
