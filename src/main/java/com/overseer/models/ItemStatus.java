package com.overseer.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ItemStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ItemStatus fromString(String value) {
        if (value == null) {
            return PENDING;
        }
        for (ItemStatus s : values()) {
            if (s.name().equalsIgnoreCase(value.trim())) {
                return s;
            }
        }
        return PENDING;
    }
}
