package com.overseer.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ResultStatus {
    OK,
    ALERT;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ResultStatus fromString(String value) {
        return "alert".equalsIgnoreCase(value) ? ALERT : OK;
    }
}
