package com.overseer.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which completion heuristic produced a match.
 */
public enum MatchType {
    GLOBAL,
    CHECKBOX,
    DECLARATION,
    SEQUENCE,
    CODE;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
