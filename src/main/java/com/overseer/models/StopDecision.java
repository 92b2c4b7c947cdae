package com.overseer.models;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Answer to a stop request from the supervised agent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StopDecision {

    private final boolean allow;
    private final String message;
    private final List<String> pendingItems;
    private final List<String> pendingAlerts;

    private StopDecision(boolean allow, String message, List<String> pendingItems, List<String> pendingAlerts) {
        this.allow = allow;
        this.message = message;
        this.pendingItems = pendingItems;
        this.pendingAlerts = pendingAlerts;
    }

    public static StopDecision allow(String message) {
        return new StopDecision(true, message, null, null);
    }

    public static StopDecision deny(String message, List<String> pendingItems, List<String> pendingAlerts) {
        return new StopDecision(false, message, List.copyOf(pendingItems), List.copyOf(pendingAlerts));
    }

    public boolean isAllow() {
        return allow;
    }

    public String getMessage() {
        return message;
    }

    public List<String> getPendingItems() {
        return pendingItems;
    }

    public List<String> getPendingAlerts() {
        return pendingAlerts;
    }
}
