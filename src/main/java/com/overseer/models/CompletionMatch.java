package com.overseer.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Evidence that a task item was finished.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CompletionMatch {

    private final String itemId;
    private final String itemName;
    private final String evidence;
    private final double confidence;
    private final MatchType matchType;

    public CompletionMatch(String itemId, String itemName, String evidence, double confidence, MatchType matchType) {
        this.itemId = itemId;
        this.itemName = itemName;
        this.evidence = evidence;
        this.confidence = confidence;
        this.matchType = matchType;
    }

    public static CompletionMatch forItem(TaskItem item, String evidence, double confidence, MatchType matchType) {
        return new CompletionMatch(item.getId(), item.getName(), evidence, confidence, matchType);
    }

    /**
     * Key used to suppress repeated detections of the same item.
     */
    @JsonIgnore
    public String dedupKey() {
        return itemId != null ? itemId : itemName;
    }

    public String getItemId() {
        return itemId;
    }

    public String getItemName() {
        return itemName;
    }

    public String getEvidence() {
        return evidence;
    }

    public double getConfidence() {
        return confidence;
    }

    public MatchType getMatchType() {
        return matchType;
    }

    @Override
    public String toString() {
        return "CompletionMatch{" +
            "item='" + itemName + '\'' +
            ", type=" + matchType +
            ", confidence=" + confidence +
            '}';
    }
}
