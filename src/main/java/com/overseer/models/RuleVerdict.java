package com.overseer.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Rule judge answer for one (text, check) pair.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RuleVerdict {

    private boolean violated;
    private String explanation;

    public RuleVerdict() {
    }

    public RuleVerdict(boolean violated, String explanation) {
        this.violated = violated;
        this.explanation = explanation;
    }

    public static RuleVerdict passed() {
        return new RuleVerdict(false, null);
    }

    public static RuleVerdict violated(String explanation) {
        return new RuleVerdict(true, explanation);
    }

    public boolean isViolated() {
        return violated;
    }

    public void setViolated(boolean violated) {
        this.violated = violated;
    }

    public String getExplanation() {
        return explanation;
    }

    public void setExplanation(String explanation) {
        this.explanation = explanation;
    }
}
