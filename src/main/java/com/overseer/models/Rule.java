package com.overseer.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Rule {

    private String id;
    private String description;
    private Severity severity = Severity.LOW;
    private String check;
    @JsonProperty("example_violation")
    private String exampleViolation;
    private boolean enabled = true;

    public Rule() {
    }

    public Rule(String id, String description, Severity severity, String check) {
        this.id = id;
        this.description = description;
        this.severity = severity != null ? severity : Severity.LOW;
        this.check = check;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity != null ? severity : Severity.LOW;
    }

    public String getCheck() {
        return check;
    }

    public void setCheck(String check) {
        this.check = check;
    }

    public String getExampleViolation() {
        return exampleViolation;
    }

    public void setExampleViolation(String exampleViolation) {
        this.exampleViolation = exampleViolation;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public String toString() {
        return "Rule{" +
            "id='" + id + '\'' +
            ", severity=" + severity +
            ", enabled=" + enabled +
            '}';
    }
}
