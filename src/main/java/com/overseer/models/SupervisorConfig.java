package com.overseer.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Declarative description of one supervisor node, as loaded from a configuration source.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SupervisorConfig {

    private String id;
    private String name;
    private SupervisorKind type;
    private String parentId;
    private List<String> keywords = new ArrayList<>();
    private List<Rule> rules = new ArrayList<>();
    private boolean enabled = true;

    public SupervisorConfig() {
    }

    public SupervisorConfig(String id, String name, SupervisorKind type) {
        this.id = id;
        this.name = name;
        this.type = type;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public SupervisorKind getType() {
        return type;
    }

    public void setType(SupervisorKind type) {
        this.type = type;
    }

    public String getParentId() {
        return parentId;
    }

    public void setParentId(String parentId) {
        this.parentId = parentId;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public void setKeywords(List<String> keywords) {
        this.keywords = keywords != null ? keywords : new ArrayList<>();
    }

    public List<Rule> getRules() {
        return rules;
    }

    public void setRules(List<Rule> rules) {
        this.rules = rules != null ? rules : new ArrayList<>();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public SupervisorConfig keywords(String... values) {
        this.keywords = new ArrayList<>(List.of(values));
        return this;
    }

    public SupervisorConfig rule(Rule rule) {
        this.rules.add(rule);
        return this;
    }

    public SupervisorConfig parent(String parentId) {
        this.parentId = parentId;
        return this;
    }
}
