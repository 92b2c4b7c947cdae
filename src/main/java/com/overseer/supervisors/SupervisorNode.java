package com.overseer.supervisors;

import com.overseer.models.Rule;
import com.overseer.models.SupervisorConfig;
import com.overseer.models.SupervisorKind;
import com.overseer.models.SupervisorResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One node of the supervisor tree. The kind decides how {@link NodeAnalyzer} treats it;
 * the node itself only carries configuration, its owned children and its counters.
 * Parent links live in {@link SupervisorTree}.
 */
public class SupervisorNode {

    private final String id;
    private final String name;
    private final SupervisorKind kind;
    private final Set<String> keywords;
    private final List<Rule> rules = new CopyOnWriteArrayList<>();
    private final List<SupervisorNode> children = new CopyOnWriteArrayList<>();
    private volatile boolean enabled;

    private final AtomicLong callCount = new AtomicLong();
    private final AtomicLong alertCount = new AtomicLong();
    private volatile SupervisorResult lastResult;

    public SupervisorNode(String id, String name, SupervisorKind kind, Set<String> keywords,
                          List<Rule> rules, boolean enabled) {
        this.id = id;
        this.name = name;
        this.kind = kind;
        this.keywords = keywords != null
            ? Collections.unmodifiableSet(new LinkedHashSet<>(keywords))
            : Set.of();
        if (rules != null) {
            this.rules.addAll(rules);
        }
        this.enabled = enabled;
    }

    public static SupervisorNode fromConfig(SupervisorConfig config) {
        return new SupervisorNode(
            config.getId(),
            config.getName(),
            config.getType() != null ? config.getType() : SupervisorKind.SPECIALIST,
            new LinkedHashSet<>(config.getKeywords()),
            config.getRules(),
            config.isEnabled()
        );
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public SupervisorKind getKind() {
        return kind;
    }

    public Set<String> getKeywords() {
        return keywords;
    }

    public boolean isEnabled() {
        return enabled;
    }

    void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<Rule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    public List<Rule> getEnabledRules() {
        List<Rule> enabledRules = new ArrayList<>();
        for (Rule rule : rules) {
            if (rule.isEnabled()) {
                enabledRules.add(rule);
            }
        }
        return enabledRules;
    }

    void addRule(Rule rule) {
        rules.add(rule);
    }

    boolean removeRule(String ruleId) {
        return rules.removeIf(r -> r.getId() != null && r.getId().equals(ruleId));
    }

    boolean toggleRule(String ruleId, boolean ruleEnabled) {
        for (Rule rule : rules) {
            if (rule.getId() != null && rule.getId().equals(ruleId)) {
                rule.setEnabled(ruleEnabled);
                return true;
            }
        }
        return false;
    }

    public List<SupervisorNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    void addChild(SupervisorNode child) {
        children.add(child);
    }

    boolean removeChild(String childId) {
        return children.removeIf(c -> c.getId().equals(childId));
    }

    void recordResult(SupervisorResult result) {
        callCount.incrementAndGet();
        if (result.isAlert()) {
            alertCount.incrementAndGet();
        }
        lastResult = result;
    }

    public long getCallCount() {
        return callCount.get();
    }

    public long getAlertCount() {
        return alertCount.get();
    }

    public SupervisorResult getLastResult() {
        return lastResult;
    }

    @Override
    public String toString() {
        return kind.value() + ":" + id;
    }
}
