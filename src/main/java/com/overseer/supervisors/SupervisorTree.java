package com.overseer.supervisors;

import com.overseer.AppLogger;
import com.overseer.models.Rule;
import com.overseer.models.SupervisorConfig;
import com.overseer.models.SupervisorKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the supervisor hierarchy: a single root router, every node reachable from it,
 * an id index and the child-to-parent lookup. Structure changes are serialized on the
 * tree and are not expected while an analysis is running.
 */
public class SupervisorTree {

    public static final String ROOT_ID = "root-router";
    private static final String COMPONENT = "SupervisorTree";

    private final SupervisorNode root;
    private final Map<String, SupervisorNode> index = new ConcurrentHashMap<>();
    private final Map<String, String> parentIds = new ConcurrentHashMap<>();

    public SupervisorTree() {
        this.root = new SupervisorNode(ROOT_ID, "Router", SupervisorKind.ROUTER, Set.of(), List.of(), true);
        index.put(ROOT_ID, root);
    }

    public SupervisorNode getRoot() {
        return root;
    }

    /**
     * Attach a new node under the configured parent. An unknown parent id falls back to
     * the root router.
     *
     * @throws IllegalArgumentException when the config is invalid or the id is taken
     */
    public synchronized SupervisorNode addNode(SupervisorConfig config) {
        List<String> errors = SupervisorConfigLoader.validate(config);
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException(String.join("; ", errors));
        }
        if (index.containsKey(config.getId())) {
            throw new IllegalArgumentException("Duplicate supervisor id: " + config.getId());
        }

        SupervisorNode parent = root;
        if (config.getParentId() != null && !config.getParentId().isBlank()) {
            SupervisorNode found = index.get(config.getParentId());
            if (found != null) {
                parent = found;
            } else {
                AppLogger.warn(COMPONENT, "Parent " + config.getParentId() + " not found for "
                    + config.getId() + "; attaching to root");
            }
        }

        SupervisorNode node = SupervisorNode.fromConfig(config);
        parent.addChild(node);
        index.put(node.getId(), node);
        parentIds.put(node.getId(), parent.getId());
        return node;
    }

    /**
     * Add every config, resolving parents declared later in the list. Entries that cannot
     * be added are reported, not thrown.
     */
    public synchronized List<String> addAll(List<SupervisorConfig> configs) {
        List<String> errors = new ArrayList<>();
        List<SupervisorConfig> remaining = new ArrayList<>(configs);
        boolean progressed = true;

        while (!remaining.isEmpty() && progressed) {
            progressed = false;
            for (int i = 0; i < remaining.size(); i++) {
                SupervisorConfig config = remaining.get(i);
                String parentId = config.getParentId();
                boolean parentReady = parentId == null || parentId.isBlank() || index.containsKey(parentId)
                    || remaining.stream().noneMatch(c -> parentId.equals(c.getId()));
                if (!parentReady) {
                    continue;
                }
                remaining.remove(i--);
                progressed = true;
                try {
                    addNode(config);
                } catch (IllegalArgumentException e) {
                    errors.add(e.getMessage());
                }
            }
        }

        // parent cycles: attach what is left to the root
        for (SupervisorConfig config : remaining) {
            errors.add("Parent cycle involving " + config.getId() + "; attached to root");
            config.setParentId(null);
            try {
                addNode(config);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        return errors;
    }

    /**
     * Detach a node and its whole subtree. The root cannot be removed.
     */
    public synchronized boolean removeNode(String id) {
        if (id == null || ROOT_ID.equals(id)) {
            return false;
        }
        String parentId = parentIds.get(id);
        SupervisorNode node = index.get(id);
        if (parentId == null || node == null) {
            return false;
        }
        index.get(parentId).removeChild(id);
        unindex(node);
        return true;
    }

    private void unindex(SupervisorNode node) {
        for (SupervisorNode child : node.getChildren()) {
            unindex(child);
        }
        index.remove(node.getId());
        parentIds.remove(node.getId());
    }

    public synchronized boolean setEnabled(String id, boolean enabled) {
        SupervisorNode node = index.get(id);
        if (node == null) {
            return false;
        }
        node.setEnabled(enabled);
        return true;
    }

    public synchronized boolean addRule(String nodeId, Rule rule) {
        SupervisorNode node = index.get(nodeId);
        if (node == null) {
            return false;
        }
        node.addRule(rule);
        return true;
    }

    public synchronized boolean removeRule(String nodeId, String ruleId) {
        SupervisorNode node = index.get(nodeId);
        return node != null && node.removeRule(ruleId);
    }

    public synchronized boolean toggleRule(String nodeId, String ruleId, boolean enabled) {
        SupervisorNode node = index.get(nodeId);
        return node != null && node.toggleRule(ruleId, enabled);
    }

    public Optional<SupervisorNode> findNode(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(index.get(id));
    }

    public Optional<SupervisorNode> getParent(String id) {
        String parentId = id == null ? null : parentIds.get(id);
        return parentId == null ? Optional.empty() : Optional.ofNullable(index.get(parentId));
    }

    public int size() {
        return index.size();
    }

    public TreeStats getStats() {
        TreeStats stats = new TreeStats();
        accumulate(root, stats);
        return stats;
    }

    private void accumulate(SupervisorNode node, TreeStats stats) {
        stats.totalNodes++;
        if (node.isEnabled()) {
            stats.activeNodes++;
        }
        stats.totalRules += node.getEnabledRules().size();
        stats.totalCalls += node.getCallCount();
        stats.totalAlerts += node.getAlertCount();
        for (SupervisorNode child : node.getChildren()) {
            accumulate(child, stats);
        }
    }

    /**
     * Nested id/name/kind/enabled/rulesCount/children view of the hierarchy.
     */
    public Map<String, Object> describe() {
        return describe(root);
    }

    private Map<String, Object> describe(SupervisorNode node) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", node.getId());
        view.put("name", node.getName());
        view.put("kind", node.getKind().value());
        view.put("enabled", node.isEnabled());
        view.put("rulesCount", node.getRules().size());
        view.put("callCount", node.getCallCount());
        view.put("alertCount", node.getAlertCount());
        List<Map<String, Object>> children = new ArrayList<>();
        for (SupervisorNode child : node.getChildren()) {
            children.add(describe(child));
        }
        view.put("children", children);
        return view;
    }

    public static class TreeStats {
        private int totalNodes;
        private int activeNodes;
        private int totalRules;
        private long totalCalls;
        private long totalAlerts;

        public int getTotalNodes() {
            return totalNodes;
        }

        public int getActiveNodes() {
            return activeNodes;
        }

        public int getTotalRules() {
            return totalRules;
        }

        public long getTotalCalls() {
            return totalCalls;
        }

        public long getTotalAlerts() {
            return totalAlerts;
        }
    }
}
