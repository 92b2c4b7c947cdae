package com.overseer;

import com.overseer.models.AlertHistoryEntry;
import com.overseer.models.StopDecision;
import com.overseer.models.TaskItem;
import com.overseer.scope.TaskScope;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Decides whether the supervised agent may stop. Stopping is refused while task items are
 * open or alerts were raised in the last five minutes, unless a one-shot bypass was granted.
 */
public class StopGate {

    public static final Duration ALERT_WINDOW = Duration.ofMinutes(5);
    static final int MAX_LISTED_ITEMS = 5;
    static final int MAX_LISTED_ALERTS = 3;
    private static final String COMPONENT = "StopGate";

    private final TaskScope scope;
    private final AlertHistory history;
    private final AtomicBoolean bypassNext = new AtomicBoolean(false);

    public StopGate(TaskScope scope, AlertHistory history) {
        this.scope = scope;
        this.history = history;
    }

    public StopDecision checkStop() {
        if (bypassNext.compareAndSet(true, false)) {
            AppLogger.info(COMPONENT, "Bypass active, allowing stop");
            return StopDecision.allow("Bypass granted");
        }

        TaskScope.Progress progress = scope.getProgress();
        List<String> pendingItems = new ArrayList<>();
        for (TaskItem item : scope.getPendingItems()) {
            pendingItems.add(item.getName());
        }
        List<AlertHistoryEntry> recentAlerts = history.getRecentAlerts(ALERT_WINDOW);

        List<String> reasons = new ArrayList<>();
        if (!pendingItems.isEmpty() && progress.getPercentage() < 100) {
            reasons.add("Task incomplete: " + pendingItems.size() + " pending item(s)");
        }
        if (!recentAlerts.isEmpty()) {
            reasons.add(recentAlerts.size() + " unresolved alert(s) in the last " + ALERT_WINDOW.toMinutes() + " minutes");
        }

        AppLogger.info(COMPONENT, "Stop check: progress " + progress.getPercentage() + "%, "
            + pendingItems.size() + " pending item(s), " + recentAlerts.size() + " recent alert(s)");

        if (reasons.isEmpty()) {
            return StopDecision.allow("Task complete. You may stop.");
        }

        List<String> alertMessages = new ArrayList<>();
        for (AlertHistoryEntry alert : recentAlerts.subList(0, Math.min(MAX_LISTED_ALERTS, recentAlerts.size()))) {
            alertMessages.add(alert.getMessage());
        }
        return StopDecision.deny(
            buildBlockMessage(reasons, pendingItems, alertMessages),
            pendingItems.subList(0, Math.min(MAX_LISTED_ITEMS, pendingItems.size())),
            alertMessages
        );
    }

    static String buildBlockMessage(List<String> reasons, List<String> pendingItems, List<String> alertMessages) {
        StringBuilder message = new StringBuilder("SUPERVISOR: stop blocked.\n\nReason(s):\n");
        for (String reason : reasons) {
            message.append("• ").append(reason).append('\n');
        }

        if (!pendingItems.isEmpty()) {
            message.append("\nPending items:\n");
            for (String item : pendingItems.subList(0, Math.min(MAX_LISTED_ITEMS, pendingItems.size()))) {
                message.append("  ○ ").append(item).append('\n');
            }
            if (pendingItems.size() > MAX_LISTED_ITEMS) {
                message.append("  ... and ").append(pendingItems.size() - MAX_LISTED_ITEMS).append(" more\n");
            }
        }

        if (!alertMessages.isEmpty()) {
            message.append("\nPending alerts:\n");
            for (String alert : alertMessages) {
                message.append("  ⚠ ").append(alert).append('\n');
            }
        }

        message.append("\nContinue working, or use /bypass to force a stop.");
        return message.toString();
    }

    /**
     * Let the next stop request through. Stays armed until a check consumes it.
     */
    public void allowNextStop() {
        bypassNext.set(true);
        AppLogger.info(COMPONENT, "Next stop will be allowed (bypass)");
    }

    public boolean isBypassActive() {
        return bypassNext.get();
    }

    public GateStatus getStatus() {
        TaskScope.Progress progress = scope.getProgress();
        int pendingCount = scope.getPendingItems().size();
        int alertCount = history.getRecentAlerts(ALERT_WINDOW).size();
        return new GateStatus(progress.getPercentage(), pendingCount, alertCount, bypassNext.get());
    }

    public static class GateStatus {
        private final int progress;
        private final int pendingItems;
        private final int pendingAlerts;
        private final boolean bypassActive;

        public GateStatus(int progress, int pendingItems, int pendingAlerts, boolean bypassActive) {
            this.progress = progress;
            this.pendingItems = pendingItems;
            this.pendingAlerts = pendingAlerts;
            this.bypassActive = bypassActive;
        }

        public boolean isRunning() {
            return true;
        }

        public int getProgress() {
            return progress;
        }

        public int getPendingItems() {
            return pendingItems;
        }

        public int getPendingAlerts() {
            return pendingAlerts;
        }

        public boolean isCanStop() {
            return pendingItems == 0 && pendingAlerts == 0;
        }

        public boolean isBypassActive() {
            return bypassActive;
        }
    }
}
