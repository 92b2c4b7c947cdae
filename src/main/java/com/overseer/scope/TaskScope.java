package com.overseer.scope;

import com.overseer.AppLogger;
import com.overseer.models.CompletionMatch;
import com.overseer.models.ItemStatus;
import com.overseer.models.TaskItem;

import java.util.ArrayList;
import java.util.List;

/**
 * Work items of the active task and their status.
 * <p>
 * Status only moves forward (pending, in progress, completed). The one exception: making an
 * item current puts any other in-progress item back to pending, so at most one item is in
 * progress at a time. Callers receive copies; the scope is changed only through its methods.
 */
public class TaskScope {

    private static final String COMPONENT = "TaskScope";

    private final List<TaskItem> items = new ArrayList<>();
    private String taskName;
    private int nextId = 1;

    /**
     * Replace the current task with a new one built from item names.
     */
    public synchronized void start(String taskName, List<String> itemNames) {
        items.clear();
        nextId = 1;
        this.taskName = taskName;
        if (itemNames != null) {
            for (String name : itemNames) {
                if (name != null && !name.isBlank()) {
                    addItemInternal(name.trim());
                }
            }
        }
        AppLogger.info(COMPONENT, "Task started: " + taskName + " (" + items.size() + " items)");
    }

    public synchronized TaskItem addItem(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Item name is required");
        }
        return copy(addItemInternal(name.trim()));
    }

    private TaskItem addItemInternal(String name) {
        TaskItem item = new TaskItem("item-" + nextId++, name, ItemStatus.PENDING);
        items.add(item);
        return item;
    }

    public synchronized boolean removeItem(String id) {
        return items.removeIf(item -> item.getId().equals(id));
    }

    /**
     * Mark an item as the one being worked on. Completed items stay completed.
     */
    public synchronized boolean setCurrentItem(String id) {
        TaskItem target = find(id);
        if (target == null) {
            return false;
        }
        for (TaskItem item : items) {
            if (item != target && item.getStatus() == ItemStatus.IN_PROGRESS) {
                item.setStatus(ItemStatus.PENDING);
            }
        }
        if (target.getStatus() == ItemStatus.PENDING) {
            target.setStatus(ItemStatus.IN_PROGRESS);
        }
        return true;
    }

    /**
     * Move an item forward. Returns false for unknown items and backward moves.
     */
    public synchronized boolean updateItemStatus(String id, ItemStatus status) {
        TaskItem item = find(id);
        if (item == null || status == null || status.ordinal() < item.getStatus().ordinal()) {
            return false;
        }
        if (status == ItemStatus.IN_PROGRESS) {
            return setCurrentItem(id);
        }
        item.setStatus(status);
        return true;
    }

    /**
     * Complete the item a detector match points at, by id or else by name.
     */
    public synchronized boolean applyCompletion(CompletionMatch match) {
        if (match == null) {
            return false;
        }
        TaskItem item = match.getItemId() != null ? find(match.getItemId()) : null;
        if (item == null && match.getItemName() != null) {
            for (TaskItem candidate : items) {
                if (candidate.getName().equalsIgnoreCase(match.getItemName())) {
                    item = candidate;
                    break;
                }
            }
        }
        if (item == null || item.isCompleted()) {
            return false;
        }
        item.setStatus(ItemStatus.COMPLETED);
        AppLogger.info(COMPONENT, "Item completed: " + item.getName() + " (" + match.getMatchType()
            + ", confidence " + match.getConfidence() + ")");
        return true;
    }

    public synchronized List<TaskItem> getItems() {
        List<TaskItem> snapshot = new ArrayList<>();
        for (TaskItem item : items) {
            snapshot.add(copy(item));
        }
        return snapshot;
    }

    public synchronized List<TaskItem> getPendingItems() {
        List<TaskItem> pending = new ArrayList<>();
        for (TaskItem item : items) {
            if (!item.isCompleted()) {
                pending.add(copy(item));
            }
        }
        return pending;
    }

    public synchronized Progress getProgress() {
        int completed = 0;
        TaskItem current = null;
        for (TaskItem item : items) {
            if (item.isCompleted()) {
                completed++;
            } else if (item.getStatus() == ItemStatus.IN_PROGRESS) {
                current = item;
            }
        }
        int total = items.size();
        int percentage = total == 0 ? 0 : (int) Math.round(completed * 100.0 / total);
        return new Progress(completed, total, percentage, current != null ? current.getName() : null);
    }

    /**
     * True when no item is left to do, including when there are no items at all.
     */
    public synchronized boolean isComplete() {
        for (TaskItem item : items) {
            if (!item.isCompleted()) {
                return false;
            }
        }
        return true;
    }

    public synchronized String getTaskName() {
        return taskName;
    }

    public synchronized void clear() {
        items.clear();
        taskName = null;
        nextId = 1;
    }

    private TaskItem find(String id) {
        if (id == null) {
            return null;
        }
        for (TaskItem item : items) {
            if (item.getId().equals(id)) {
                return item;
            }
        }
        return null;
    }

    private static TaskItem copy(TaskItem item) {
        return new TaskItem(item.getId(), item.getName(), item.getStatus());
    }

    public static class Progress {
        private final int completed;
        private final int total;
        private final int percentage;
        private final String currentItem;

        public Progress(int completed, int total, int percentage, String currentItem) {
            this.completed = completed;
            this.total = total;
            this.percentage = percentage;
            this.currentItem = currentItem;
        }

        public int getCompleted() {
            return completed;
        }

        public int getTotal() {
            return total;
        }

        public int getPercentage() {
            return percentage;
        }

        public String getCurrentItem() {
            return currentItem;
        }
    }
}
