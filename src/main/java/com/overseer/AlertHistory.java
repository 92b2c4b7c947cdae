package com.overseer;

import com.overseer.models.AlertHistoryEntry;
import com.overseer.models.ResultStatus;
import com.overseer.models.SupervisorResult;
import com.overseer.storage.JsonStorage;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;

/**
 * Bounded log of past alerts, newest first. Every insertion is written to disk;
 * when the file cannot be read or written the history keeps working in memory.
 */
public class AlertHistory {

    public static final int MAX_SIZE = 100;
    public static final int PREVIEW_LENGTH = 200;

    private final Deque<AlertHistoryEntry> entries = new ArrayDeque<>();
    private final Path storagePath;
    private final Clock clock;

    public AlertHistory(Path storagePath) {
        this(storagePath, Clock.systemUTC());
    }

    public AlertHistory(Path storagePath, Clock clock) {
        this.storagePath = storagePath;
        this.clock = clock;
        loadFromDisk();
    }

    /**
     * In-memory history with no backing file.
     */
    public static AlertHistory inMemory() {
        return new AlertHistory(null);
    }

    public AlertHistoryEntry record(SupervisorResult result, String chunkContent) {
        String message = result.getMessage() != null ? result.getMessage() : "Alert without message";
        AlertHistoryEntry entry = new AlertHistoryEntry(
            "alert-" + UUID.randomUUID(),
            result.getSupervisorName(),
            message,
            result.getStatus(),
            clock.millis(),
            preview(chunkContent)
        );
        add(entry);
        return entry;
    }

    public void add(AlertHistoryEntry entry) {
        synchronized (entries) {
            entries.addFirst(entry);
            while (entries.size() > MAX_SIZE) {
                entries.removeLast();
            }
        }
        saveAll();
    }

    /**
     * All entries, newest first.
     */
    public List<AlertHistoryEntry> getAll() {
        synchronized (entries) {
            return new ArrayList<>(entries);
        }
    }

    public List<AlertHistoryEntry> getBySupervisor(String supervisorName) {
        List<AlertHistoryEntry> results = new ArrayList<>();
        for (AlertHistoryEntry entry : getAll()) {
            if (supervisorName != null && supervisorName.equals(entry.getSupervisorName())) {
                results.add(entry);
            }
        }
        return results;
    }

    /**
     * Entries with status alert recorded within the given window.
     */
    public List<AlertHistoryEntry> getRecentAlerts(Duration window) {
        long cutoff = clock.millis() - window.toMillis();
        List<AlertHistoryEntry> results = new ArrayList<>();
        for (AlertHistoryEntry entry : getAll()) {
            if (entry.getStatus() == ResultStatus.ALERT && entry.getTimestamp() > cutoff) {
                results.add(entry);
            }
        }
        return results;
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
        saveAll();
        AppLogger.info("AlertHistory", "Alert history cleared");
    }

    static String preview(String content) {
        if (content == null) {
            return "";
        }
        if (content.length() <= PREVIEW_LENGTH) {
            return content;
        }
        return content.substring(0, PREVIEW_LENGTH) + "...";
    }

    private void loadFromDisk() {
        if (storagePath == null) {
            return;
        }
        if (!Files.exists(storagePath)) {
            AppLogger.info("AlertHistory", "No alert history at " + storagePath + "; starting empty.");
            return;
        }
        try {
            List<AlertHistoryEntry> stored = JsonStorage.readJsonList(storagePath, AlertHistoryEntry[].class);
            synchronized (entries) {
                Iterator<AlertHistoryEntry> it = stored.iterator();
                while (it.hasNext() && entries.size() < MAX_SIZE) {
                    entries.addLast(it.next());
                }
            }
            AppLogger.info("AlertHistory", "Loaded " + size() + " alert(s) from disk.");
        } catch (Exception e) {
            AppLogger.warn("AlertHistory", "Failed to load alert history from " + storagePath + ": " + e.getMessage());
        }
    }

    private synchronized void saveAll() {
        if (storagePath == null) {
            return;
        }
        try {
            JsonStorage.writeJsonList(storagePath, getAll());
        } catch (Exception e) {
            AppLogger.warn("AlertHistory", "Failed to save alert history to " + storagePath + ": " + e.getMessage());
        }
    }
}
