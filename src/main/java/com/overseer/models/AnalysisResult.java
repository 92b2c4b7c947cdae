package com.overseer.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Union of the tree result and the behavior result for one chunk.
 */
public class AnalysisResult {

    private final String chunkId;
    private final String thinkingChunk;
    private final List<SupervisorResult> results;
    private final long totalTimeMs;
    private final long timestamp;
    private final boolean queued;

    public AnalysisResult(String chunkId, String thinkingChunk, List<SupervisorResult> results,
                          long totalTimeMs, boolean queued) {
        this.chunkId = chunkId;
        this.thinkingChunk = thinkingChunk;
        this.results = results != null ? Collections.unmodifiableList(new ArrayList<>(results)) : List.of();
        this.totalTimeMs = totalTimeMs;
        this.timestamp = System.currentTimeMillis();
        this.queued = queued;
    }

    /**
     * Placeholder handed back when the chunk was queued behind an in-flight analysis.
     */
    public static AnalysisResult queued(ThinkingChunk chunk) {
        return new AnalysisResult(chunk.getId(), chunk.getContent(), List.of(), 0, true);
    }

    @JsonIgnore
    public List<SupervisorResult> getAlerts() {
        List<SupervisorResult> alerts = new ArrayList<>();
        for (SupervisorResult result : results) {
            if (result.isAlert()) {
                alerts.add(result);
            }
        }
        return alerts;
    }

    public String getChunkId() {
        return chunkId;
    }

    public String getThinkingChunk() {
        return thinkingChunk;
    }

    public List<SupervisorResult> getResults() {
        return results;
    }

    public long getTotalTimeMs() {
        return totalTimeMs;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public boolean isQueued() {
        return queued;
    }
}
