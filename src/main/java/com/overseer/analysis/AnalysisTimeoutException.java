package com.overseer.analysis;

/**
 * The tree traversal for a chunk did not finish before its deadline. Judge calls that were
 * still running keep going; their results are dropped.
 */
public class AnalysisTimeoutException extends RuntimeException {

    private final String chunkId;
    private final long timeoutMs;

    public AnalysisTimeoutException(String chunkId, long timeoutMs) {
        super("Analysis of chunk " + chunkId + " timed out after " + timeoutMs + "ms");
        this.chunkId = chunkId;
        this.timeoutMs = timeoutMs;
    }

    public String getChunkId() {
        return chunkId;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
