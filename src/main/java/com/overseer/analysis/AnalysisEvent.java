package com.overseer.analysis;

import com.overseer.models.AnalysisResult;
import com.overseer.models.SupervisorResult;
import com.overseer.models.ThinkingChunk;

/**
 * Notification published by the {@link AnalysisScheduler}.
 */
public class AnalysisEvent {

    public enum Type {
        ANALYSIS_COMPLETE,
        ALERT,
        ANALYSIS_FAILED
    }

    private final Type type;
    private final ThinkingChunk chunk;
    private final AnalysisResult result;
    private final SupervisorResult alert;
    private final Throwable error;

    private AnalysisEvent(Type type, ThinkingChunk chunk, AnalysisResult result, SupervisorResult alert,
                          Throwable error) {
        this.type = type;
        this.chunk = chunk;
        this.result = result;
        this.alert = alert;
        this.error = error;
    }

    public static AnalysisEvent complete(ThinkingChunk chunk, AnalysisResult result) {
        return new AnalysisEvent(Type.ANALYSIS_COMPLETE, chunk, result, null, null);
    }

    public static AnalysisEvent alert(ThinkingChunk chunk, AnalysisResult result, SupervisorResult alert) {
        return new AnalysisEvent(Type.ALERT, chunk, result, alert, null);
    }

    public static AnalysisEvent failed(ThinkingChunk chunk, Throwable error) {
        return new AnalysisEvent(Type.ANALYSIS_FAILED, chunk, null, null, error);
    }

    public Type getType() {
        return type;
    }

    public ThinkingChunk getChunk() {
        return chunk;
    }

    public AnalysisResult getResult() {
        return result;
    }

    public SupervisorResult getAlert() {
        return alert;
    }

    public Throwable getError() {
        return error;
    }
}
