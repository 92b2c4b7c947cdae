package com.overseer.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Optional context passed alongside a chunk: what the agent was asked to do and how far it got.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisContext {

    private String originalRequest;
    private String progress;

    public AnalysisContext() {
    }

    public AnalysisContext(String originalRequest, String progress) {
        this.originalRequest = originalRequest;
        this.progress = progress;
    }

    @JsonIgnore
    public boolean hasOriginalRequest() {
        return originalRequest != null && !originalRequest.isBlank();
    }

    public String getOriginalRequest() {
        return originalRequest;
    }

    public void setOriginalRequest(String originalRequest) {
        this.originalRequest = originalRequest;
    }

    public String getProgress() {
        return progress;
    }

    public void setProgress(String progress) {
        this.progress = progress;
    }
}
