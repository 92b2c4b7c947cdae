package com.overseer.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertHistoryEntry {

    private String id;
    private String supervisorName;
    private String message;
    private ResultStatus status;
    private long timestamp;
    private String chunkPreview;

    public AlertHistoryEntry() {
    }

    public AlertHistoryEntry(String id, String supervisorName, String message, ResultStatus status,
                             long timestamp, String chunkPreview) {
        this.id = id;
        this.supervisorName = supervisorName;
        this.message = message;
        this.status = status;
        this.timestamp = timestamp;
        this.chunkPreview = chunkPreview;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getSupervisorName() {
        return supervisorName;
    }

    public void setSupervisorName(String supervisorName) {
        this.supervisorName = supervisorName;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public ResultStatus getStatus() {
        return status;
    }

    public void setStatus(ResultStatus status) {
        this.status = status;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }

    public String getChunkPreview() {
        return chunkPreview;
    }

    public void setChunkPreview(String chunkPreview) {
        this.chunkPreview = chunkPreview;
    }

    @Override
    public String toString() {
        return "AlertHistoryEntry{" +
            "id='" + id + '\'' +
            ", supervisor='" + supervisorName + '\'' +
            ", message='" + message + '\'' +
            ", timestamp=" + timestamp +
            '}';
    }
}
