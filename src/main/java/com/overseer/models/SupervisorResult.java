package com.overseer.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of one supervisor invocation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SupervisorResult {

    private String supervisorId;
    private String supervisorName;
    private ResultStatus status = ResultStatus.OK;
    private Severity severity;
    private String message;
    private String evidenceSnippet;
    private long timestamp;
    private long processingTimeMs;

    public SupervisorResult() {
    }

    public static SupervisorResult ok(String supervisorId, String supervisorName, long startedAt) {
        SupervisorResult result = new SupervisorResult();
        result.supervisorId = supervisorId;
        result.supervisorName = supervisorName;
        result.status = ResultStatus.OK;
        result.timestamp = System.currentTimeMillis();
        result.processingTimeMs = result.timestamp - startedAt;
        return result;
    }

    public static SupervisorResult alert(String supervisorId, String supervisorName, Severity severity,
                                         String message, String evidenceSnippet, long startedAt) {
        SupervisorResult result = new SupervisorResult();
        result.supervisorId = supervisorId;
        result.supervisorName = supervisorName;
        result.status = ResultStatus.ALERT;
        result.severity = severity;
        result.message = message;
        result.evidenceSnippet = evidenceSnippet;
        result.timestamp = System.currentTimeMillis();
        result.processingTimeMs = result.timestamp - startedAt;
        return result;
    }

    @JsonIgnore
    public boolean isAlert() {
        return status == ResultStatus.ALERT;
    }

    public String getSupervisorId() {
        return supervisorId;
    }

    public void setSupervisorId(String supervisorId) {
        this.supervisorId = supervisorId;
    }

    public String getSupervisorName() {
        return supervisorName;
    }

    public void setSupervisorName(String supervisorName) {
        this.supervisorName = supervisorName;
    }

    public ResultStatus getStatus() {
        return status;
    }

    public void setStatus(ResultStatus status) {
        this.status = status;
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getEvidenceSnippet() {
        return evidenceSnippet;
    }

    public void setEvidenceSnippet(String evidenceSnippet) {
        this.evidenceSnippet = evidenceSnippet;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }

    public long getProcessingTimeMs() {
        return processingTimeMs;
    }

    public void setProcessingTimeMs(long processingTimeMs) {
        this.processingTimeMs = processingTimeMs;
    }

    @Override
    public String toString() {
        return "SupervisorResult{" +
            "supervisor='" + supervisorName + '\'' +
            ", status=" + status +
            ", severity=" + severity +
            ", message='" + message + '\'' +
            '}';
    }
}
