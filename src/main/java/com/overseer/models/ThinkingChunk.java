package com.overseer.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.UUID;

/**
 * One fragment of streamed reasoning text submitted for analysis.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ThinkingChunk {

    private String id;
    private String content;
    private long timestamp;
    private String messageId;

    public ThinkingChunk() {
    }

    public ThinkingChunk(String id, String content, long timestamp, String messageId) {
        this.id = id;
        this.content = content;
        this.timestamp = timestamp;
        this.messageId = messageId;
    }

    public static ThinkingChunk of(String content) {
        return new ThinkingChunk(UUID.randomUUID().toString(), content, System.currentTimeMillis(), null);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }

    public String getMessageId() {
        return messageId;
    }

    public void setMessageId(String messageId) {
        this.messageId = messageId;
    }
}
