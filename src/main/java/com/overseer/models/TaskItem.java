package com.overseer.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class TaskItem {

    private String id;
    private String name;
    private ItemStatus status = ItemStatus.PENDING;

    public TaskItem() {
    }

    public TaskItem(String id, String name, ItemStatus status) {
        this.id = id;
        this.name = name;
        this.status = status != null ? status : ItemStatus.PENDING;
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status == ItemStatus.COMPLETED;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public ItemStatus getStatus() {
        return status;
    }

    public void setStatus(ItemStatus status) {
        this.status = status;
    }

    @Override
    public String toString() {
        return "TaskItem{" +
            "id='" + id + '\'' +
            ", name='" + name + '\'' +
            ", status=" + status +
            '}';
    }
}
