package com.stacker.task;

import java.io.Serializable;

/**
 * Outcome of executing one {@link IndexTask}, written to the result topic.
 * Carries either the number of documents written (on success) or the error (on failure).
 */
public class IndexTaskResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private String taskId;
    private IndexTaskType type;
    private boolean success;
    private long documents;
    private String errorMessage;
    private long durationMs;
    private long timestamp;

    public IndexTaskResult() {
    }

    public static IndexTaskResult success(IndexTask task, long documents, long durationMs) {
        IndexTaskResult result = of(task, durationMs);
        result.success = true;
        result.documents = documents;
        return result;
    }

    public static IndexTaskResult failure(IndexTask task, String errorMessage, long durationMs) {
        IndexTaskResult result = of(task, durationMs);
        result.success = false;
        result.errorMessage = errorMessage;
        return result;
    }

    private static IndexTaskResult of(IndexTask task, long durationMs) {
        IndexTaskResult result = new IndexTaskResult();
        result.taskId = task.getTaskId();
        result.type = task.getType();
        result.durationMs = durationMs;
        result.timestamp = System.currentTimeMillis();
        return result;
    }

    public String getTaskId() {
        return taskId;
    }

    public void setTaskId(String taskId) {
        this.taskId = taskId;
    }

    public IndexTaskType getType() {
        return type;
    }

    public void setType(IndexTaskType type) {
        this.type = type;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public long getDocuments() {
        return documents;
    }

    public void setDocuments(long documents) {
        this.documents = documents;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }

    @Override
    public String toString() {
        return "IndexTaskResult{taskId='" + taskId + "', type=" + type + ", success=" + success +
                ", documents=" + documents + "}";
    }
}
