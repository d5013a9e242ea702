package io.auditforge.model;

public enum WorkItemStatus {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    NEEDS_RETRY;

    public boolean terminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
