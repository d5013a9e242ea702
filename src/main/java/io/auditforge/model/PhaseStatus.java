package io.auditforge.model;

public enum PhaseStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETE
}
