package io.auditforge.delta;

public enum ChangeKind {
    ADDED,
    MODIFIED,
    DELETED,
    UNCHANGED
}
