package io.auditforge.model;

public enum GapPriority {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    public boolean dispatchable() {
        return this == CRITICAL || this == HIGH;
    }
}
