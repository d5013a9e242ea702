package io.auditforge.delta;

public enum ChangeMagnitude {
    MINOR,
    MAJOR
}
