package io.auditforge.model;

public enum GapKind {
    SCOPE_UNIT,
    CATALOG_PATTERN,
    CHECKLIST
}
