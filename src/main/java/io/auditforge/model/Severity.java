package io.auditforge.model;

public enum Severity {
    INFO,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * One level up, saturating at {@link #CRITICAL}.
     */
    public Severity escalate() {
        Severity[] all = values();
        return ordinal() + 1 < all.length ? all[ordinal() + 1] : CRITICAL;
    }

    public static Severity fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return MEDIUM;
        }
        for (Severity value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + raw);
    }
}
