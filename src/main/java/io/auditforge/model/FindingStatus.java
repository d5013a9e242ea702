package io.auditforge.model;

public enum FindingStatus {
    CONFIRMED,
    POTENTIAL,
    NOT_VULNERABLE,
    NEEDS_REVIEW;

    public static FindingStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return NEEDS_REVIEW;
        }
        String normalized = raw.trim().replace('-', '_');
        for (FindingStatus value : values()) {
            if (value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown finding status: " + raw);
    }
}
