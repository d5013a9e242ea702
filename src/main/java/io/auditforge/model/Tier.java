package io.auditforge.model;

/**
 * Coarse sizing preset. The ceiling caps how many work items of one batch may run at once.
 */
public enum Tier {
    QUICK("quick", 8),
    STANDARD("standard", 5),
    DEEP("deep", 3);

    private final String label;
    private final int batchCeiling;

    Tier(String label, int batchCeiling) {
        this.label = label;
        this.batchCeiling = batchCeiling;
    }

    public String label() {
        return label;
    }

    public int batchCeiling() {
        return batchCeiling;
    }

    public static Tier fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return STANDARD;
        }
        for (Tier value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.label.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown tier: " + raw);
    }
}
