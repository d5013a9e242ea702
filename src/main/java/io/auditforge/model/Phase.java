package io.auditforge.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Pipeline stages in their strict execution order.
 */
public enum Phase {
    SCAN("scan"),
    ANALYZE("analyze"),
    SYNTHESIZE("synthesize"),
    INVESTIGATE("investigate"),
    REPORT("report"),
    VERIFY("verify");

    private final String dirName;

    Phase(String dirName) {
        this.dirName = dirName;
    }

    public String dirName() {
        return dirName;
    }

    /**
     * Phases whose worker outputs go through the quality gate.
     */
    public boolean qualityGated() {
        return this == ANALYZE || this == INVESTIGATE;
    }

    /**
     * Phases whose workers consume findings and run under a synthesis mode.
     */
    public boolean synthesis() {
        return this == SYNTHESIZE || this == REPORT;
    }

    public boolean producesFindings() {
        return this == INVESTIGATE;
    }

    public List<Phase> predecessors() {
        List<Phase> out = new ArrayList<>();
        for (Phase phase : values()) {
            if (phase.ordinal() >= ordinal()) {
                break;
            }
            out.add(phase);
        }
        return out;
    }

    public static Phase fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Phase is required");
        }
        for (Phase value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.dirName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown phase: " + raw);
    }
}
