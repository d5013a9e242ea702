package io.auditforge.model;

public enum SynthesisMode {
    /** All reference material embedded in the worker input. */
    INLINE,
    /** Voluminous references replaced by file paths, findings still embedded. */
    PARTIAL_DISK,
    /** Findings trimmed to one-paragraph summaries with detail by path only. */
    DISK_HEAVY
}
