package io.auditforge.model;

public enum EvolutionTag {
    NEW,
    RECURRENT,
    REGRESSION,
    RESOLVED,
    RESOLVED_BY_REMOVAL;

    /**
     * Resolved findings are kept in the ledger but no longer tracked as active.
     */
    public boolean active() {
        return this != RESOLVED && this != RESOLVED_BY_REMOVAL;
    }
}
