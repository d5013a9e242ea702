package io.auditforge.storage;

import io.auditforge.model.Phase;
import io.auditforge.model.PhaseStatus;

/**
 * Rejected phase transition. Never retried by the orchestrator.
 */
public class InvalidTransitionException extends IllegalStateException {
    private final Phase phase;
    private final PhaseStatus from;
    private final PhaseStatus to;

    public InvalidTransitionException(Phase phase, PhaseStatus from, PhaseStatus to, String message) {
        super(message);
        this.phase = phase;
        this.from = from;
        this.to = to;
    }

    public Phase phase() {
        return phase;
    }

    public PhaseStatus from() {
        return from;
    }

    public PhaseStatus to() {
        return to;
    }
}
