package io.auditforge.model;

/**
 * Analysis output whose identity outlives the run that produced it.
 */
public record Finding(
        String id,
        FindingStatus status,
        Severity severity,
        String targetFile,
        String title,
        String summary,
        String detailPath,
        EvolutionTag evolution,
        Severity priorSeverity
) {
    public Finding {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("finding id cannot be empty");
        }
        status = status == null ? FindingStatus.NEEDS_REVIEW : status;
        severity = severity == null ? Severity.MEDIUM : severity;
    }

    public Finding withEvolution(EvolutionTag tag, Severity newSeverity, Severity previousSeverity) {
        return new Finding(id, status, newSeverity, targetFile, title, summary, detailPath, tag, previousSeverity);
    }

    public boolean active() {
        return evolution == null || evolution.active();
    }
}
