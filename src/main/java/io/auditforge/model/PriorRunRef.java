package io.auditforge.model;

public record PriorRunRef(
        long runId,
        String revision,
        String archiveDir,
        DeltaSummary delta
) {
}
