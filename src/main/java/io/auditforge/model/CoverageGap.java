package io.auditforge.model;

public record CoverageGap(
        GapKind kind,
        String ref,
        GapPriority priority,
        String reason,
        String followUpItemId
) {
    public CoverageGap withFollowUp(String itemId) {
        return new CoverageGap(kind, ref, priority, reason, itemId);
    }
}
