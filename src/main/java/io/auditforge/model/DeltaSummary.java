package io.auditforge.model;

public record DeltaSummary(
        int added,
        int modified,
        int deleted,
        int unchanged,
        int priorTotal,
        double changeRatio,
        boolean massiveRewrite
) {
}
