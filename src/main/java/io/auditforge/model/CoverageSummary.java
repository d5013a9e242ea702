package io.auditforge.model;

/**
 * Coverage ratios in {@code [0, 1]}; a dimension with nothing declared counts as fully covered.
 */
public record CoverageSummary(
        double scopeCoverage,
        double patternCoverage,
        double checklistCoverage,
        boolean supplementalDispatched
) {
}
