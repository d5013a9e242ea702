package io.auditforge.coverage;

import io.auditforge.model.CoverageGap;
import io.auditforge.model.CoverageSummary;

import java.util.List;

public record CoverageReport(
        CoverageSummary summary,
        List<CoverageGap> gaps
) {
    public CoverageReport {
        gaps = gaps == null ? List.of() : List.copyOf(gaps);
    }

    public List<CoverageGap> dispatchableGaps() {
        return gaps.stream().filter(gap -> gap.priority().dispatchable()).toList();
    }
}
