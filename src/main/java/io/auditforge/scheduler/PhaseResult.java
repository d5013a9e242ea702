package io.auditforge.scheduler;

import io.auditforge.model.CoverageGap;
import io.auditforge.model.CoverageSummary;
import io.auditforge.model.Phase;
import io.auditforge.model.PhaseState;
import io.auditforge.model.PhaseStatus;
import io.auditforge.model.QualityGap;
import io.auditforge.model.SynthesisMode;

import java.util.List;

public record PhaseResult(
        Phase phase,
        PhaseStatus status,
        int itemsTotal,
        int itemsSucceeded,
        int itemsFailed,
        int batchesTotal,
        int batchesCompleted,
        int batchSize,
        int retriesUsed,
        SynthesisMode mode,
        List<QualityGap> qualityGaps,
        List<CoverageGap> coverageGaps,
        CoverageSummary coverage
) {
    public static PhaseResult from(PhaseState state) {
        return new PhaseResult(
                state.phase(),
                state.status(),
                state.itemsTotal(),
                state.itemsCompleted(),
                state.itemsFailed(),
                state.batchesTotal(),
                state.batchesCompleted(),
                state.batchSize(),
                state.retriesUsed(),
                state.mode(),
                state.qualityGaps(),
                state.coverageGaps(),
                state.coverage()
        );
    }
}
