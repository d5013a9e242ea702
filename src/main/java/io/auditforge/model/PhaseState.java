package io.auditforge.model;

import java.util.ArrayList;
import java.util.List;

public record PhaseState(
        Phase phase,
        PhaseStatus status,
        int itemsTotal,
        int itemsCompleted,
        int itemsFailed,
        int batchesTotal,
        int batchesCompleted,
        int batchSize,
        int retriesUsed,
        SynthesisMode mode,
        List<QualityGap> qualityGaps,
        List<CoverageGap> coverageGaps,
        CoverageSummary coverage,
        long startedAtMs,
        long completedAtMs
) {
    public PhaseState {
        status = status == null ? PhaseStatus.PENDING : status;
        qualityGaps = qualityGaps == null ? List.of() : List.copyOf(qualityGaps);
        coverageGaps = coverageGaps == null ? List.of() : List.copyOf(coverageGaps);
    }

    public static PhaseState pending(Phase phase) {
        return new PhaseState(phase, PhaseStatus.PENDING, 0, 0, 0, 0, 0, 0, 0, null,
                List.of(), List.of(), null, 0L, 0L);
    }

    public PhaseState withStatus(PhaseStatus next, long nowMs) {
        long started = next == PhaseStatus.IN_PROGRESS && startedAtMs == 0L ? nowMs : startedAtMs;
        long completed = next == PhaseStatus.COMPLETE ? nowMs : completedAtMs;
        return new PhaseState(phase, next, itemsTotal, itemsCompleted, itemsFailed, batchesTotal, batchesCompleted,
                batchSize, retriesUsed, mode, qualityGaps, coverageGaps, coverage, started, completed);
    }

    public PhaseState withCounters(int total, int completed, int failed) {
        return new PhaseState(phase, status, total, completed, failed, batchesTotal, batchesCompleted,
                batchSize, retriesUsed, mode, qualityGaps, coverageGaps, coverage, startedAtMs, completedAtMs);
    }

    public PhaseState withBatches(int total, int completed, int size) {
        return new PhaseState(phase, status, itemsTotal, itemsCompleted, itemsFailed, total, completed,
                size, retriesUsed, mode, qualityGaps, coverageGaps, coverage, startedAtMs, completedAtMs);
    }

    public PhaseState withRetriesUsed(int used) {
        return new PhaseState(phase, status, itemsTotal, itemsCompleted, itemsFailed, batchesTotal, batchesCompleted,
                batchSize, used, mode, qualityGaps, coverageGaps, coverage, startedAtMs, completedAtMs);
    }

    public PhaseState withMode(SynthesisMode value) {
        return new PhaseState(phase, status, itemsTotal, itemsCompleted, itemsFailed, batchesTotal, batchesCompleted,
                batchSize, retriesUsed, value, qualityGaps, coverageGaps, coverage, startedAtMs, completedAtMs);
    }

    public PhaseState withQualityGap(QualityGap gap) {
        List<QualityGap> next = new ArrayList<>();
        for (QualityGap existing : qualityGaps) {
            if (!existing.itemId().equals(gap.itemId())) {
                next.add(existing);
            }
        }
        next.add(gap);
        return new PhaseState(phase, status, itemsTotal, itemsCompleted, itemsFailed, batchesTotal, batchesCompleted,
                batchSize, retriesUsed, mode, next, coverageGaps, coverage, startedAtMs, completedAtMs);
    }

    public PhaseState withCoverage(CoverageSummary summary, List<CoverageGap> gaps) {
        return new PhaseState(phase, status, itemsTotal, itemsCompleted, itemsFailed, batchesTotal, batchesCompleted,
                batchSize, retriesUsed, mode, qualityGaps, gaps, summary, startedAtMs, completedAtMs);
    }
}
