package io.auditforge.budget;

import io.auditforge.config.OrchestratorSettings;
import io.auditforge.model.Finding;
import io.auditforge.model.FindingStatus;
import io.auditforge.model.SynthesisMode;
import io.auditforge.model.Tier;
import io.auditforge.model.WorkItem;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Sizes batches from estimated input volume. Exact sizes are unknown until the referenced content
 * is read, so each item is estimated from fixed overheads plus a per-reference allowance.
 */
public final class ContextBudgetEstimator {
    static final long FINDING_TOKENS = 1_500L;
    static final long COLLAPSED_FINDING_TOKENS = 100L;
    private static final int SMALL_BATCH = 8;
    private static final int MEDIUM_BATCH = 5;
    private static final int LARGE_BATCH = 3;

    private final OrchestratorSettings settings;

    public ContextBudgetEstimator(OrchestratorSettings settings) {
        this.settings = settings;
    }

    public TokenEstimate estimate(WorkItem item) {
        return new TokenEstimate(
                item.id(),
                settings.templateOverheadTokens(),
                settings.perReferenceTokens() * item.scope().size(),
                settings.crossReferenceTokens()
        );
    }

    public List<TokenEstimate> estimateAll(Collection<WorkItem> items) {
        List<TokenEstimate> out = new ArrayList<>(items.size());
        for (WorkItem item : items) {
            out.add(estimate(item));
        }
        return out;
    }

    /**
     * Batch size from the average item estimate, capped by the tier ceiling and by
     * {@code maxConcurrency} when it is positive.
     */
    public int batchSizeFor(Collection<TokenEstimate> estimates, Tier tier, int maxConcurrency) {
        int size = SMALL_BATCH;
        if (!estimates.isEmpty()) {
            long sum = 0L;
            for (TokenEstimate estimate : estimates) {
                sum += estimate.total();
            }
            long average = sum / estimates.size();
            if (average > settings.largeItemTokens()) {
                size = LARGE_BATCH;
            } else if (average >= settings.smallItemTokens()) {
                size = MEDIUM_BATCH;
            }
        }
        if (tier != null) {
            size = Math.min(size, tier.batchCeiling());
        }
        if (maxConcurrency > 0) {
            size = Math.min(size, maxConcurrency);
        }
        return Math.max(1, size);
    }

    /**
     * Splits every item over the split threshold into two siblings with disjoint halves of its scope.
     * Both write the same output; the second one appends.
     */
    public List<WorkItem> splitOversized(List<WorkItem> items) {
        List<WorkItem> out = new ArrayList<>(items.size());
        for (WorkItem item : items) {
            if (estimate(item).total() <= settings.splitItemTokens() || item.scope().size() < 2) {
                out.add(item);
                continue;
            }
            int mid = (item.scope().size() + 1) / 2;
            List<String> first = item.scope().subList(0, mid);
            List<String> second = item.scope().subList(mid, item.scope().size());
            out.add(item.asSplit(item.id() + "-part1", first, item.id(), false));
            out.add(item.asSplit(item.id() + "-part2", second, item.id(), true));
        }
        return out;
    }

    public SynthesisMode selectMode(long totalEstimate) {
        if (totalEstimate < settings.inlineModeTokens()) {
            return SynthesisMode.INLINE;
        }
        if (totalEstimate <= settings.partialDiskModeTokens()) {
            return SynthesisMode.PARTIAL_DISK;
        }
        return SynthesisMode.DISK_HEAVY;
    }

    /**
     * Input volume of a synthesis phase: its items plus the findings it has to digest.
     */
    public long estimateSynthesis(Collection<WorkItem> items, Collection<Finding> findings) {
        long total = 0L;
        for (WorkItem item : items) {
            total += estimate(item).total();
        }
        for (Finding finding : findings) {
            total += finding.status() == FindingStatus.NOT_VULNERABLE ? COLLAPSED_FINDING_TOKENS : FINDING_TOKENS;
        }
        return total;
    }
}
