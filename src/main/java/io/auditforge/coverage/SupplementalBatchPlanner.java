package io.auditforge.coverage;

import io.auditforge.model.CoverageGap;
import io.auditforge.model.GapKind;
import io.auditforge.model.Phase;
import io.auditforge.model.WorkItem;
import io.auditforge.util.Hashing;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns CRITICAL and HIGH gaps into synthetic work items for one extra batch. Gaps past the cap, and
 * all MEDIUM/LOW gaps, are recorded without follow-up.
 */
public final class SupplementalBatchPlanner {

    public Plan plan(Phase phase, List<CoverageGap> gaps, int batchNumber, int cap, String workerClass, Path outputDir) {
        List<WorkItem> items = new ArrayList<>();
        List<CoverageGap> annotated = new ArrayList<>(gaps.size());
        for (CoverageGap gap : gaps) {
            if (!gap.priority().dispatchable() || items.size() >= cap) {
                annotated.add(gap);
                continue;
            }
            String id = syntheticId(gap);
            List<String> scope = gap.kind() == GapKind.SCOPE_UNIT ? List.of(gap.ref()) : List.of();
            List<String> patterns = gap.kind() == GapKind.CATALOG_PATTERN ? List.of(gap.ref()) : List.of();
            WorkItem item = WorkItem.queued(id, phase, workerClass, scope, patterns, List.of(),
                            outputDir.resolve(id + ".md").toString())
                    .withBatch(batchNumber)
                    .asSynthetic();
            items.add(item);
            annotated.add(gap.withFollowUp(id));
        }
        return new Plan(items, annotated);
    }

    static String syntheticId(CoverageGap gap) {
        return "gap-" + gap.kind().name().toLowerCase(Locale.ROOT).replace('_', '-') + "-" + Hashing.shortHash(gap.ref());
    }

    public record Plan(
            List<WorkItem> items,
            List<CoverageGap> gaps
    ) {
    }
}
