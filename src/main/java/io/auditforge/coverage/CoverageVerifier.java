package io.auditforge.coverage;

import io.auditforge.model.CoverageGap;
import io.auditforge.model.CoverageSummary;
import io.auditforge.model.GapKind;
import io.auditforge.model.GapPriority;
import io.auditforge.model.WorkItem;
import io.auditforge.model.WorkItemStatus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Set difference between what a phase declared and what its succeeded items touched.
 *
 * <p>Priorities: an externally reachable unit no item covered is CRITICAL; a unit some item attempted
 * without success is HIGH; any other uncovered unit is MEDIUM. Uncovered high-risk patterns are HIGH,
 * other patterns MEDIUM, checklist entries LOW.
 */
public final class CoverageVerifier {

    public CoverageReport verifyCoverage(DeclaredScope scope, Collection<WorkItem> processed) {
        DeclaredScope declared = scope == null ? DeclaredScope.empty() : scope;
        Set<String> coveredUnits = new HashSet<>();
        Set<String> attemptedUnits = new HashSet<>();
        Set<String> coveredPatterns = new HashSet<>();
        Set<String> coveredChecklist = new HashSet<>();
        for (WorkItem item : processed) {
            attemptedUnits.addAll(item.scope());
            if (item.status() != WorkItemStatus.SUCCEEDED) {
                continue;
            }
            coveredUnits.addAll(item.scope());
            coveredPatterns.addAll(item.patterns());
            coveredChecklist.addAll(item.checklist());
        }

        List<CoverageGap> gaps = new ArrayList<>();
        int unitHits = 0;
        for (DeclaredScope.ScopeUnit unit : declared.units()) {
            if (coveredUnits.contains(unit.id())) {
                unitHits++;
                continue;
            }
            boolean attempted = attemptedUnits.contains(unit.id());
            GapPriority priority;
            String reason;
            if (unit.externallyReachable() && !attempted) {
                priority = GapPriority.CRITICAL;
                reason = "externally reachable unit with no covering work item";
            } else if (attempted) {
                priority = GapPriority.HIGH;
                reason = "attempted but never succeeded";
            } else {
                priority = GapPriority.MEDIUM;
                reason = "internal unit not covered";
            }
            gaps.add(new CoverageGap(GapKind.SCOPE_UNIT, unit.id(), priority, reason, null));
        }
        int patternHits = 0;
        for (DeclaredScope.CatalogPattern pattern : declared.patterns()) {
            if (coveredPatterns.contains(pattern.id())) {
                patternHits++;
                continue;
            }
            gaps.add(new CoverageGap(GapKind.CATALOG_PATTERN, pattern.id(),
                    pattern.highRisk() ? GapPriority.HIGH : GapPriority.MEDIUM,
                    pattern.highRisk() ? "high-risk pattern not checked" : "pattern not checked", null));
        }
        int checklistHits = 0;
        for (String entry : declared.checklist()) {
            if (coveredChecklist.contains(entry)) {
                checklistHits++;
                continue;
            }
            gaps.add(new CoverageGap(GapKind.CHECKLIST, entry, GapPriority.LOW, "checklist entry not addressed", null));
        }
        gaps.sort(Comparator.comparing(CoverageGap::priority).thenComparing(CoverageGap::kind)
                .thenComparing(CoverageGap::ref));
        CoverageSummary summary = new CoverageSummary(
                ratio(unitHits, declared.units().size()),
                ratio(patternHits, declared.patterns().size()),
                ratio(checklistHits, declared.checklist().size()),
                false
        );
        return new CoverageReport(summary, gaps);
    }

    static double ratio(int hits, int declared) {
        return declared == 0 ? 1.0d : (double) hits / declared;
    }
}
