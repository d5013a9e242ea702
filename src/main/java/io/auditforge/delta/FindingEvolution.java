package io.auditforge.delta;

import io.auditforge.model.EvolutionTag;
import io.auditforge.model.Finding;
import io.auditforge.model.FindingStatus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tags the findings of the current run against the latest ledger projection.
 *
 * <ul>
 *   <li>unknown id: NEW</li>
 *   <li>previously RESOLVED: REGRESSION, severity one level above the recorded prior severity</li>
 *   <li>otherwise: RECURRENT</li>
 * </ul>
 * Prior active findings that were not reported again become RESOLVED, or RESOLVED_BY_REMOVAL when
 * their file was deleted.
 */
public final class FindingEvolution {
    private FindingEvolution() {
    }

    public static Outcome evolve(Collection<Finding> priorLatest, Collection<Finding> current, DeltaReport delta) {
        Map<String, Finding> prior = new LinkedHashMap<>();
        for (Finding finding : priorLatest) {
            prior.put(finding.id(), finding);
        }
        List<Finding> tagged = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (Finding finding : current) {
            if (!seen.add(finding.id())) {
                continue;
            }
            Finding before = prior.get(finding.id());
            if (before == null) {
                tagged.add(finding.withEvolution(EvolutionTag.NEW, finding.severity(), null));
            } else if (before.evolution() == EvolutionTag.RESOLVED) {
                tagged.add(finding.withEvolution(EvolutionTag.REGRESSION, before.severity().escalate(), before.severity()));
            } else {
                tagged.add(finding.withEvolution(EvolutionTag.RECURRENT, finding.severity(), before.severity()));
            }
        }
        List<Finding> resolved = new ArrayList<>();
        for (Finding before : prior.values()) {
            if (seen.contains(before.id()) || !before.active() || before.status() == FindingStatus.NOT_VULNERABLE) {
                continue;
            }
            boolean removed = delta != null && delta.recordFor(before.targetFile())
                    .map(r -> r.kind() == ChangeKind.DELETED)
                    .orElse(false);
            EvolutionTag tag = removed ? EvolutionTag.RESOLVED_BY_REMOVAL : EvolutionTag.RESOLVED;
            resolved.add(before.withEvolution(tag, before.severity(), before.severity()));
        }
        return new Outcome(tagged, resolved);
    }

    public record Outcome(
            List<Finding> current,
            List<Finding> resolved
    ) {
        public List<Finding> all() {
            List<Finding> out = new ArrayList<>(current);
            out.addAll(resolved);
            return out;
        }
    }
}
