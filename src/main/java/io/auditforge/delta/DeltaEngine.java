package io.auditforge.delta;

import io.auditforge.model.DeltaSummary;
import io.auditforge.model.EvolutionTag;
import io.auditforge.model.Finding;
import io.auditforge.model.FindingStatus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * File-level change classification between a prior run and the current tree, and the
 * re-classification of prior findings against it.
 */
public final class DeltaEngine {
    private final double massiveRewriteRatio;
    private final int majorChangeLines;

    public DeltaEngine(double massiveRewriteRatio, int majorChangeLines) {
        if (massiveRewriteRatio <= 0d || massiveRewriteRatio > 1d) {
            throw new IllegalArgumentException("massiveRewriteRatio must be in (0, 1]: " + massiveRewriteRatio);
        }
        this.massiveRewriteRatio = massiveRewriteRatio;
        this.majorChangeLines = Math.max(1, majorChangeLines);
    }

    /**
     * Every path of {@code priorFileIndex} and {@code currentFileSet} gets exactly one record.
     */
    public DeltaReport computeDelta(
            String fromRevision,
            String toRevision,
            Collection<String> priorFileIndex,
            Collection<String> currentFileSet,
            Map<String, FileChange> changes
    ) {
        Set<String> prior = new LinkedHashSet<>(priorFileIndex == null ? List.of() : priorFileIndex);
        Set<String> current = new LinkedHashSet<>(currentFileSet == null ? List.of() : currentFileSet);
        Map<String, FileChange> changed = changes == null ? Map.of() : changes;
        TreeSet<String> union = new TreeSet<>(prior);
        union.addAll(current);

        List<DeltaRecord> records = new ArrayList<>(union.size());
        int added = 0;
        int modified = 0;
        int deleted = 0;
        int unchanged = 0;
        for (String path : union) {
            boolean inPrior = prior.contains(path);
            boolean inCurrent = current.contains(path);
            if (inPrior && !inCurrent) {
                records.add(new DeltaRecord(path, ChangeKind.DELETED, null, 0));
                deleted++;
            } else if (!inPrior) {
                FileChange change = changed.get(path);
                records.add(new DeltaRecord(path, ChangeKind.ADDED, null, change == null ? 0 : change.changedLines()));
                added++;
            } else {
                FileChange change = changed.get(path);
                if (change == null || change.changedLines() == 0) {
                    records.add(new DeltaRecord(path, ChangeKind.UNCHANGED, null, 0));
                    unchanged++;
                } else {
                    records.add(new DeltaRecord(path, ChangeKind.MODIFIED, magnitude(change.changedLines()),
                            change.changedLines()));
                    modified++;
                }
            }
        }
        records.sort(Comparator.comparing(DeltaRecord::path));
        int priorTotal = prior.size();
        double ratio = changeRatio(modified + added, priorTotal);
        DeltaSummary summary = new DeltaSummary(added, modified, deleted, unchanged, priorTotal, ratio,
                ratio >= massiveRewriteRatio);
        return new DeltaReport(fromRevision, toRevision, records, summary);
    }

    /**
     * Maps prior findings through the delta. Pure: the inputs are not modified and applying it to its
     * own output yields the same tags.
     */
    public List<ReclassifiedFinding> reclassifyFindings(Collection<Finding> priorFindings, DeltaReport delta) {
        Map<String, DeltaRecord> byPath = delta.byPath();
        boolean massive = delta.massiveRewrite();
        List<ReclassifiedFinding> out = new ArrayList<>();
        for (Finding finding : priorFindings) {
            DeltaRecord record = finding.targetFile() == null ? null : byPath.get(finding.targetFile());
            ChangeKind kind = record == null ? null : record.kind();
            boolean dismissal = finding.status() == FindingStatus.NOT_VULNERABLE;
            ReclassifyTag tag;
            Finding mapped = finding;
            if (kind == ChangeKind.DELETED) {
                tag = ReclassifyTag.RESOLVED_BY_REMOVAL;
                mapped = finding.withEvolution(EvolutionTag.RESOLVED_BY_REMOVAL, finding.severity(),
                        finding.priorSeverity());
            } else if (kind == ChangeKind.UNCHANGED && !massive) {
                tag = ReclassifyTag.VERIFY;
            } else {
                tag = ReclassifyTag.RECHECK;
            }
            boolean carried = dismissal && tag == ReclassifyTag.VERIFY;
            out.add(new ReclassifiedFinding(mapped, tag, kind, carried));
        }
        out.sort(Comparator.comparing(r -> r.finding().id()));
        return out;
    }

    private ChangeMagnitude magnitude(int changedLines) {
        if (changedLines < 0) {
            return ChangeMagnitude.MAJOR;
        }
        return changedLines >= majorChangeLines ? ChangeMagnitude.MAJOR : ChangeMagnitude.MINOR;
    }

    static double changeRatio(int changedOrAdded, int priorTotal) {
        if (priorTotal <= 0) {
            return changedOrAdded > 0 ? 1.0d : 0.0d;
        }
        return (double) changedOrAdded / (double) priorTotal;
    }
}
