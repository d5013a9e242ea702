package io.auditforge.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The single persisted document describing one run.
 */
public record RunState(
        String schema,
        long runId,
        long createdAtMs,
        long updatedAtMs,
        RunConfig config,
        String revision,
        List<String> fileIndex,
        PriorRunRef prior,
        Map<Phase, PhaseState> phases,
        Map<String, WorkItem> items
) {
    public static final String SCHEMA = "auditforge.state.v1";

    public RunState {
        fileIndex = fileIndex == null ? List.of() : List.copyOf(fileIndex);
        LinkedHashMap<Phase, PhaseState> orderedPhases = new LinkedHashMap<>();
        for (Phase phase : Phase.values()) {
            PhaseState state = phases == null ? null : phases.get(phase);
            orderedPhases.put(phase, state == null ? PhaseState.pending(phase) : state);
        }
        phases = Collections.unmodifiableMap(orderedPhases);
        items = items == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(items));
    }

    public static RunState fresh(long runId, long nowMs, RunConfig config, String revision,
                                 List<String> fileIndex, PriorRunRef prior) {
        return new RunState(SCHEMA, runId, nowMs, nowMs, config, revision, fileIndex, prior, null, null);
    }

    public PhaseState phase(Phase phase) {
        return phases.get(phase);
    }

    public RunState withPhase(PhaseState state) {
        LinkedHashMap<Phase, PhaseState> next = new LinkedHashMap<>(phases);
        next.put(state.phase(), state);
        return new RunState(schema, runId, createdAtMs, updatedAtMs, config, revision, fileIndex, prior, next, items);
    }

    public RunState withItems(Collection<WorkItem> updated) {
        LinkedHashMap<String, WorkItem> next = new LinkedHashMap<>(items);
        for (WorkItem item : updated) {
            next.put(itemKey(item.phase(), item.id()), item);
        }
        return new RunState(schema, runId, createdAtMs, updatedAtMs, config, revision, fileIndex, prior, phases, next);
    }

    /**
     * Item ids are unique within a phase; the same plan may be reused by several phases.
     */
    public static String itemKey(Phase phase, String itemId) {
        return phase.dirName() + "/" + itemId;
    }

    public Optional<WorkItem> item(Phase phase, String itemId) {
        return Optional.ofNullable(items.get(itemKey(phase, itemId)));
    }

    public RunState touched(long nowMs) {
        return new RunState(schema, runId, createdAtMs, nowMs, config, revision, fileIndex, prior, phases, items);
    }

    /**
     * Items of one phase in batch order, registration order inside a batch.
     */
    public List<WorkItem> itemsFor(Phase phase) {
        List<WorkItem> out = new ArrayList<>();
        for (WorkItem item : items.values()) {
            if (item.phase() == phase) {
                out.add(item);
            }
        }
        out.sort(Comparator.comparingInt(WorkItem::batch));
        return out;
    }

    public Phase currentPhase() {
        Phase current = Phase.SCAN;
        for (PhaseState state : phases.values()) {
            if (state.status() == PhaseStatus.IN_PROGRESS) {
                return state.phase();
            }
            if (state.status() == PhaseStatus.COMPLETE) {
                current = state.phase();
            }
        }
        return current;
    }
}
