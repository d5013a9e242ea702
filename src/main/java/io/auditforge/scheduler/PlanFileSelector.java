package io.auditforge.scheduler;

import io.auditforge.coverage.DeclaredScope;
import io.auditforge.model.Phase;
import io.auditforge.model.RunState;
import io.auditforge.model.WorkItem;
import io.auditforge.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads work items and the declared scope of a phase from a plan file.
 */
public final class PlanFileSelector implements WorkItemSelector {
    private final PlanFile plan;

    public PlanFileSelector(PlanFile plan) {
        this.plan = plan;
    }

    public static PlanFileSelector load(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Plan file not found: " + file);
        }
        try {
            PlanFile plan = Jsons.mapper().readValue(file.toFile(), PlanFile.class);
            return new PlanFileSelector(plan == null ? new PlanFile(List.of(), null) : plan);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read plan file: " + file, e);
        }
    }

    @Override
    public List<WorkItem> selectWorkItems(Phase phase, RunState state) {
        List<WorkItem> out = new ArrayList<>(plan.items().size());
        Set<String> seen = new HashSet<>();
        for (PlanFile.PlanItem item : plan.items()) {
            if (item.id() == null || item.id().isBlank()) {
                throw new IllegalArgumentException("Plan item without id");
            }
            if (!seen.add(item.id())) {
                throw new IllegalArgumentException("Duplicate plan item id: " + item.id());
            }
            out.add(WorkItem.queued(item.id(), phase, item.worker(), item.scope(), item.patterns(),
                    item.checklist(), item.output()));
        }
        return out;
    }

    public DeclaredScope declaredScope() {
        return plan.scope();
    }
}
