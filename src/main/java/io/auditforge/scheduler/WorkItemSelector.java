package io.auditforge.scheduler;

import io.auditforge.model.Phase;
import io.auditforge.model.RunState;
import io.auditforge.model.WorkItem;

import java.util.List;

/**
 * Decides what a phase analyzes. Only consulted the first time a phase registers its items.
 */
@FunctionalInterface
public interface WorkItemSelector {
    List<WorkItem> selectWorkItems(Phase phase, RunState state);
}
