package io.auditforge.scheduler;

import io.auditforge.model.Batch;
import io.auditforge.model.Phase;
import io.auditforge.model.WorkItem;

import java.util.List;

/**
 * Hooks around one batch. {@code afterBatch} runs once the batch outcome is durable.
 */
public interface BatchListener {
    BatchListener NONE = new BatchListener() {
    };

    default void beforeBatch(Phase phase, Batch batch) {
    }

    default void afterBatch(Phase phase, Batch batch, List<WorkItem> results) {
    }
}
