package io.auditforge.model;

import java.util.List;

/**
 * One worker invocation inside a phase.
 *
 * <p>{@code splitOf} and {@code appendOutput} mark the second half of an oversized item: both halves
 * share {@code outputPath}, the first creates it and the appender extends it.
 */
public record WorkItem(
        String id,
        Phase phase,
        String workerClass,
        List<String> scope,
        List<String> patterns,
        List<String> checklist,
        String outputPath,
        WorkItemStatus status,
        int retryCount,
        int batch,
        String lastError,
        Integer score,
        boolean qualityGap,
        String feedback,
        String splitOf,
        boolean appendOutput,
        boolean synthetic,
        long updatedAtMs
) {
    public WorkItem {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("work item id cannot be empty");
        }
        scope = scope == null ? List.of() : List.copyOf(scope);
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        checklist = checklist == null ? List.of() : List.copyOf(checklist);
        status = status == null ? WorkItemStatus.QUEUED : status;
    }

    public static WorkItem queued(
            String id,
            Phase phase,
            String workerClass,
            List<String> scope,
            List<String> patterns,
            List<String> checklist,
            String outputPath
    ) {
        return new WorkItem(id, phase, workerClass, scope, patterns, checklist, outputPath,
                WorkItemStatus.QUEUED, 0, 0, null, null, false, null, null, false, false, 0L);
    }

    public WorkItem withStatus(WorkItemStatus next, String error, long nowMs) {
        return new WorkItem(id, phase, workerClass, scope, patterns, checklist, outputPath, next, retryCount, batch,
                error, score, qualityGap, feedback, splitOf, appendOutput, synthetic, nowMs);
    }

    public WorkItem withBatch(int number) {
        return new WorkItem(id, phase, workerClass, scope, patterns, checklist, outputPath, status, retryCount, number,
                lastError, score, qualityGap, feedback, splitOf, appendOutput, synthetic, updatedAtMs);
    }

    public WorkItem withPhase(Phase value, String worker, String output) {
        return new WorkItem(id, value, worker, scope, patterns, checklist, output, status, retryCount, batch,
                lastError, score, qualityGap, feedback, splitOf, appendOutput, synthetic, updatedAtMs);
    }

    public WorkItem withScore(int value) {
        return new WorkItem(id, phase, workerClass, scope, patterns, checklist, outputPath, status, retryCount, batch,
                lastError, value, qualityGap, feedback, splitOf, appendOutput, synthetic, updatedAtMs);
    }

    /**
     * Queues the single allowed re-execution. The retry augments the existing output.
     */
    public WorkItem forRetry(String retryFeedback, long nowMs) {
        return new WorkItem(id, phase, workerClass, scope, patterns, checklist, outputPath, WorkItemStatus.NEEDS_RETRY,
                retryCount + 1, batch, lastError, null, false, retryFeedback, splitOf, true, synthetic, nowMs);
    }

    public WorkItem acceptedWithGap(long nowMs) {
        return new WorkItem(id, phase, workerClass, scope, patterns, checklist, outputPath, status, retryCount, batch,
                lastError, score, true, feedback, splitOf, appendOutput, synthetic, nowMs);
    }

    public WorkItem asSplit(String newId, List<String> half, String parentId, boolean appender) {
        return new WorkItem(newId, phase, workerClass, half, patterns, checklist, outputPath, status, retryCount, batch,
                lastError, score, qualityGap, feedback, parentId, appender, synthetic, updatedAtMs);
    }

    public WorkItem asSynthetic() {
        return new WorkItem(id, phase, workerClass, scope, patterns, checklist, outputPath, status, retryCount, batch,
                lastError, score, qualityGap, feedback, splitOf, appendOutput, true, updatedAtMs);
    }

    /**
     * Terminal and not eligible for another dispatch in the fan-out loop.
     */
    public boolean settled() {
        return status == WorkItemStatus.SUCCEEDED || qualityGap;
    }
}
