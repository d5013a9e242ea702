package io.auditforge.worker;

/**
 * Black-box analysis task. Writes its artifact to {@link WorkerContext#outputPath()} and reports
 * a terminal outcome; the scheduler enforces the wall-clock ceiling.
 */
public interface Worker {
    String id();

    WorkerResult execute(WorkerContext context) throws Exception;
}
