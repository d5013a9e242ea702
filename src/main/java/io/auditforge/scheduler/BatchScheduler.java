package io.auditforge.scheduler;

import io.auditforge.budget.ContextBudgetEstimator;
import io.auditforge.config.AuditForgeConfig;
import io.auditforge.config.OrchestratorSettings;
import io.auditforge.model.Batch;
import io.auditforge.model.Phase;
import io.auditforge.model.PhaseState;
import io.auditforge.model.PhaseStatus;
import io.auditforge.model.RunState;
import io.auditforge.model.WorkItem;
import io.auditforge.model.WorkItemStatus;
import io.auditforge.observability.AuditLogger;
import io.auditforge.storage.StateStore;
import io.auditforge.worker.Worker;
import io.auditforge.worker.WorkerContext;
import io.auditforge.worker.WorkerRegistry;
import io.auditforge.worker.WorkerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Partitions a phase into ordered batches and drives them one at a time. Members of a batch run
 * concurrently; the batch ends when every member is terminal or has hit the wall-clock ceiling.
 *
 * <p>State is persisted before dispatch (members RUNNING) and after the join, so a crash anywhere
 * inside a batch resumes by re-dispatching only that batch's unsettled members.
 */
public final class BatchScheduler {
    private static final Logger LOG = LoggerFactory.getLogger(BatchScheduler.class);
    public static final String SYNTHESIS_INPUT_FILE = "synthesis-input.json";

    private final AuditForgeConfig config;
    private final StateStore store;
    private final WorkerRegistry workers;
    private final ContextBudgetEstimator estimator;
    private final AuditLogger journal;
    private final OrchestratorSettings settings;

    public BatchScheduler(
            AuditForgeConfig config,
            StateStore store,
            WorkerRegistry workers,
            ContextBudgetEstimator estimator,
            AuditLogger journal,
            OrchestratorSettings settings
    ) {
        this.config = config;
        this.store = store;
        this.workers = workers;
        this.estimator = estimator;
        this.journal = journal;
        this.settings = settings;
    }

    /**
     * Registers {@code proposed} on first entry, then runs every batch not yet completed.
     * On re-entry the proposed list is ignored in favour of the registered items.
     */
    public PhaseResult runPhase(Phase phase, List<WorkItem> proposed, BatchListener listener) {
        BatchListener hooks = listener == null ? BatchListener.NONE : listener;
        RunState state = store.transitionPhase(phase, PhaseStatus.IN_PROGRESS);
        if (state.itemsFor(phase).isEmpty() && proposed != null && !proposed.isEmpty()) {
            state = register(state, phase, proposed);
        }
        int total = state.phase(phase).batchesTotal();
        for (int number = state.phase(phase).batchesCompleted() + 1; number <= total; number++) {
            List<WorkItem> members = membersOf(state, phase, number);
            Batch batch = new Batch(number, members.size(), members.stream().map(WorkItem::id).toList());
            List<WorkItem> pending = new ArrayList<>();
            for (WorkItem item : members) {
                if (dispatchable(item)) {
                    pending.add(item);
                }
            }
            hooks.beforeBatch(phase, batch);
            if (pending.isEmpty()) {
                LOG.debug("Batch {}/{} of {} has no pending members", number, total, phase);
            } else {
                LOG.info("Dispatching batch {}/{} of {} ({} of {} members)",
                        number, total, phase, pending.size(), members.size());
                dispatch(phase, pending);
            }
            state = store.require();
            PhaseState phaseState = state.phase(phase);
            state = state.withPhase(phaseState.withBatches(phaseState.batchesTotal(), number, phaseState.batchSize()))
                    .touched(now());
            store.save(state);
            journal.log(AuditLogger.AuditEvent.of("batch.complete", "phase:" + phase.dirName(), "ok",
                    state.runId(), phase.name(), null, Map.of("batch", number, "batches_total", total)));
            hooks.afterBatch(phase, batch, membersOf(state, phase, number));
        }
        return PhaseResult.from(store.require().phase(phase));
    }

    /**
     * Runs the given items as one concurrent group and persists their outcomes. Used for regular
     * batches, quality retries and the coverage supplemental batch.
     */
    public List<WorkItem> dispatch(Phase phase, List<WorkItem> items) {
        if (items.isEmpty()) {
            return List.of();
        }
        RunState state = store.require();
        long startedAt = now();
        List<WorkItem> running = new ArrayList<>(items.size());
        for (WorkItem item : items) {
            running.add(item.withStatus(WorkItemStatus.RUNNING, null, startedAt));
        }
        state = recount(state.withItems(running), phase).touched(startedAt);
        store.save(state);
        journal.log(AuditLogger.AuditEvent.of("batch.dispatch", "phase:" + phase.dirName(), "started",
                state.runId(), phase.name(), null,
                Map.of("items", running.stream().map(WorkItem::id).toList())));

        Map<String, Future<WorkerResult>> futures = new LinkedHashMap<>();
        ExecutorService pool = Executors.newFixedThreadPool(running.size(), daemonThreads(phase));
        List<WorkItem> finished = new ArrayList<>(running.size());
        try {
            for (WorkItem item : running) {
                Optional<Worker> worker = workers.findById(item.workerClass());
                if (worker.isEmpty()) {
                    continue;
                }
                WorkerContext context = contextFor(state, phase, item);
                Future<WorkerResult> creator = item.splitOf() == null || !item.appendOutput()
                        ? null
                        : futures.get(item.splitOf() + "-part1");
                futures.put(item.id(), pool.submit(() -> {
                    awaitCreator(item, creator);
                    return worker.get().execute(context);
                }));
            }
            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(settings.itemTimeoutMs());
            for (WorkItem item : running) {
                Future<WorkerResult> future = futures.get(item.id());
                if (future == null) {
                    finished.add(fail(phase, item, state.runId(), "unknown worker class: " + item.workerClass()));
                    continue;
                }
                finished.add(join(phase, item, future, deadline, state.runId()));
            }
        } finally {
            pool.shutdownNow();
        }

        RunState latest = store.require();
        latest = recount(latest.withItems(finished), phase).touched(now());
        store.save(latest);
        return finished;
    }

    /**
     * Rebuilds the phase counters from its items.
     */
    public static RunState recount(RunState state, Phase phase) {
        int total = 0;
        int succeeded = 0;
        int failed = 0;
        for (WorkItem item : state.itemsFor(phase)) {
            total++;
            if (item.status() == WorkItemStatus.SUCCEEDED) {
                succeeded++;
            } else if (item.status() == WorkItemStatus.FAILED) {
                failed++;
            }
        }
        PhaseState phaseState = state.phase(phase);
        return state.withPhase(phaseState.withCounters(total, succeeded, failed));
    }

    static boolean dispatchable(WorkItem item) {
        if (item.settled()) {
            return false;
        }
        return switch (item.status()) {
            case QUEUED, RUNNING -> true;
            case FAILED -> item.retryCount() == 0;
            default -> false;
        };
    }

    public Path defaultOutputPath(Phase phase, String itemId) {
        return config.phaseDir(phase).resolve(itemId + ".md");
    }

    private RunState register(RunState state, Phase phase, List<WorkItem> proposed) {
        String defaultWorker = state.config().workerClassFor(phase,
                settings.workerClasses().getOrDefault(phase.name(), settings.defaultWorkerClass()));
        List<WorkItem> normalized = new ArrayList<>(proposed.size());
        for (WorkItem item : proposed) {
            String worker = item.workerClass() == null || item.workerClass().isBlank() ? defaultWorker : item.workerClass();
            String output = item.outputPath() == null || item.outputPath().isBlank()
                    ? defaultOutputPath(phase, item.id()).toString()
                    : config.rootDir().resolve(item.outputPath()).normalize().toString();
            normalized.add(item.withPhase(phase, worker, output));
        }
        List<WorkItem> split = estimator.splitOversized(normalized);
        int size = estimator.batchSizeFor(estimator.estimateAll(split), state.config().tier(),
                state.config().maxConcurrency());
        List<WorkItem> numbered = new ArrayList<>(split.size());
        long nowMs = now();
        for (int i = 0; i < split.size(); i++) {
            numbered.add(split.get(i).withBatch(i / size + 1).withStatus(WorkItemStatus.QUEUED, null, nowMs));
        }
        int batches = (numbered.size() + size - 1) / size;
        RunState next = state.withItems(numbered);
        PhaseState phaseState = next.phase(phase);
        next = recount(next.withPhase(phaseState.withBatches(batches, 0, size)), phase).touched(nowMs);
        store.save(next);
        LOG.info("Registered {} items for {} in {} batches of up to {}", numbered.size(), phase, batches, size);
        journal.log(AuditLogger.AuditEvent.of("phase.register", "phase:" + phase.dirName(), "ok",
                next.runId(), phase.name(), null,
                Map.of("items", numbered.size(), "batches", batches, "batch_size", size,
                        "split", numbered.size() - normalized.size())));
        return next;
    }

    private WorkItem join(Phase phase, WorkItem item, Future<WorkerResult> future, long deadlineNanos, long runId) {
        try {
            long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
            WorkerResult result = future.get(remaining, TimeUnit.NANOSECONDS);
            if (result != null && result.success()) {
                return item.withStatus(WorkItemStatus.SUCCEEDED, null, now());
            }
            return fail(phase, item, runId, result == null ? "worker returned no result" : result.error());
        } catch (TimeoutException e) {
            future.cancel(true);
            return fail(phase, item, runId, "timeout after " + settings.itemTimeoutMs() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return fail(phase, item, runId, cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new RuntimeException("Interrupted while waiting for work item " + item.id(), e);
        }
    }

    /**
     * The appending half of a split item must not start writing before the creating half is done.
     */
    private static void awaitCreator(WorkItem item, Future<WorkerResult> creator) throws InterruptedException {
        if (creator == null) {
            return;
        }
        try {
            creator.get();
        } catch (ExecutionException e) {
            LOG.debug("Creator of split item {} failed, appending anyway", item.id(), e.getCause());
        }
    }

    private WorkItem fail(Phase phase, WorkItem item, long runId, String error) {
        LOG.warn("Work item {} of {} failed: {}", item.id(), phase, error);
        journal.log(AuditLogger.AuditEvent.of("item.failed", "item:" + item.id(), "failed",
                runId, phase.name(), item.id(), Map.of("error", error == null ? "" : error)));
        return item.withStatus(WorkItemStatus.FAILED, error, now());
    }

    private WorkerContext contextFor(RunState state, Phase phase, WorkItem item) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("phaseDir", config.phaseDir(phase).toString());
        putIfExists(attributes, "delta", config.deltaFile());
        putIfExists(attributes, "reclassifiedFindings", config.reclassifiedFindingsFile());
        putIfExists(attributes, "synthesisInput", config.phaseDir(phase).resolve(SYNTHESIS_INPUT_FILE));
        return new WorkerContext(
                state.runId(),
                phase,
                item.id(),
                item.scope(),
                item.patterns(),
                item.checklist(),
                Path.of(item.outputPath()),
                item.appendOutput(),
                item.feedback(),
                item.retryCount() + 1,
                state.phase(phase).mode(),
                attributes
        );
    }

    private static void putIfExists(Map<String, String> attributes, String key, Path file) {
        if (Files.exists(file)) {
            attributes.put(key, file.toString());
        }
    }

    private static List<WorkItem> membersOf(RunState state, Phase phase, int batch) {
        List<WorkItem> out = new ArrayList<>();
        for (WorkItem item : state.itemsFor(phase)) {
            if (item.batch() == batch) {
                out.add(item);
            }
        }
        return out;
    }

    private static ThreadFactory daemonThreads(Phase phase) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "auditforge-" + phase.dirName() + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static long now() {
        return Instant.now().toEpochMilli();
    }
}
