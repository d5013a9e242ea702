package io.auditforge.quality;

import io.auditforge.config.OrchestratorSettings;
import io.auditforge.model.Phase;
import io.auditforge.model.PhaseState;
import io.auditforge.model.QualityGap;
import io.auditforge.model.RunState;
import io.auditforge.model.WorkItem;
import io.auditforge.model.WorkItemStatus;
import io.auditforge.observability.AuditLogger;
import io.auditforge.scheduler.BatchScheduler;
import io.auditforge.storage.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Scores phase outputs and grants each low-scoring item at most one augmenting retry, within a
 * per-phase retry budget. Anything still short afterwards is accepted and recorded as a gap; the gate
 * never blocks phase completion.
 *
 * <p>Every step reads and writes the persisted state, so a crash between scoring and retry resumes
 * without scoring twice or granting a second retry.
 */
public final class QualityGate {
    private static final Logger LOG = LoggerFactory.getLogger(QualityGate.class);

    private final StateStore store;
    private final BatchScheduler scheduler;
    private final QualityValidator validator;
    private final AuditLogger journal;
    private final OrchestratorSettings settings;

    public QualityGate(
            StateStore store,
            BatchScheduler scheduler,
            QualityValidator validator,
            AuditLogger journal,
            OrchestratorSettings settings
    ) {
        this.store = store;
        this.scheduler = scheduler;
        this.validator = validator;
        this.journal = journal;
        this.settings = settings;
    }

    public RunState apply(Phase phase) {
        score(phase);
        List<WorkItem> retries = new ArrayList<>();
        for (WorkItem item : store.require().itemsFor(phase)) {
            if (pendingRetry(item)) {
                retries.add(item);
            }
        }
        if (!retries.isEmpty()) {
            LOG.info("Retrying {} item(s) of {} below quality threshold", retries.size(), phase);
            scheduler.dispatch(phase, retries);
            score(phase);
        }
        return store.require();
    }

    /**
     * Re-dispatches one item in append mode with {@code feedback} and returns its new state, unscored.
     * Counts against the phase retry budget; an item is retried at most once.
     */
    public WorkItem retry(WorkItem item, String feedback) {
        Phase phase = item.phase();
        RunState state = store.require();
        WorkItem current = state.item(phase, item.id())
                .orElseThrow(() -> new IllegalArgumentException("Unknown work item: " + item.id()));
        if (!pendingRetry(current)) {
            if (current.retryCount() > 0) {
                throw new IllegalStateException("Work item " + current.id() + " was already retried");
            }
            PhaseState phaseState = state.phase(phase);
            if (phaseState.retriesUsed() >= settings.maxRetriesPerPhase()) {
                throw new IllegalStateException("Retry budget of phase " + phase.dirName() + " is exhausted");
            }
            long nowMs = Instant.now().toEpochMilli();
            current = current.forRetry(feedback, nowMs);
            RunState next = state.withPhase(phaseState.withRetriesUsed(phaseState.retriesUsed() + 1))
                    .withItems(List.of(current));
            store.save(BatchScheduler.recount(next, phase).touched(nowMs));
            journal.log(AuditLogger.AuditEvent.of("quality.retry", "item:" + current.id(), "queued",
                    state.runId(), phase.name(), current.id(),
                    Map.of("feedback", feedback == null ? "" : feedback)));
        }
        scheduler.dispatch(phase, List.of(current));
        return store.require().item(phase, item.id()).orElseThrow();
    }

    /**
     * Scores every terminal, unscored item. Failed items score zero without consulting the validator.
     */
    void score(Phase phase) {
        RunState state = store.require();
        List<WorkItem> unscored = new ArrayList<>();
        for (WorkItem item : state.itemsFor(phase)) {
            if (item.score() == null && !item.qualityGap() && !item.synthetic()
                    && (item.status() == WorkItemStatus.SUCCEEDED || item.status() == WorkItemStatus.FAILED)) {
                unscored.add(item);
            }
        }
        if (unscored.isEmpty()) {
            return;
        }
        PhaseState phaseState = state.phase(phase);
        int retriesUsed = phaseState.retriesUsed();
        long nowMs = Instant.now().toEpochMilli();
        List<WorkItem> updated = new ArrayList<>(unscored.size());
        int groupSize = Math.max(1, settings.validatorGroupSize());
        for (int from = 0; from < unscored.size(); from += groupSize) {
            List<WorkItem> group = unscored.subList(from, Math.min(unscored.size(), from + groupSize));
            List<WorkItem> succeeded = group.stream().filter(i -> i.status() == WorkItemStatus.SUCCEEDED).toList();
            Map<String, Score> scores = succeeded.isEmpty() ? Map.of() : validator.validate(succeeded);
            for (WorkItem item : group) {
                Score score = item.status() == WorkItemStatus.FAILED
                        ? new Score(0, "worker failed: " + item.lastError())
                        : scores.get(item.id());
                if (score == null) {
                    throw new IllegalStateException("Validator returned no score for item " + item.id());
                }
                WorkItem scored = item.withScore(score.percent());
                if (score.percent() >= settings.qualityThreshold()) {
                    updated.add(scored);
                } else if (item.retryCount() == 0 && retriesUsed < settings.maxRetriesPerPhase()) {
                    retriesUsed++;
                    updated.add(scored.forRetry(score.feedback(), nowMs));
                    journal.log(AuditLogger.AuditEvent.of("quality.retry", "item:" + item.id(), "queued",
                            state.runId(), phase.name(), item.id(),
                            Map.of("score", score.percent(), "feedback", score.feedback())));
                } else {
                    String reason = item.retryCount() > 0
                            ? "below threshold after retry"
                            : "phase retry budget exhausted";
                    updated.add(scored.acceptedWithGap(nowMs));
                    phaseState = phaseState.withQualityGap(
                            new QualityGap(item.id(), score.percent(), item.retryCount(), reason));
                    LOG.warn("Accepted {} of {} with quality gap: score {} ({})", item.id(), phase, score.percent(), reason);
                    journal.log(AuditLogger.AuditEvent.of("quality.gap", "item:" + item.id(), "accepted",
                            state.runId(), phase.name(), item.id(),
                            Map.of("score", score.percent(), "reason", reason)));
                }
            }
        }
        RunState next = state.withPhase(phaseState.withRetriesUsed(retriesUsed)).withItems(updated);
        store.save(BatchScheduler.recount(next, phase).touched(nowMs));
    }

    static boolean pendingRetry(WorkItem item) {
        if (item.qualityGap() || item.retryCount() == 0) {
            return false;
        }
        return item.status() == WorkItemStatus.NEEDS_RETRY || item.status() == WorkItemStatus.RUNNING;
    }
}
