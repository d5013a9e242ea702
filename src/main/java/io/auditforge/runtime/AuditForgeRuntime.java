package io.auditforge.runtime;

import com.fasterxml.jackson.core.type.TypeReference;
import io.auditforge.budget.ContextBudgetEstimator;
import io.auditforge.budget.SynthesisInput;
import io.auditforge.budget.SynthesisInputPlanner;
import io.auditforge.config.AuditForgeConfig;
import io.auditforge.config.OrchestratorSettings;
import io.auditforge.coverage.CoverageReport;
import io.auditforge.coverage.CoverageVerifier;
import io.auditforge.coverage.DeclaredScope;
import io.auditforge.coverage.SupplementalBatchPlanner;
import io.auditforge.delta.DeltaEngine;
import io.auditforge.delta.DeltaReport;
import io.auditforge.delta.FileChangeProvider;
import io.auditforge.delta.FindingEvolution;
import io.auditforge.delta.GitFileChangeProvider;
import io.auditforge.delta.ReclassifiedFinding;
import io.auditforge.model.CoverageSummary;
import io.auditforge.model.EvolutionTag;
import io.auditforge.model.Finding;
import io.auditforge.model.FindingStatus;
import io.auditforge.model.Phase;
import io.auditforge.model.PhaseState;
import io.auditforge.model.PhaseStatus;
import io.auditforge.model.PriorRunRef;
import io.auditforge.model.RunConfig;
import io.auditforge.model.RunState;
import io.auditforge.model.Severity;
import io.auditforge.model.SynthesisMode;
import io.auditforge.model.Tier;
import io.auditforge.model.WorkItem;
import io.auditforge.model.WorkItemStatus;
import io.auditforge.observability.AuditLogger;
import io.auditforge.quality.OutputArtifactValidator;
import io.auditforge.quality.QualityGate;
import io.auditforge.quality.QualityValidator;
import io.auditforge.scheduler.BatchListener;
import io.auditforge.scheduler.BatchScheduler;
import io.auditforge.scheduler.PhaseResult;
import io.auditforge.scheduler.WorkItemSelector;
import io.auditforge.storage.Database;
import io.auditforge.storage.FindingLedger;
import io.auditforge.storage.RunArchive;
import io.auditforge.storage.StateStore;
import io.auditforge.util.Jsons;
import io.auditforge.worker.EchoWorker;
import io.auditforge.worker.FailWorker;
import io.auditforge.worker.ScriptWorker;
import io.auditforge.worker.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Top-level loop of one data root: starts, stacks and archives runs, and drives a phase through
 * fan-out, the quality gate, the coverage check and finding bookkeeping before completing it.
 *
 * <p>Every step persists through the {@link StateStore}; calling {@link #runPhase} again after a crash
 * continues where the previous process stopped.
 */
public final class AuditForgeRuntime {
    private static final Logger LOG = LoggerFactory.getLogger(AuditForgeRuntime.class);
    public static final String FINDINGS_SIDECAR_SUFFIX = ".findings.json";
    public static final String DECLARED_SCOPE_FILE = "declared-scope.json";
    private static final long SCRIPT_DEFAULT_TIMEOUT_MS = 60_000L;

    private final AuditForgeConfig config;
    private final OrchestratorSettings settings;
    private final FileChangeProvider changes;
    private final Database database;
    private final FindingLedger ledger;
    private final RunArchive archive;
    private final StateStore store;
    private final AuditLogger journal;
    private final WorkerRegistry workers;
    private final ContextBudgetEstimator estimator;
    private final BatchScheduler scheduler;
    private final QualityGate gate;
    private final DeltaEngine deltaEngine;
    private final CoverageVerifier coverageVerifier;
    private final SupplementalBatchPlanner supplementalPlanner;
    private final SynthesisInputPlanner synthesisPlanner;

    public AuditForgeRuntime(AuditForgeConfig config) {
        this(config, new GitFileChangeProvider(config.rootDir().getParent()), null);
    }

    public AuditForgeRuntime(AuditForgeConfig config, FileChangeProvider changes, QualityValidator validator) {
        this.config = config;
        this.settings = OrchestratorSettings.load(config.settingsFile());
        this.changes = changes;
        this.database = new Database(config);
        this.ledger = new FindingLedger(database);
        this.archive = new RunArchive(config);
        this.store = new StateStore(config.stateFile());
        this.journal = new AuditLogger(config.journalFile());
        this.workers = new WorkerRegistry();
        this.estimator = new ContextBudgetEstimator(settings);
        this.scheduler = new BatchScheduler(config, store, workers, estimator, journal, settings);
        this.gate = new QualityGate(store, scheduler,
                validator == null
                        ? new OutputArtifactValidator(settings.minOutputBytes(), settings.requiredOutputMarkers())
                        : validator,
                journal, settings);
        this.deltaEngine = new DeltaEngine(settings.massiveRewriteRatio(), settings.majorChangeLines());
        this.coverageVerifier = new CoverageVerifier();
        this.supplementalPlanner = new SupplementalBatchPlanner();
        this.synthesisPlanner = new SynthesisInputPlanner();
        workers.register(new EchoWorker());
        workers.register(new FailWorker());
    }

    public void init() {
        try {
            Files.createDirectories(config.rootDir());
            for (Phase phase : Phase.values()) {
                Files.createDirectories(config.phaseDir(phase));
            }
            Files.createDirectories(config.runDir());
            Files.createDirectories(config.historyRoot());
            Files.createDirectories(config.workersRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to create data root: " + config.rootDir(), e);
        }
        database.init();
        registerConfiguredScriptWorkers();
    }

    public AuditForgeConfig config() {
        return config;
    }

    public OrchestratorSettings settings() {
        return settings;
    }

    public WorkerRegistry workerRegistry() {
        return workers;
    }

    public StateStore stateStore() {
        return store;
    }

    public FindingLedger ledger() {
        return ledger;
    }

    /**
     * Archives the active run, if any, and starts the next one. With {@code stack} the new run is
     * compared against the latest archive and the archived findings are reclassified.
     */
    public StartOutcome startRun(StartRequest request) {
        long nowMs = Instant.now().toEpochMilli();
        String archivedAs = null;
        long highest = archive.highestRunId();
        Optional<RunState> active = store.load();
        if (active.isPresent()) {
            RunState previous = active.get();
            List<Finding> findings = ledger.forRun(previous.runId()).stream()
                    .map(FindingLedger.LedgerEntry::finding)
                    .toList();
            RunArchive.ArchiveEntry entry = archive.archive(previous, findings, Instant.ofEpochMilli(nowMs));
            archivedAs = entry.name();
            highest = Math.max(highest, previous.runId());
            LOG.info("Archived run {} as {}", previous.runId(), entry.name());
            journal.log(AuditLogger.AuditEvent.of("run.archive", "run:" + previous.runId(), "ok",
                    previous.runId(), null, null, Map.of("archive", entry.name(), "findings", findings.size())));
        }

        long runId = highest + 1;
        String revision = changes.currentRevision();
        List<String> files = changes.listFiles();
        PriorRunRef prior = null;
        if (request.stack()) {
            RunArchive.ArchiveEntry latest = archive.latestComplete()
                    .orElseThrow(() -> new IllegalStateException("No completed run in the archive to stack on"));
            prior = stackOn(latest, revision, files);
        }
        RunConfig runConfig = new RunConfig(
                request.tier() == null ? settings.tier() : request.tier(),
                request.maxConcurrency() == null ? settings.maxConcurrency() : request.maxConcurrency(),
                workerClasses(request.workerClasses())
        );
        RunState state = RunState.fresh(runId, nowMs, runConfig, revision, files, prior);
        store.save(state);
        LOG.info("Started run {} at revision {} ({} files, tier {})", runId, revision, files.size(),
                runConfig.tier().label());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("revision", revision == null ? "" : revision);
        details.put("tier", runConfig.tier().label());
        details.put("files", files.size());
        details.put("stacked_on", prior == null ? "" : prior.archiveDir());
        journal.log(AuditLogger.AuditEvent.of("run.start", "run:" + runId, "ok", runId, null, null, details));
        return new StartOutcome(runId, revision, runConfig.tier().label(), files.size(), archivedAs, prior);
    }

    /**
     * Runs one phase to COMPLETE. {@code selector} is only consulted when the phase has no registered
     * items yet. The first non-empty {@code declaredScope} is kept with the phase outputs and reused
     * when a resumed call passes null; with neither, the coverage check is skipped.
     */
    public PhaseResult runPhase(Phase phase, WorkItemSelector selector, DeclaredScope declaredScope,
                                BatchListener listener) {
        RunState state = store.require();
        if (state.phase(phase).status() == PhaseStatus.COMPLETE) {
            LOG.info("Phase {} of run {} is already complete", phase, state.runId());
            return PhaseResult.from(state.phase(phase));
        }
        boolean resumed = state.phase(phase).status() == PhaseStatus.IN_PROGRESS;
        state = store.transitionPhase(phase, PhaseStatus.IN_PROGRESS);
        journal.log(AuditLogger.AuditEvent.of(resumed ? "phase.resume" : "phase.start", "phase:" + phase.dirName(),
                "ok", state.runId(), phase.name(), null, Map.of()));

        List<WorkItem> proposed = List.of();
        if (state.itemsFor(phase).isEmpty() && selector != null) {
            proposed = selector.selectWorkItems(phase, state);
        }
        if (declaredScope != null && !declaredScope.isEmpty() && savedDeclaredScope(phase).isEmpty()) {
            StateStore.writeAtomically(declaredScopeFile(phase), Jsons.toJson(declaredScope));
        }
        if (phase.synthesis() && state.phase(phase).mode() == null) {
            prepareSynthesis(phase, proposed);
        }

        scheduler.runPhase(phase, proposed, listener);
        if (phase.qualityGated()) {
            gate.apply(phase);
        }
        DeclaredScope scope = declaredScope == null ? savedDeclaredScope(phase).orElse(null) : declaredScope;
        if (scope != null && !scope.isEmpty()) {
            verifyCoverage(phase, scope);
        }
        if (phase.producesFindings()) {
            recordFindings(phase);
        }

        RunState done = store.transitionPhase(phase, PhaseStatus.COMPLETE);
        PhaseState phaseState = done.phase(phase);
        LOG.info("Phase {} complete: {}/{} items succeeded, {} quality gap(s), {} coverage gap(s)",
                phase, phaseState.itemsCompleted(), phaseState.itemsTotal(),
                phaseState.qualityGaps().size(), phaseState.coverageGaps().size());
        journal.log(AuditLogger.AuditEvent.of("phase.complete", "phase:" + phase.dirName(), "ok",
                done.runId(), phase.name(), null,
                Map.of("items", phaseState.itemsTotal(),
                        "succeeded", phaseState.itemsCompleted(),
                        "failed", phaseState.itemsFailed(),
                        "retries", phaseState.retriesUsed())));
        return PhaseResult.from(phaseState);
    }

    public Optional<StatusView> status() {
        Optional<RunState> loaded = store.load();
        if (loaded.isEmpty()) {
            return Optional.empty();
        }
        RunState state = loaded.get();
        Phase current = state.currentPhase();
        PhaseState currentState = state.phase(current);
        List<PhaseSummary> phases = new ArrayList<>();
        for (PhaseState phaseState : state.phases().values()) {
            phases.add(new PhaseSummary(
                    phaseState.phase().dirName(),
                    phaseState.status().name(),
                    phaseState.batchesCompleted() + "/" + phaseState.batchesTotal(),
                    phaseState.itemsCompleted(),
                    phaseState.itemsFailed(),
                    phaseState.itemsTotal(),
                    phaseState.retriesUsed(),
                    phaseState.qualityGaps().size(),
                    phaseState.coverageGaps().size(),
                    phaseState.mode() == null ? null : phaseState.mode().name()
            ));
        }
        return Optional.of(new StatusView(
                state.runId(),
                state.revision(),
                state.config().tier().label(),
                state.prior() == null ? null : state.prior().runId(),
                current.dirName(),
                currentState.status().name(),
                currentState.batchesCompleted() + "/" + currentState.batchesTotal() + " batches",
                nextStep(state),
                phases
        ));
    }

    public List<RunArchive.ArchiveEntry> history() {
        return archive.list();
    }

    public List<Finding> findings(FindingFilter filter) {
        List<Finding> source;
        String run = filter == null || filter.run() == null ? "current" : filter.run().trim().toLowerCase(Locale.ROOT);
        switch (run) {
            case "current" -> {
                Optional<RunState> active = store.load();
                source = active.isEmpty()
                        ? List.of()
                        : ledger.forRun(active.get().runId()).stream().map(FindingLedger.LedgerEntry::finding).toList();
            }
            case "previous" -> source = archive.latest().map(archive::readFindings).orElse(List.of());
            case "latest" -> source = ledger.latest();
            default -> throw new IllegalArgumentException("Unknown run selector: " + filter.run()
                    + " (expected current, previous or latest)");
        }
        List<Finding> out = new ArrayList<>();
        for (Finding finding : source) {
            if (filter != null && filter.severity() != null && finding.severity() != filter.severity()) {
                continue;
            }
            if (filter != null && filter.status() != null && finding.status() != filter.status()) {
                continue;
            }
            out.add(finding);
        }
        return out;
    }

    public Optional<DeltaReport> delta() {
        return readJson(config.deltaFile(), new TypeReference<DeltaReport>() {
        });
    }

    public List<ReclassifiedFinding> reclassifiedFindings() {
        return readJson(config.reclassifiedFindingsFile(), new TypeReference<List<ReclassifiedFinding>>() {
        }).orElse(List.of());
    }

    public AuditLogger.IntegrityOutcome verifyJournal() {
        return journal.verify();
    }

    private PriorRunRef stackOn(RunArchive.ArchiveEntry latest, String revision, List<String> files) {
        RunState priorState = archive.readState(latest);
        DeltaReport delta = deltaEngine.computeDelta(
                priorState.revision(),
                revision,
                priorState.fileIndex(),
                files,
                changes.changesSince(priorState.revision())
        );
        List<Finding> priorFindings = archive.readFindings(latest).stream().filter(Finding::active).toList();
        List<ReclassifiedFinding> reclassified = deltaEngine.reclassifyFindings(priorFindings, delta);
        writeJson(config.deltaFile(), delta);
        writeJson(config.reclassifiedFindingsFile(), reclassified);
        if (delta.massiveRewrite()) {
            LOG.warn("Massive rewrite since run {} (change ratio {}): prior verdicts are re-checked",
                    priorState.runId(), String.format(Locale.ROOT, "%.2f", delta.summary().changeRatio()));
        }
        journal.log(AuditLogger.AuditEvent.of("run.stack", "run:" + priorState.runId(), "ok",
                priorState.runId(), null, null,
                Map.of("added", delta.summary().added(),
                        "modified", delta.summary().modified(),
                        "deleted", delta.summary().deleted(),
                        "unchanged", delta.summary().unchanged(),
                        "massive_rewrite", delta.massiveRewrite(),
                        "reclassified", reclassified.size())));
        return new PriorRunRef(priorState.runId(), priorState.revision(), latest.dir(), delta.summary());
    }

    private void prepareSynthesis(Phase phase, List<WorkItem> proposed) {
        RunState state = store.require();
        List<Finding> findings = ledger.activeLatest();
        long total = estimator.estimateSynthesis(proposed, findings);
        SynthesisMode mode = estimator.selectMode(total);
        List<Path> references = new ArrayList<>();
        for (Phase before : phase.predecessors()) {
            for (WorkItem item : state.itemsFor(before)) {
                if (item.status() == WorkItemStatus.SUCCEEDED && item.outputPath() != null) {
                    references.add(Path.of(item.outputPath()));
                }
            }
        }
        SynthesisInput input = synthesisPlanner.plan(mode, total, findings, references);
        writeJson(config.phaseDir(phase).resolve(BatchScheduler.SYNTHESIS_INPUT_FILE), input);
        long nowMs = Instant.now().toEpochMilli();
        store.save(state.withPhase(state.phase(phase).withMode(mode)).touched(nowMs));
        LOG.info("Synthesis mode for {}: {} (estimated {} tokens, {} findings)", phase, mode, total, findings.size());
        journal.log(AuditLogger.AuditEvent.of("phase.mode", "phase:" + phase.dirName(), mode.name(),
                state.runId(), phase.name(), null, Map.of("estimate", total, "findings", findings.size())));
    }

    /**
     * Records gaps once, dispatches at most one supplemental batch, and refreshes the ratios after it.
     */
    private void verifyCoverage(Phase phase, DeclaredScope declaredScope) {
        RunState state = store.require();
        PhaseState phaseState = state.phase(phase);
        boolean planned = state.itemsFor(phase).stream().anyMatch(WorkItem::synthetic)
                || (phaseState.coverage() != null);
        if (!planned) {
            List<WorkItem> processed = state.itemsFor(phase).stream().filter(i -> !i.synthetic()).toList();
            CoverageReport report = coverageVerifier.verifyCoverage(declaredScope, processed);
            int supplementalBatch = phaseState.batchesTotal() + 1;
            String workerClass = state.config().workerClassFor(phase,
                    settings.workerClasses().getOrDefault(phase.name(), settings.defaultWorkerClass()));
            SupplementalBatchPlanner.Plan plan = supplementalPlanner.plan(phase, report.gaps(), supplementalBatch,
                    Math.max(1, phaseState.batchSize()), workerClass, config.phaseDir(phase));
            boolean dispatching = !plan.items().isEmpty();
            CoverageSummary summary = withSupplemental(report.summary(), dispatching);
            PhaseState next = phaseState.withCoverage(summary, plan.gaps());
            if (dispatching) {
                next = next.withBatches(supplementalBatch, phaseState.batchesCompleted(), phaseState.batchSize());
            }
            state = BatchScheduler.recount(state.withItems(plan.items()).withPhase(next), phase)
                    .touched(Instant.now().toEpochMilli());
            store.save(state);
            LOG.info("Coverage of {}: {} gap(s), {} supplemental item(s)", phase, plan.gaps().size(), plan.items().size());
            journal.log(AuditLogger.AuditEvent.of("coverage.gaps", "phase:" + phase.dirName(), "recorded",
                    state.runId(), phase.name(), null,
                    Map.of("gaps", plan.gaps().size(), "supplemental", plan.items().size())));
        }

        List<WorkItem> pending = store.require().itemsFor(phase).stream()
                .filter(WorkItem::synthetic)
                .filter(i -> i.status() == WorkItemStatus.QUEUED || i.status() == WorkItemStatus.RUNNING)
                .toList();
        if (!pending.isEmpty()) {
            scheduler.dispatch(phase, pending);
        }

        state = store.require();
        phaseState = state.phase(phase);
        boolean supplemental = phaseState.coverage() != null && phaseState.coverage().supplementalDispatched();
        CoverageReport refreshed = coverageVerifier.verifyCoverage(declaredScope, state.itemsFor(phase));
        PhaseState next = phaseState.withCoverage(withSupplemental(refreshed.summary(), supplemental),
                phaseState.coverageGaps());
        if (supplemental) {
            next = next.withBatches(next.batchesTotal(), next.batchesTotal(), next.batchSize());
        }
        store.save(state.withPhase(next).touched(Instant.now().toEpochMilli()));
    }

    /**
     * Reads finding sidecars written next to item outputs, tags their evolution against the ledger and
     * appends them. Skipped when this run already recorded findings, so a resumed phase does not
     * append twice.
     */
    private void recordFindings(Phase phase) {
        RunState state = store.require();
        if (!ledger.forRun(state.runId()).isEmpty()) {
            return;
        }
        Map<String, Finding> current = new LinkedHashMap<>();
        for (WorkItem item : state.itemsFor(phase)) {
            if (item.status() != WorkItemStatus.SUCCEEDED || item.outputPath() == null) {
                continue;
            }
            Path sidecar = Path.of(item.outputPath() + FINDINGS_SIDECAR_SUFFIX);
            for (Finding finding : readJson(sidecar, new TypeReference<List<Finding>>() {
            }).orElse(List.of())) {
                current.put(finding.id(), finding);
            }
        }
        DeltaReport delta = state.prior() == null ? null : delta().orElse(null);
        FindingEvolution.Outcome outcome = FindingEvolution.evolve(ledger.latest(), current.values(), delta);
        long nowMs = Instant.now().toEpochMilli();
        int appended = ledger.append(state.runId(), outcome.all(), nowMs);
        long regressions = outcome.current().stream()
                .filter(f -> f.evolution() == EvolutionTag.REGRESSION)
                .count();
        LOG.info("Recorded {} finding event(s) for run {} ({} resolved, {} regression(s))",
                appended, state.runId(), outcome.resolved().size(), regressions);
        journal.log(AuditLogger.AuditEvent.of("findings.record", "run:" + state.runId(), "ok",
                state.runId(), phase.name(), null,
                Map.of("current", outcome.current().size(),
                        "resolved", outcome.resolved().size(),
                        "regressions", regressions)));
    }

    private String nextStep(RunState state) {
        for (PhaseState phaseState : state.phases().values()) {
            if (phaseState.status() == PhaseStatus.IN_PROGRESS) {
                int remaining = Math.max(0, phaseState.batchesTotal() - phaseState.batchesCompleted());
                return "Resume phase " + phaseState.phase().dirName() + ": " + remaining + " batch(es) remaining";
            }
            if (phaseState.status() == PhaseStatus.PENDING) {
                return "Run phase " + phaseState.phase().dirName();
            }
        }
        return "Run complete; start the next run with 'start --stack'";
    }

    private Map<Phase, String> workerClasses(Map<Phase, String> requested) {
        Map<Phase, String> out = new EnumMap<>(Phase.class);
        for (Map.Entry<String, String> entry : settings.workerClasses().entrySet()) {
            out.put(Phase.fromString(entry.getKey()), entry.getValue());
        }
        if (requested != null) {
            out.putAll(requested);
        }
        for (Map.Entry<Phase, String> entry : out.entrySet()) {
            if (workers.findById(entry.getValue()).isEmpty()) {
                throw new IllegalArgumentException("Unknown worker class for " + entry.getKey().dirName()
                        + ": " + entry.getValue());
            }
        }
        return out;
    }

    private void registerConfiguredScriptWorkers() {
        Path file = config.scriptWorkersFile();
        if (!Files.exists(file)) {
            return;
        }
        ScriptWorkerFile parsed;
        try {
            parsed = Jsons.mapper().readValue(file.toFile(), ScriptWorkerFile.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read script workers: " + file, e);
        }
        if (parsed == null || parsed.workers() == null) {
            return;
        }
        int loaded = 0;
        for (ScriptWorkerSpec spec : parsed.workers()) {
            if (spec == null || spec.id() == null || spec.id().isBlank()
                    || spec.command() == null || spec.command().isEmpty()) {
                LOG.warn("Skipping invalid script worker entry in {}", file);
                journal.log(AuditLogger.AuditEvent.of("worker.script.register", "workers", "invalid_spec",
                        null, null, null, Map.of("file", file.toString())));
                continue;
            }
            long timeoutMs = spec.timeoutMs() == null ? SCRIPT_DEFAULT_TIMEOUT_MS : spec.timeoutMs();
            workers.register(new ScriptWorker(spec.id(), spec.command(), timeoutMs));
            loaded++;
        }
        LOG.debug("Registered {} script worker(s) from {}", loaded, file);
    }

    private Path declaredScopeFile(Phase phase) {
        return config.phaseDir(phase).resolve(DECLARED_SCOPE_FILE);
    }

    private Optional<DeclaredScope> savedDeclaredScope(Phase phase) {
        return readJson(declaredScopeFile(phase), new TypeReference<DeclaredScope>() {
        });
    }

    private static CoverageSummary withSupplemental(CoverageSummary summary, boolean dispatched) {
        return new CoverageSummary(summary.scopeCoverage(), summary.patternCoverage(), summary.checklistCoverage(),
                dispatched);
    }

    private static void writeJson(Path file, Object value) {
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            Files.writeString(file, Jsons.toJson(value));
        } catch (IOException e) {
            throw new RuntimeException("Failed to write " + file, e);
        }
    }

    private static <T> Optional<T> readJson(Path file, TypeReference<T> type) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(Jsons.mapper().readValue(file.toFile(), type));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read " + file, e);
        }
    }

    public record StartRequest(
            Tier tier,
            Integer maxConcurrency,
            Map<Phase, String> workerClasses,
            boolean stack
    ) {
    }

    public record StartOutcome(
            long runId,
            String revision,
            String tier,
            int files,
            String archivedPrevious,
            PriorRunRef prior
    ) {
    }

    public record FindingFilter(
            Severity severity,
            FindingStatus status,
            String run
    ) {
    }

    public record StatusView(
            long runId,
            String revision,
            String tier,
            Long stackedOnRunId,
            String currentPhase,
            String currentPhaseStatus,
            String progress,
            String nextStep,
            List<PhaseSummary> phases
    ) {
    }

    public record PhaseSummary(
            String phase,
            String status,
            String batches,
            int succeeded,
            int failed,
            int total,
            int retries,
            int qualityGaps,
            int coverageGaps,
            String mode
    ) {
    }

    public record ScriptWorkerFile(List<ScriptWorkerSpec> workers) {
    }

    public record ScriptWorkerSpec(String id, List<String> command, Long timeoutMs) {
    }
}
