package io.auditforge.runtime;

import io.auditforge.config.AuditForgeConfig;
import io.auditforge.coverage.DeclaredScope;
import io.auditforge.delta.ChangeKind;
import io.auditforge.delta.DeltaReport;
import io.auditforge.delta.FileChange;
import io.auditforge.delta.FileChangeProvider;
import io.auditforge.delta.ReclassifiedFinding;
import io.auditforge.delta.ReclassifyTag;
import io.auditforge.model.Batch;
import io.auditforge.model.EvolutionTag;
import io.auditforge.model.Finding;
import io.auditforge.model.FindingStatus;
import io.auditforge.model.GapPriority;
import io.auditforge.model.Phase;
import io.auditforge.model.PhaseStatus;
import io.auditforge.model.RunState;
import io.auditforge.model.Severity;
import io.auditforge.model.SynthesisMode;
import io.auditforge.model.Tier;
import io.auditforge.model.WorkItem;
import io.auditforge.model.WorkItemStatus;
import io.auditforge.scheduler.BatchListener;
import io.auditforge.scheduler.PhaseResult;
import io.auditforge.scheduler.WorkItemSelector;
import io.auditforge.storage.PhasePrerequisiteException;
import io.auditforge.util.Jsons;
import io.auditforge.worker.Worker;
import io.auditforge.worker.WorkerContext;
import io.auditforge.worker.WorkerResult;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditForgeRuntimeTest {

    @Test
    void crashAfterSecondBatchResumesWithOnlyThirdAndFourthBatch() throws Exception {
        Path root = Files.createTempDirectory("auditforge-test-runtime-resume-");
        try {
            FakeChanges changes = new FakeChanges("rev1", List.of("a.java"));
            AuditForgeRuntime runtime = runtime(root, changes);
            CountingWorker firstWorker = new CountingWorker();
            runtime.workerRegistry().register(firstWorker);
            runtime.startRun(new AuditForgeRuntime.StartRequest(Tier.STANDARD, null, Map.of(Phase.SCAN, "counting"), false));

            WorkItemSelector sixteen = (phase, state) -> {
                List<WorkItem> items = new ArrayList<>();
                for (int i = 1; i <= 16; i++) {
                    items.add(WorkItem.queued(String.format("scan-%02d", i), phase, null, references(15),
                            List.of(), List.of(), null));
                }
                return items;
            };
            BatchListener crash = new BatchListener() {
                @Override
                public void afterBatch(Phase phase, Batch batch, List<WorkItem> results) {
                    if (batch.number() == 2) {
                        throw new IllegalStateException("process killed");
                    }
                }
            };
            Assertions.assertThrows(IllegalStateException.class, () -> runtime.runPhase(Phase.SCAN, sixteen, null, crash));
            Assertions.assertEquals(10, firstWorker.invoked.size());

            AuditForgeRuntime.StatusView status = runtime.status().orElseThrow();
            Assertions.assertEquals("scan", status.currentPhase());
            Assertions.assertEquals("IN_PROGRESS", status.currentPhaseStatus());
            Assertions.assertEquals("2/4 batches", status.progress());
            Assertions.assertEquals("Resume phase scan: 2 batch(es) remaining", status.nextStep());

            AuditForgeRuntime restarted = runtime(root, changes);
            CountingWorker secondWorker = new CountingWorker();
            restarted.workerRegistry().register(secondWorker);
            List<Integer> batches = Collections.synchronizedList(new ArrayList<>());
            WorkItemSelector mustNotBeCalled = (phase, state) -> {
                throw new AssertionError("selector consulted on resume");
            };
            PhaseResult result = restarted.runPhase(Phase.SCAN, mustNotBeCalled, null, new BatchListener() {
                @Override
                public void beforeBatch(Phase phase, Batch batch) {
                    batches.add(batch.number());
                }
            });

            Assertions.assertEquals(List.of(3, 4), batches);
            Assertions.assertEquals(6, secondWorker.invoked.size());
            Assertions.assertFalse(secondWorker.invoked.contains("scan-01"));
            Assertions.assertTrue(secondWorker.invoked.contains("scan-16"));
            Assertions.assertEquals(PhaseStatus.COMPLETE, result.status());
            Assertions.assertEquals(16, result.itemsSucceeded());
            Assertions.assertEquals(4, result.batchesCompleted());
            Assertions.assertEquals("Run phase analyze", restarted.status().orElseThrow().nextStep());
            Assertions.assertTrue(restarted.verifyJournal().ok());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void phaseCannotStartBeforeItsPredecessorCompletes() throws Exception {
        Path root = Files.createTempDirectory("auditforge-test-runtime-prereq-");
        try {
            AuditForgeRuntime runtime = runtime(root, new FakeChanges("rev1", List.of()));
            runtime.startRun(new AuditForgeRuntime.StartRequest(null, null, null, false));
            WorkItemSelector mustNotBeCalled = (phase, state) -> {
                throw new AssertionError("selector consulted for a blocked phase");
            };

            PhasePrerequisiteException error = Assertions.assertThrows(PhasePrerequisiteException.class,
                    () -> runtime.runPhase(Phase.ANALYZE, mustNotBeCalled, null, null));

            Assertions.assertEquals(Phase.SCAN, error.missingPrerequisite());
            RunState state = runtime.stateStore().require();
            Assertions.assertEquals(PhaseStatus.PENDING, state.phase(Phase.ANALYZE).status());
            Assertions.assertTrue(state.items().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void stackedRunsReclassifyPriorFindingsAndEscalateRegressions() throws Exception {
        Path root = Files.createTempDirectory("auditforge-test-runtime-stack-");
        try {
            FakeChanges changes = new FakeChanges("rev1", List.of("a.java", "b.java", "c.java"));
            FindingWorker findings = new FindingWorker();

            AuditForgeRuntime first = runtime(root, changes);
            first.workerRegistry().register(findings);
            Assertions.assertThrows(IllegalStateException.class,
                    () -> first.startRun(new AuditForgeRuntime.StartRequest(null, null, null, true)));
            AuditForgeRuntime.StartOutcome run1 = first.startRun(new AuditForgeRuntime.StartRequest(null, null, null, false));
            Assertions.assertEquals(1L, run1.runId());
            findings.next = List.of(
                    finding("F-1", Severity.MEDIUM, "a.java", FindingStatus.CONFIRMED),
                    finding("F-2", Severity.LOW, "b.java", FindingStatus.POTENTIAL),
                    finding("F-3", Severity.HIGH, "c.java", FindingStatus.CONFIRMED)
            );
            runAllPhases(first);

            changes.revision = "rev2";
            changes.files = List.of("a.java", "b.java");
            changes.changes = Map.of("a.java", new FileChange("a.java", 12));
            AuditForgeRuntime second = runtime(root, changes);
            second.workerRegistry().register(findings);
            AuditForgeRuntime.StartOutcome run2 = second.startRun(new AuditForgeRuntime.StartRequest(null, null, null, true));
            Assertions.assertEquals(2L, run2.runId());
            Assertions.assertNotNull(run2.archivedPrevious());
            Assertions.assertEquals(1L, run2.prior().runId());

            DeltaReport delta = second.delta().orElseThrow();
            Assertions.assertEquals(ChangeKind.MODIFIED, delta.recordFor("a.java").orElseThrow().kind());
            Assertions.assertEquals(ChangeKind.UNCHANGED, delta.recordFor("b.java").orElseThrow().kind());
            Assertions.assertEquals(ChangeKind.DELETED, delta.recordFor("c.java").orElseThrow().kind());
            Assertions.assertFalse(delta.massiveRewrite());
            Map<String, ReclassifyTag> tags = new LinkedHashMap<>();
            for (ReclassifiedFinding reclassified : second.reclassifiedFindings()) {
                tags.put(reclassified.finding().id(), reclassified.tag());
            }
            Assertions.assertEquals(Map.of("F-1", ReclassifyTag.RECHECK, "F-2", ReclassifyTag.VERIFY,
                    "F-3", ReclassifyTag.RESOLVED_BY_REMOVAL), tags);

            findings.next = List.of(finding("F-2", Severity.LOW, "b.java", FindingStatus.POTENTIAL));
            runAllPhases(second);
            Map<String, Finding> run2Findings = byId(second.findings(new AuditForgeRuntime.FindingFilter(null, null, "current")));
            Assertions.assertEquals(EvolutionTag.RECURRENT, run2Findings.get("F-2").evolution());
            Assertions.assertEquals(EvolutionTag.RESOLVED, run2Findings.get("F-1").evolution());
            Assertions.assertEquals(EvolutionTag.RESOLVED_BY_REMOVAL, run2Findings.get("F-3").evolution());

            changes.revision = "rev3";
            changes.changes = Map.of();
            AuditForgeRuntime third = runtime(root, changes);
            third.workerRegistry().register(findings);
            third.startRun(new AuditForgeRuntime.StartRequest(null, null, null, true));
            Assertions.assertEquals(1, third.reclassifiedFindings().size());
            findings.next = List.of(
                    finding("F-1", Severity.MEDIUM, "a.java", FindingStatus.CONFIRMED),
                    finding("F-2", Severity.LOW, "b.java", FindingStatus.POTENTIAL)
            );
            runAllPhases(third);

            Finding regression = byId(third.findings(new AuditForgeRuntime.FindingFilter(null, null, "current"))).get("F-1");
            Assertions.assertEquals(EvolutionTag.REGRESSION, regression.evolution());
            Assertions.assertEquals(Severity.HIGH, regression.severity());
            Assertions.assertEquals(Severity.MEDIUM, regression.priorSeverity());
            Assertions.assertEquals(List.of("F-1"), third.findings(
                    new AuditForgeRuntime.FindingFilter(Severity.HIGH, null, "current")).stream().map(Finding::id).toList());
            Assertions.assertEquals(3, third.findings(new AuditForgeRuntime.FindingFilter(null, null, "previous")).size());
            Assertions.assertEquals(2, third.history().size());
            Assertions.assertEquals(3L, third.stateStore().require().runId());
            Assertions.assertTrue(third.verifyJournal().ok());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void stackingSkipsAnAbandonedRunAndReusesTheLastCompletedOne() throws Exception {
        Path root = Files.createTempDirectory("auditforge-test-runtime-abandoned-");
        try {
            FakeChanges changes = new FakeChanges("rev1", List.of("a.java", "b.java"));
            FindingWorker findings = new FindingWorker();
            AuditForgeRuntime first = runtime(root, changes);
            first.workerRegistry().register(findings);
            first.startRun(new AuditForgeRuntime.StartRequest(null, null, null, false));
            findings.next = List.of(finding("F-1", Severity.HIGH, "a.java", FindingStatus.CONFIRMED));
            runAllPhases(first);

            changes.revision = "rev2";
            AuditForgeRuntime second = runtime(root, changes);
            second.startRun(new AuditForgeRuntime.StartRequest(null, null, null, false));
            second.runPhase(Phase.SCAN, (phase, state) -> List.of(), null, null);

            changes.revision = "rev3";
            AuditForgeRuntime third = runtime(root, changes);
            AuditForgeRuntime.StartOutcome run3 = third.startRun(new AuditForgeRuntime.StartRequest(null, null, null, true));

            Assertions.assertEquals(3L, run3.runId());
            Assertions.assertEquals(1L, run3.prior().runId());
            Assertions.assertEquals("rev1", third.delta().orElseThrow().fromRevision());
            List<ReclassifiedFinding> reclassified = third.reclassifiedFindings();
            Assertions.assertEquals(1, reclassified.size());
            Assertions.assertEquals("F-1", reclassified.get(0).finding().id());
            Assertions.assertEquals(ReclassifyTag.VERIFY, reclassified.get(0).tag());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void stackingWithOnlyAbandonedRunsIsRejected() throws Exception {
        Path root = Files.createTempDirectory("auditforge-test-runtime-no-base-");
        try {
            AuditForgeRuntime runtime = runtime(root, new FakeChanges("rev1", List.of("a.java")));
            runtime.startRun(new AuditForgeRuntime.StartRequest(null, null, null, false));
            runtime.runPhase(Phase.SCAN, (phase, state) -> List.of(), null, null);

            IllegalStateException error = Assertions.assertThrows(IllegalStateException.class,
                    () -> runtime.startRun(new AuditForgeRuntime.StartRequest(null, null, null, true)));
            Assertions.assertTrue(error.getMessage().contains("No completed run"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void resumeWithoutScopeStillVerifiesCoverage() throws Exception {
        Path root = Files.createTempDirectory("auditforge-test-runtime-resume-scope-");
        try {
            FakeChanges changes = new FakeChanges("rev1", List.of());
            AuditForgeRuntime runtime = runtime(root, changes);
            runtime.startRun(new AuditForgeRuntime.StartRequest(Tier.QUICK, 1, null, false));
            WorkItemSelector two = (phase, state) -> List.of(
                    WorkItem.queued("s1", phase, null, List.of("core/A.java"), List.of(), List.of(), null),
                    WorkItem.queued("s2", phase, null, List.of("core/B.java"), List.of(), List.of(), null));
            DeclaredScope scope = new DeclaredScope(
                    List.of(new DeclaredScope.ScopeUnit("core/A.java", false),
                            new DeclaredScope.ScopeUnit("core/B.java", false),
                            new DeclaredScope.ScopeUnit("api/Login.java", true)),
                    List.of(),
                    List.of());
            BatchListener crash = new BatchListener() {
                @Override
                public void afterBatch(Phase phase, Batch batch, List<WorkItem> results) {
                    if (batch.number() == 1) {
                        throw new IllegalStateException("process killed");
                    }
                }
            };
            Assertions.assertThrows(IllegalStateException.class, () -> runtime.runPhase(Phase.SCAN, two, scope, crash));
            Assertions.assertTrue(Files.exists(runtime.config().phaseDir(Phase.SCAN)
                    .resolve(AuditForgeRuntime.DECLARED_SCOPE_FILE)));

            AuditForgeRuntime restarted = runtime(root, changes);
            PhaseResult result = restarted.runPhase(Phase.SCAN, null, null, null);

            Assertions.assertEquals(PhaseStatus.COMPLETE, result.status());
            Assertions.assertEquals(3, result.itemsTotal());
            Assertions.assertEquals(3, result.batchesTotal());
            Assertions.assertEquals(3, result.batchesCompleted());
            Assertions.assertNotNull(result.coverage());
            Assertions.assertTrue(result.coverage().supplementalDispatched());
            Assertions.assertEquals(1.0d, result.coverage().scopeCoverage(), 1e-9);
            Assertions.assertEquals(1, result.coverageGaps().size());
            Assertions.assertEquals("api/Login.java", result.coverageGaps().get(0).ref());
            Assertions.assertEquals(GapPriority.CRITICAL, result.coverageGaps().get(0).priority());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void uncoveredReachableUnitTriggersOneSupplementalBatch() throws Exception {
        Path root = Files.createTempDirectory("auditforge-test-runtime-coverage-");
        try {
            AuditForgeRuntime runtime = runtime(root, new FakeChanges("rev1", List.of()));
            runtime.startRun(new AuditForgeRuntime.StartRequest(Tier.QUICK, null, null, false));
            runtime.runPhase(Phase.SCAN, (phase, state) -> List.of(), null, null);
            WorkItemSelector one = (phase, state) -> List.of(
                    WorkItem.queued("core", phase, null, List.of("core/Cache.java"), List.of(), List.of(), null));
            DeclaredScope scope = new DeclaredScope(
                    List.of(new DeclaredScope.ScopeUnit("core/Cache.java", false),
                            new DeclaredScope.ScopeUnit("api/Login.java", true),
                            new DeclaredScope.ScopeUnit("core/Util.java", false)),
                    List.of(),
                    List.of("C-1"));

            PhaseResult result = runtime.runPhase(Phase.ANALYZE, one, scope, null);

            Assertions.assertEquals(PhaseStatus.COMPLETE, result.status());
            Assertions.assertEquals(2, result.itemsTotal());
            Assertions.assertEquals(2, result.batchesTotal());
            Assertions.assertEquals(2, result.batchesCompleted());
            Assertions.assertTrue(result.coverage().supplementalDispatched());
            Assertions.assertEquals(2.0d / 3.0d, result.coverage().scopeCoverage(), 1e-9);
            Assertions.assertEquals(3, result.coverageGaps().size());
            Assertions.assertEquals(GapPriority.CRITICAL, result.coverageGaps().get(0).priority());
            String followUp = result.coverageGaps().get(0).followUpItemId();
            Assertions.assertNotNull(followUp);
            WorkItem synthetic = runtime.stateStore().require().item(Phase.ANALYZE, followUp).orElseThrow();
            Assertions.assertTrue(synthetic.synthetic());
            Assertions.assertEquals(WorkItemStatus.SUCCEEDED, synthetic.status());
            Assertions.assertEquals(2, synthetic.batch());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void synthesisPhaseRecordsModeAndWritesItsInput() throws Exception {
        Path root = Files.createTempDirectory("auditforge-test-runtime-synthesis-");
        try {
            AuditForgeRuntime runtime = runtime(root, new FakeChanges("rev1", List.of()));
            runtime.startRun(new AuditForgeRuntime.StartRequest(null, null, null, false));
            runtime.runPhase(Phase.SCAN, (phase, state) -> List.of(
                    WorkItem.queued("s1", phase, null, List.of("a.java"), List.of(), List.of(), null)), null, null);
            runtime.runPhase(Phase.ANALYZE, (phase, state) -> List.of(), null, null);

            PhaseResult result = runtime.runPhase(Phase.SYNTHESIZE, (phase, state) -> List.of(
                    WorkItem.queued("digest", phase, null, List.of(), List.of(), List.of(), null)), null, null);

            Assertions.assertEquals(SynthesisMode.INLINE, result.mode());
            Path input = runtime.config().phaseDir(Phase.SYNTHESIZE).resolve("synthesis-input.json");
            Assertions.assertTrue(Files.exists(input));
            String json = Files.readString(input, StandardCharsets.UTF_8);
            Assertions.assertTrue(json.contains("s1.md"));
            String output = Files.readString(runtime.config().phaseDir(Phase.SYNTHESIZE).resolve("digest.md"),
                    StandardCharsets.UTF_8);
            Assertions.assertTrue(output.contains("mode: INLINE"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void runAllPhases(AuditForgeRuntime runtime) {
        WorkItemSelector none = (phase, state) -> List.of();
        runtime.runPhase(Phase.SCAN, none, null, null);
        runtime.runPhase(Phase.ANALYZE, none, null, null);
        runtime.runPhase(Phase.SYNTHESIZE, none, null, null);
        runtime.runPhase(Phase.INVESTIGATE, (phase, state) -> List.of(
                WorkItem.queued("inv-1", phase, "findings", List.of("a.java", "b.java"), List.of(), List.of(), null)),
                null, null);
        runtime.runPhase(Phase.REPORT, none, null, null);
        runtime.runPhase(Phase.VERIFY, none, null, null);
    }

    private static AuditForgeRuntime runtime(Path root, FileChangeProvider changes) {
        AuditForgeRuntime runtime = new AuditForgeRuntime(AuditForgeConfig.fromRoot(root.toString()), changes, null);
        runtime.init();
        return runtime;
    }

    private static List<String> references(int count) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            out.add("src/F" + i + ".java");
        }
        return out;
    }

    private static Finding finding(String id, Severity severity, String file, FindingStatus status) {
        return new Finding(id, status, severity, file, id + " title", id + " summary", null, null, null);
    }

    private static Map<String, Finding> byId(List<Finding> findings) {
        Map<String, Finding> out = new LinkedHashMap<>();
        for (Finding finding : findings) {
            out.put(finding.id(), finding);
        }
        return out;
    }

    private static final class FakeChanges implements FileChangeProvider {
        private String revision;
        private List<String> files;
        private Map<String, FileChange> changes = Map.of();

        private FakeChanges(String revision, List<String> files) {
            this.revision = revision;
            this.files = files;
        }

        @Override
        public String currentRevision() {
            return revision;
        }

        @Override
        public List<String> listFiles() {
            return files;
        }

        @Override
        public Map<String, FileChange> changesSince(String priorRevision) {
            return changes;
        }
    }

    private static final class CountingWorker implements Worker {
        private final List<String> invoked = Collections.synchronizedList(new ArrayList<>());

        @Override
        public String id() {
            return "counting";
        }

        @Override
        public WorkerResult execute(WorkerContext context) throws Exception {
            invoked.add(context.itemId());
            Files.createDirectories(context.outputPath().getParent());
            Files.writeString(context.outputPath(), "# " + context.itemId(), StandardCharsets.UTF_8);
            return WorkerResult.ok(context.outputPath().toString());
        }
    }

    private static final class FindingWorker implements Worker {
        private volatile List<Finding> next = List.of();

        @Override
        public String id() {
            return "findings";
        }

        @Override
        public WorkerResult execute(WorkerContext context) throws Exception {
            Files.createDirectories(context.outputPath().getParent());
            StringBuilder report = new StringBuilder("# Investigation " + context.itemId() + "\n");
            report.append("Reviewed scope: ").append(String.join(", ", context.scope())).append("\n\n");
            for (Finding finding : next) {
                report.append("- ").append(finding.id()).append(": ").append(finding.title()).append('\n');
            }
            Files.writeString(context.outputPath(), report.toString(), StandardCharsets.UTF_8);
            Files.writeString(Path.of(context.outputPath() + AuditForgeRuntime.FINDINGS_SIDECAR_SUFFIX),
                    Jsons.toJson(next), StandardCharsets.UTF_8);
            return WorkerResult.ok(context.outputPath().toString());
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
