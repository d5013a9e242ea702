package io.auditforge.storage;

import io.auditforge.config.AuditForgeConfig;
import io.auditforge.model.EvolutionTag;
import io.auditforge.model.Finding;
import io.auditforge.model.FindingStatus;
import io.auditforge.model.Phase;
import io.auditforge.model.PhaseStatus;
import io.auditforge.model.RunConfig;
import io.auditforge.model.RunState;
import io.auditforge.model.Severity;
import io.auditforge.model.Tier;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class RunArchiveTest {

    @Test
    void archiveMovesRunArtifactsUnderDateAndShortRevision() throws Exception {
        Path root = Files.createTempDirectory("auditforge-test-archive-");
        try {
            AuditForgeConfig config = AuditForgeConfig.fromRoot(root.toString());
            new Database(config).init();
            StateStore store = new StateStore(config.stateFile());
            RunState state = RunState.fresh(3L, 1_000L, new RunConfig(Tier.QUICK, 0, Map.of()),
                    "9f8e7d6c5b4a", List.of("a.txt"), null);
            store.save(state);
            Files.createDirectories(config.phasesRoot().resolve("scan"));
            Files.writeString(config.phasesRoot().resolve("scan").resolve("item.md"), "# out", StandardCharsets.UTF_8);

            Finding finding = new Finding("F-1", FindingStatus.CONFIRMED, Severity.HIGH, "a.txt", "t", "s",
                    null, EvolutionTag.NEW, null);
            RunArchive archive = new RunArchive(config);
            Instant now = Instant.parse("2026-03-04T10:15:30Z");
            RunArchive.ArchiveEntry entry = archive.archive(state, List.of(finding), now);

            Assertions.assertEquals("2026-03-04-9f8e7d6", entry.name());
            Assertions.assertEquals("quick", entry.tier());
            Assertions.assertFalse(entry.complete());
            Assertions.assertFalse(Files.exists(config.stateFile()));
            Assertions.assertTrue(Files.isDirectory(config.phasesRoot()));
            Assertions.assertTrue(Files.exists(Path.of(entry.dir()).resolve("phases").resolve("scan").resolve("item.md")));
            Assertions.assertEquals(3L, archive.readState(entry).runId());
            Assertions.assertEquals(List.of(finding), archive.readFindings(entry));

            RunState next = RunState.fresh(4L, 2_000L, new RunConfig(Tier.QUICK, 0, Map.of()),
                    "9f8e7d6c5b4a", List.of("a.txt"), null);
            RunArchive.ArchiveEntry second = archive.archive(next, List.of(), now);
            Assertions.assertEquals("2026-03-04-9f8e7d6-2", second.name());

            Assertions.assertEquals(List.of(3L, 4L), archive.list().stream().map(RunArchive.ArchiveEntry::runId).toList());
            Assertions.assertEquals(4L, archive.latest().orElseThrow().runId());
            Assertions.assertEquals(4L, archive.highestRunId());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void latestCompleteSkipsAbandonedRuns() throws Exception {
        Path root = Files.createTempDirectory("auditforge-test-archive-complete-");
        try {
            AuditForgeConfig config = AuditForgeConfig.fromRoot(root.toString());
            RunArchive archive = new RunArchive(config);
            Instant now = Instant.parse("2026-05-06T08:00:00Z");
            Assertions.assertTrue(archive.latestComplete().isEmpty());

            RunState finished = RunState.fresh(1L, 1_000L, new RunConfig(Tier.STANDARD, 0, Map.of()),
                    "aaa111", List.of("a.txt"), null);
            for (Phase phase : Phase.values()) {
                finished = StateStore.applyTransition(finished, phase, PhaseStatus.IN_PROGRESS, 2_000L);
                finished = StateStore.applyTransition(finished, phase, PhaseStatus.COMPLETE, 3_000L);
            }
            archive.archive(finished, List.of(), now);
            RunState abandoned = StateStore.applyTransition(
                    RunState.fresh(2L, 4_000L, new RunConfig(Tier.STANDARD, 0, Map.of()), "bbb222", List.of(), null),
                    Phase.SCAN, PhaseStatus.IN_PROGRESS, 5_000L);
            archive.archive(abandoned, List.of(), now);

            Assertions.assertEquals(2L, archive.latest().orElseThrow().runId());
            RunArchive.ArchiveEntry base = archive.latestComplete().orElseThrow();
            Assertions.assertEquals(1L, base.runId());
            Assertions.assertTrue(base.complete());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void archiveNameFallsBackWhenRevisionIsUnknown() {
        Instant now = Instant.parse("2026-01-02T00:00:00Z");
        Assertions.assertEquals("2026-01-02-norev", RunArchive.archiveName(now, null));
        Assertions.assertEquals("2026-01-02-v12", RunArchive.archiveName(now, "v1.2"));
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
