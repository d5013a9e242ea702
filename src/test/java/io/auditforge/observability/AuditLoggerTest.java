package io.auditforge.observability;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void chainSurvivesReopenAndVerifies() throws Exception {
        Path root = Files.createTempDirectory("auditforge-test-journal-");
        try {
            Path file = root.resolve("journal").resolve("journal.log");
            AuditLogger first = new AuditLogger(file);
            first.log(AuditLogger.AuditEvent.of("run.start", "run:1", "ok", 1L, null, null, Map.of("files", 3)));
            first.log(AuditLogger.AuditEvent.of("phase.start", "phase:scan", "ok", 1L, "SCAN", null, null));
            String tail = first.currentHash();

            AuditLogger reopened = new AuditLogger(file);
            Assertions.assertEquals(tail, reopened.currentHash());
            reopened.log(AuditLogger.AuditEvent.of("batch.complete", "phase:scan", "ok", 1L, "SCAN", null,
                    Map.of("batch", 1, "items", 5)));

            AuditLogger.IntegrityOutcome outcome = reopened.verify();
            Assertions.assertTrue(outcome.ok(), outcome.message());
            Assertions.assertEquals(3, outcome.checkedRows());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void editedRowBreaksTheChain() throws Exception {
        Path root = Files.createTempDirectory("auditforge-test-journal-tamper-");
        try {
            Path file = root.resolve("journal.log");
            AuditLogger journal = new AuditLogger(file);
            journal.log(AuditLogger.AuditEvent.of("quality.gap", "item:a", "recorded", 1L, "ANALYZE", "a", Map.of("score", 40)));
            journal.log(AuditLogger.AuditEvent.of("quality.gap", "item:b", "recorded", 1L, "ANALYZE", "b", Map.of("score", 55)));
            journal.log(AuditLogger.AuditEvent.of("phase.complete", "phase:analyze", "ok", 1L, "ANALYZE", null, Map.of()));

            List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
            lines.set(1, lines.get(1).replace("\"score\":55", "\"score\":95"));
            Files.write(file, lines, StandardCharsets.UTF_8);

            AuditLogger.IntegrityOutcome outcome = new AuditLogger(file).verify();
            Assertions.assertFalse(outcome.ok());
            Assertions.assertEquals(2, outcome.brokenAtRow());
            Assertions.assertEquals("hash mismatch", outcome.message());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void emptyJournalIsIntact() throws Exception {
        Path root = Files.createTempDirectory("auditforge-test-journal-empty-");
        try {
            AuditLogger.IntegrityOutcome outcome = new AuditLogger(root.resolve("journal.log")).verify();
            Assertions.assertTrue(outcome.ok());
            Assertions.assertEquals(0, outcome.checkedRows());
        } finally {
            deleteRecursively(root);
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
