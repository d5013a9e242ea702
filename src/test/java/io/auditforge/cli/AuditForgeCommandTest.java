package io.auditforge.cli;

import io.auditforge.config.AuditForgeConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class AuditForgeCommandTest {

    @Test
    void initCreatesLayoutAndStatusReportsNoRun() throws Exception {
        Path root = Files.createTempDirectory("auditforge-test-cli-");
        try {
            Path data = root.resolve("data");
            Assertions.assertEquals(0, execute("--root", data.toString(), "init").exitCode);
            Assertions.assertTrue(Files.isDirectory(data.resolve("phases").resolve("scan")));
            Assertions.assertTrue(Files.isDirectory(data.resolve("history")));
            Assertions.assertTrue(Files.exists(data.resolve("ledger.db")));

            Result status = execute("--root", data.toString(), "status");
            Assertions.assertEquals(1, status.exitCode);
            Assertions.assertTrue(status.out.contains("no active run"));

            Result delta = execute("--root", data.toString(), "delta");
            Assertions.assertEquals(1, delta.exitCode);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void readOnlyCommandsPrintJson() throws Exception {
        Path root = Files.createTempDirectory("auditforge-test-cli-read-");
        try {
            String data = root.resolve("data").toString();
            Result workers = execute("--root", data, "workers");
            Assertions.assertEquals(0, workers.exitCode);
            Assertions.assertTrue(workers.out.contains("echo"));
            Assertions.assertTrue(workers.out.contains("fail"));

            Result settings = execute("--root", data, "settings");
            Assertions.assertEquals(0, settings.exitCode);
            Assertions.assertTrue(settings.out.contains(AuditForgeConfig.SETTINGS_FILE));
            Assertions.assertTrue(settings.out.contains("\"qualityThreshold\" : 70"));

            Result journal = execute("--root", data, "journal-verify");
            Assertions.assertEquals(0, journal.exitCode);
            Assertions.assertTrue(journal.out.contains("\"ok\" : true"));

            Result findings = execute("--root", data, "findings");
            Assertions.assertEquals(0, findings.exitCode);
            Assertions.assertTrue(findings.out.contains("[ ]"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void runPhaseRequiresPhaseOption() throws Exception {
        Path root = Files.createTempDirectory("auditforge-test-cli-usage-");
        try {
            Assertions.assertEquals(2, execute("--root", root.toString(), "run-phase").exitCode);
            Assertions.assertEquals(2, execute("--root", root.toString(), "no-such-command").exitCode);
        } finally {
            deleteRecursively(root);
        }
    }

    private static Result execute(String... args) {
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (PrintStream capture = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            System.setOut(capture);
            CommandLine commandLine = new CommandLine(new AuditForgeCommand());
            commandLine.setErr(new PrintWriter(new ByteArrayOutputStream(), true));
            int exitCode = commandLine.execute(args);
            return new Result(exitCode, buffer.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(original);
        }
    }

    private record Result(int exitCode, String out) {
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
