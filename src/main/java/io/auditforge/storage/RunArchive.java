package io.auditforge.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import io.auditforge.config.AuditForgeConfig;
import io.auditforge.model.Finding;
import io.auditforge.model.PhaseStatus;
import io.auditforge.model.RunState;
import io.auditforge.util.Jsons;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Completed runs, one directory each under {@code history/}, named {@code {date}-{short-revision}}.
 * An archive is written once and only read afterwards.
 */
public final class RunArchive {
    public static final String FINDINGS_FILE = "findings.json";
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);
    private static final int SHORT_REVISION = 7;

    private final AuditForgeConfig config;

    public RunArchive(AuditForgeConfig config) {
        this.config = config;
    }

    /**
     * Moves the active state document and run artifacts into a new archive directory.
     */
    public ArchiveEntry archive(RunState state, List<Finding> findings, Instant now) {
        Path dir = uniqueDir(archiveName(now, state.revision()));
        try {
            Files.createDirectories(dir);
            moveIfExists(config.phasesRoot(), dir.resolve("phases"));
            moveIfExists(config.runDir(), dir.resolve("run"));
            Jsons.mapper().writeValue(dir.resolve(FINDINGS_FILE).toFile(), findings == null ? List.of() : findings);
            StateStore.writeAtomically(dir.resolve(AuditForgeConfig.STATE_FILE), Jsons.toJson(state));
            Files.deleteIfExists(config.stateFile());
            Files.createDirectories(config.phasesRoot());
            Files.createDirectories(config.runDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to archive run " + state.runId() + " into " + dir, e);
        }
        return entry(dir, state);
    }

    public List<ArchiveEntry> list() {
        List<ArchiveEntry> out = new ArrayList<>();
        Path root = config.historyRoot();
        if (!Files.isDirectory(root)) {
            return out;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path dir : stream) {
                Path stateFile = dir.resolve(AuditForgeConfig.STATE_FILE);
                if (Files.exists(stateFile)) {
                    out.add(entry(dir, StateStore.read(stateFile)));
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to list run archive: " + root, e);
        }
        out.sort(Comparator.comparingLong(ArchiveEntry::runId));
        return out;
    }

    public Optional<ArchiveEntry> latest() {
        List<ArchiveEntry> all = list();
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
    }

    /**
     * Newest archive whose phases all completed. Abandoned runs are skipped as a stacking base.
     */
    public Optional<ArchiveEntry> latestComplete() {
        List<ArchiveEntry> all = list();
        for (int i = all.size() - 1; i >= 0; i--) {
            if (all.get(i).complete()) {
                return Optional.of(all.get(i));
            }
        }
        return Optional.empty();
    }

    public long highestRunId() {
        return list().stream().mapToLong(ArchiveEntry::runId).max().orElse(0L);
    }

    public RunState readState(ArchiveEntry entry) {
        return StateStore.read(Path.of(entry.dir()).resolve(AuditForgeConfig.STATE_FILE));
    }

    public List<Finding> readFindings(ArchiveEntry entry) {
        Path file = Path.of(entry.dir()).resolve(FINDINGS_FILE);
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            return Jsons.mapper().readValue(file.toFile(), new TypeReference<List<Finding>>() {
            });
        } catch (IOException e) {
            throw new CorruptStateException(file, "unreadable archived findings", e);
        }
    }

    static String archiveName(Instant now, String revision) {
        String rev = revision == null ? "" : revision.trim().toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < rev.length() && sb.length() < SHORT_REVISION; i++) {
            char ch = rev.charAt(i);
            if ((ch >= 'a' && ch <= 'z') || (ch >= '0' && ch <= '9')) {
                sb.append(ch);
            }
        }
        String shortRev = sb.length() == 0 ? "norev" : sb.toString();
        return DATE.format(now) + "-" + shortRev;
    }

    private Path uniqueDir(String name) {
        Path candidate = config.historyRoot().resolve(name);
        int suffix = 2;
        while (Files.exists(candidate)) {
            candidate = config.historyRoot().resolve(name + "-" + suffix);
            suffix++;
        }
        return candidate;
    }

    private static void moveIfExists(Path source, Path target) throws IOException {
        if (Files.exists(source)) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static ArchiveEntry entry(Path dir, RunState state) {
        boolean complete = state.phases().values().stream().allMatch(p -> p.status() == PhaseStatus.COMPLETE);
        return new ArchiveEntry(
                dir.getFileName().toString(),
                dir.toString(),
                state.runId(),
                state.revision(),
                state.createdAtMs(),
                state.updatedAtMs(),
                state.config().tier().label(),
                complete
        );
    }

    public record ArchiveEntry(
            String name,
            String dir,
            long runId,
            String revision,
            long createdAtMs,
            long updatedAtMs,
            String tier,
            boolean complete
    ) {
    }
}
