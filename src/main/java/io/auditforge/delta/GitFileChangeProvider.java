package io.auditforge.delta;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * {@link FileChangeProvider} backed by the {@code git} executable.
 */
public final class GitFileChangeProvider implements FileChangeProvider {
    private static final long GIT_TIMEOUT_SECONDS = 60L;

    private final Path repoDir;

    public GitFileChangeProvider(Path repoDir) {
        this.repoDir = repoDir;
    }

    @Override
    public String currentRevision() {
        return run(List.of("git", "rev-parse", "HEAD")).strip();
    }

    @Override
    public List<String> listFiles() {
        List<String> out = new ArrayList<>();
        for (String line : run(List.of("git", "ls-files", "--cached", "--others", "--exclude-standard")).split("\n")) {
            if (!line.isBlank()) {
                out.add(line.strip());
            }
        }
        return out;
    }

    @Override
    public Map<String, FileChange> changesSince(String revision) {
        if (revision == null || revision.isBlank()) {
            throw new IllegalArgumentException("revision is required to compute changes");
        }
        Map<String, FileChange> out = new LinkedHashMap<>();
        for (String line : run(List.of("git", "diff", "--numstat", "--no-renames", revision)).split("\n")) {
            FileChange change = parseNumstat(line);
            if (change != null) {
                out.put(change.path(), change);
            }
        }
        return out;
    }

    static FileChange parseNumstat(String line) {
        if (line == null || line.isBlank()) {
            return null;
        }
        String[] parts = line.split("\t", 3);
        if (parts.length < 3) {
            return null;
        }
        if ("-".equals(parts[0]) || "-".equals(parts[1])) {
            return new FileChange(parts[2].strip(), -1);
        }
        try {
            return new FileChange(parts[2].strip(), Integer.parseInt(parts[0]) + Integer.parseInt(parts[1]));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private String run(List<String> command) {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(repoDir.toFile());
        pb.redirectErrorStream(true);
        try {
            Process process = pb.start();
            process.getOutputStream().close();
            byte[] output = process.getInputStream().readAllBytes();
            if (!process.waitFor(GIT_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new IllegalStateException("git timed out: " + String.join(" ", command));
            }
            String text = new String(output, StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                throw new IllegalStateException("git failed (exit=" + process.exitValue() + "): "
                        + String.join(" ", command) + ": " + text.strip());
            }
            return text;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to run git in " + repoDir, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running git", e);
        }
    }
}
