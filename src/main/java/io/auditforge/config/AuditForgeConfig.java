package io.auditforge.config;

import io.auditforge.model.Phase;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Fixed on-disk layout of one data root.
 */
public final class AuditForgeConfig {
    public static final String DEFAULT_ROOT = ".auditforge";
    public static final String STATE_FILE = "STATE.json";
    public static final String SETTINGS_FILE = "auditforge-settings.json";

    private final Path rootDir;

    public AuditForgeConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static AuditForgeConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new AuditForgeConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path stateFile() {
        return rootDir.resolve(STATE_FILE);
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path phasesRoot() {
        return rootDir.resolve("phases");
    }

    public Path phaseDir(Phase phase) {
        return phasesRoot().resolve(phase.dirName());
    }

    public Path runDir() {
        return rootDir.resolve("run");
    }

    public Path deltaFile() {
        return runDir().resolve("delta.json");
    }

    public Path reclassifiedFindingsFile() {
        return runDir().resolve("reclassified-findings.json");
    }

    public Path historyRoot() {
        return rootDir.resolve("history");
    }

    public Path dbFile() {
        return rootDir.resolve("ledger.db");
    }

    public Path journalRoot() {
        return rootDir.resolve("journal");
    }

    public Path journalFile() {
        return journalRoot().resolve("journal.log");
    }

    public Path workersRoot() {
        return rootDir.resolve("workers");
    }

    public Path scriptWorkersFile() {
        return workersRoot().resolve("scripts.json");
    }
}
