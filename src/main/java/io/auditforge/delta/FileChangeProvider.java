package io.auditforge.delta;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of the version-control tooling of the analyzed tree.
 */
public interface FileChangeProvider {
    String currentRevision();

    List<String> listFiles();

    /**
     * Paths whose content differs from {@code revision}, keyed by path.
     */
    Map<String, FileChange> changesSince(String revision);
}
