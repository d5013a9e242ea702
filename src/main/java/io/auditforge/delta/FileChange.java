package io.auditforge.delta;

/**
 * A path reported as changed since a revision. {@code changedLines} is added plus removed lines;
 * binary files report {@code -1}.
 */
public record FileChange(
        String path,
        int changedLines
) {
}
