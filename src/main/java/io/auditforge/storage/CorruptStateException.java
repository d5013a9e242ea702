package io.auditforge.storage;

import java.nio.file.Path;

/**
 * The state document exists but cannot be read. Requires operator intervention; the store
 * never reinitializes over it.
 */
public final class CorruptStateException extends RuntimeException {
    private final Path file;

    public CorruptStateException(Path file, String reason, Throwable cause) {
        super("Corrupt run state at " + file + ": " + reason, cause);
        this.file = file;
    }

    public Path file() {
        return file;
    }
}
