package io.auditforge.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.auditforge.model.Phase;
import io.auditforge.model.PhaseState;
import io.auditforge.model.PhaseStatus;
import io.auditforge.model.RunState;
import io.auditforge.util.Jsons;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Optional;

/**
 * Durable home of the active {@link RunState}.
 *
 * <p>Every save replaces the whole document through a synced temp file and an atomic rename, so a
 * crash leaves either the previous or the new document on disk, never a torn one.
 */
public final class StateStore {
    private final Path stateFile;
    private final Object lock = new Object();

    public StateStore(Path stateFile) {
        this.stateFile = stateFile;
    }

    public Path stateFile() {
        return stateFile;
    }

    public Optional<RunState> load() {
        synchronized (lock) {
            if (!Files.exists(stateFile)) {
                return Optional.empty();
            }
            return Optional.of(read(stateFile));
        }
    }

    public RunState require() {
        return load().orElseThrow(() -> new IllegalStateException("No active run at " + stateFile + "; run 'start' first"));
    }

    public void save(RunState state) {
        synchronized (lock) {
            writeAtomically(stateFile, Jsons.toJson(state));
        }
    }

    /**
     * Applies one phase transition to the stored document and persists it before returning.
     */
    public RunState transitionPhase(Phase phase, PhaseStatus newStatus) {
        synchronized (lock) {
            RunState current = require();
            RunState next = applyTransition(current, phase, newStatus, Instant.now().toEpochMilli());
            if (next != current) {
                writeAtomically(stateFile, Jsons.toJson(next));
            }
            return next;
        }
    }

    /**
     * Pure transition check. Returns the same instance when the phase is already in {@code newStatus}.
     */
    public static RunState applyTransition(RunState state, Phase phase, PhaseStatus newStatus, long nowMs) {
        PhaseState current = state.phase(phase);
        PhaseStatus from = current.status();
        if (from == newStatus) {
            return state;
        }
        switch (newStatus) {
            case PENDING -> throw new InvalidTransitionException(phase, from, newStatus,
                    "Phase " + phase.dirName() + " cannot regress from " + from + " to PENDING");
            case IN_PROGRESS -> {
                if (from == PhaseStatus.COMPLETE) {
                    throw new InvalidTransitionException(phase, from, newStatus,
                            "Phase " + phase.dirName() + " is already COMPLETE");
                }
                for (Phase before : phase.predecessors()) {
                    PhaseStatus status = state.phase(before).status();
                    if (status != PhaseStatus.COMPLETE) {
                        throw new PhasePrerequisiteException(phase, from, before, status);
                    }
                }
            }
            case COMPLETE -> {
                if (from != PhaseStatus.IN_PROGRESS) {
                    throw new InvalidTransitionException(phase, from, newStatus,
                            "Phase " + phase.dirName() + " must be IN_PROGRESS before COMPLETE, was " + from);
                }
            }
            default -> throw new IllegalArgumentException("Unsupported phase status: " + newStatus);
        }
        return state.withPhase(current.withStatus(newStatus, nowMs)).touched(nowMs);
    }

    public static RunState read(Path file) {
        String raw;
        try {
            raw = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CorruptStateException(file, "unreadable", e);
        }
        if (raw.isBlank()) {
            throw new CorruptStateException(file, "empty document", null);
        }
        RunState state;
        try {
            state = Jsons.mapper().readValue(raw, RunState.class);
        } catch (JsonProcessingException e) {
            throw new CorruptStateException(file, e.getOriginalMessage(), e);
        }
        if (state == null || !RunState.SCHEMA.equals(state.schema())) {
            throw new CorruptStateException(file, "unexpected schema "
                    + (state == null ? null : state.schema()), null);
        }
        if (state.runId() <= 0L || state.config() == null) {
            throw new CorruptStateException(file, "missing run metadata", null);
        }
        return state;
    }

    public static void writeAtomically(Path target, String content) {
        Path parent = target.toAbsolutePath().getParent();
        Path tmp = parent.resolve(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(parent);
            try (FileChannel channel = FileChannel.open(tmp,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(content.getBytes(StandardCharsets.UTF_8));
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ignored) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to write state document: " + target, e);
        }
    }
}
