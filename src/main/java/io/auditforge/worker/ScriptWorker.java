package io.auditforge.worker;

import io.auditforge.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command per work item. The invocation context is written to stdin as JSON and
 * the output location is also exported as {@code AUDITFORGE_OUTPUT}; exit code 0 means success.
 */
public final class ScriptWorker implements Worker {
    private static final int MAX_ERROR_CHARS = 512;

    private final String id;
    private final List<String> command;
    private final long timeoutMs;

    public ScriptWorker(String id, List<String> command, long timeoutMs) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("script worker id cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script worker command cannot be empty: " + id);
        }
        this.id = id;
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public WorkerResult execute(WorkerContext context) {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        pb.environment().put("AUDITFORGE_OUTPUT", context.outputPath().toString());
        pb.environment().put("AUDITFORGE_APPEND", Boolean.toString(context.appendOutput()));
        pb.environment().put("AUDITFORGE_PHASE", context.phase().dirName());
        pb.environment().put("AUDITFORGE_ITEM", context.itemId());
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return WorkerResult.fail("script spawn failed: " + e.getMessage());
        }

        try {
            byte[] input = Jsons.toJson(payload(context)).getBytes(StandardCharsets.UTF_8);
            process.getOutputStream().write(input);
            process.getOutputStream().flush();
            process.getOutputStream().close();

            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return WorkerResult.fail("script timeout after " + Duration.ofMillis(timeoutMs));
            }

            String combined = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            if (process.exitValue() == 0) {
                return WorkerResult.ok(combined.strip());
            }
            return WorkerResult.fail("script exit=" + process.exitValue() + " output=" + truncate(combined));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return WorkerResult.fail("script interrupted");
        } catch (IOException e) {
            process.destroyForcibly();
            return WorkerResult.fail("script execution failed: " + e.getMessage());
        }
    }

    private static Map<String, Object> payload(WorkerContext context) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("runId", context.runId());
        out.put("phase", context.phase().dirName());
        out.put("itemId", context.itemId());
        out.put("scope", context.scope());
        out.put("patterns", context.patterns());
        out.put("checklist", context.checklist());
        out.put("outputPath", context.outputPath().toString());
        out.put("appendOutput", context.appendOutput());
        out.put("feedback", context.feedback());
        out.put("attempt", context.attempt());
        out.put("mode", context.mode() == null ? null : context.mode().name());
        out.put("attributes", context.attributes());
        return out;
    }

    private String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
