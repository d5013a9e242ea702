package io.auditforge.worker;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.time.Instant;

/**
 * Writes a markdown stub listing the item scope. Used for dry runs and smoke tests of a pipeline.
 */
public final class EchoWorker implements Worker {
    @Override
    public String id() {
        return "echo";
    }

    @Override
    public WorkerResult execute(WorkerContext context) throws Exception {
        StringBuilder sb = new StringBuilder();
        if (context.appendOutput()) {
            sb.append(System.lineSeparator());
        }
        sb.append("## ").append(context.itemId()).append(" (").append(context.phase().dirName()).append(")")
                .append(System.lineSeparator());
        sb.append("- generated: ").append(Instant.now()).append(System.lineSeparator());
        sb.append("- attempt: ").append(context.attempt()).append(System.lineSeparator());
        if (context.mode() != null) {
            sb.append("- mode: ").append(context.mode()).append(System.lineSeparator());
        }
        if (context.feedback() != null && !context.feedback().isBlank()) {
            sb.append("- addressed feedback: ").append(context.feedback()).append(System.lineSeparator());
        }
        for (String ref : context.scope()) {
            sb.append("- scope: ").append(ref).append(System.lineSeparator());
        }
        Files.createDirectories(context.outputPath().toAbsolutePath().getParent());
        if (context.appendOutput()) {
            Files.writeString(context.outputPath(), sb.toString(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } else {
            Files.writeString(context.outputPath(), sb.toString(), StandardCharsets.UTF_8);
        }
        return WorkerResult.ok(context.outputPath().toString());
    }
}
