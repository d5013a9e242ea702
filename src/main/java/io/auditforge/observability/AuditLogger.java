package io.auditforge.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.auditforge.util.Hashing;
import io.auditforge.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hash-chained JSON-lines journal of orchestration events: phase transitions, batch dispatch,
 * retries, gaps and archive operations. Each row carries the hash of the previous row.
 */
public final class AuditLogger {
    private static final ObjectMapper COMPACT_MAPPER = new ObjectMapper().findAndRegisterModules();
    private final Path auditFile;
    private String previousHash;

    public AuditLogger(Path auditFile) {
        this.auditFile = auditFile;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize journal file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("run_id", event.runId());
        row.put("phase", event.phase());
        row.put("item_id", event.itemId());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(toCompactJson(row));
        row.put("hash", rowHash);
        String line = toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write journal", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Recomputes the chain from the first row and reports the first broken link.
     */
    public synchronized IntegrityOutcome verify() {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read journal: " + auditFile, e);
        }
        String expectedPrev = "";
        int checked = 0;
        for (String line : lines) {
            if (line == null || line.isBlank()) {
                continue;
            }
            checked++;
            try {
                JsonNode node = Jsons.mapper().readTree(line);
                if (!(node instanceof ObjectNode row)) {
                    return new IntegrityOutcome(false, checked, checked, "row is not an object");
                }
                String hash = row.path("hash").asText("");
                if (!expectedPrev.equals(row.path("prev_hash").asText(""))) {
                    return new IntegrityOutcome(false, checked, checked, "prev_hash mismatch");
                }
                ObjectNode unsigned = row.deepCopy();
                unsigned.remove("hash");
                String recomputed = Hashing.sha256Hex(COMPACT_MAPPER.writeValueAsString(unsigned));
                if (!recomputed.equals(hash)) {
                    return new IntegrityOutcome(false, checked, checked, "hash mismatch");
                }
                expectedPrev = hash;
            } catch (JsonProcessingException e) {
                return new IntegrityOutcome(false, checked, checked, "unparseable row: " + e.getOriginalMessage());
            }
        }
        return new IntegrityOutcome(true, checked, 0, "ok");
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Failed to read journal tail: " + auditFile, e);
        }
    }

    private String toCompactJson(Map<String, Object> row) {
        try {
            return COMPACT_MAPPER.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize journal row", e);
        }
    }

    public record AuditEvent(
            String action,
            String resource,
            String result,
            Long runId,
            String phase,
            String itemId,
            Map<String, Object> details
    ) {
        public static AuditEvent of(
                String action,
                String resource,
                String result,
                Long runId,
                String phase,
                String itemId,
                Map<String, Object> details
        ) {
            return new AuditEvent(action, resource, result, runId, phase, itemId, details == null ? Map.of() : details);
        }
    }

    public record IntegrityOutcome(
            boolean ok,
            int checkedRows,
            int brokenAtRow,
            String message
    ) {
    }
}
