package io.auditforge.quality;

import io.auditforge.model.WorkItem;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural checks on the artifact a worker left behind: it exists, it is not a stub, and it
 * contains every required marker. The score is the share of checks passed.
 */
public final class OutputArtifactValidator implements QualityValidator {
    private final int minOutputBytes;
    private final List<String> requiredMarkers;

    public OutputArtifactValidator(int minOutputBytes, List<String> requiredMarkers) {
        this.minOutputBytes = Math.max(0, minOutputBytes);
        this.requiredMarkers = requiredMarkers == null ? List.of() : List.copyOf(requiredMarkers);
    }

    @Override
    public Map<String, Score> validate(List<WorkItem> group) {
        Map<String, Score> out = new LinkedHashMap<>();
        for (WorkItem item : group) {
            out.put(item.id(), validate(item.outputPath() == null ? null : Path.of(item.outputPath())));
        }
        return out;
    }

    public Score validate(Path output) {
        int checks = 2 + requiredMarkers.size();
        if (output == null || !Files.isRegularFile(output)) {
            return new Score(0, "output missing: " + output);
        }
        String content;
        try {
            content = Files.readString(output, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read worker output: " + output, e);
        }
        int passed = 1;
        List<String> problems = new ArrayList<>();
        int bytes = content.getBytes(StandardCharsets.UTF_8).length;
        if (bytes >= minOutputBytes) {
            passed++;
        } else {
            problems.add("output has " + bytes + " bytes, expected at least " + minOutputBytes);
        }
        for (String marker : requiredMarkers) {
            if (content.contains(marker)) {
                passed++;
            } else {
                problems.add("missing section '" + marker + "'");
            }
        }
        return new Score(passed * 100 / checks, String.join("; ", problems));
    }
}
