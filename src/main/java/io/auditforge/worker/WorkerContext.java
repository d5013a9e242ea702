package io.auditforge.worker;

import io.auditforge.model.Phase;
import io.auditforge.model.SynthesisMode;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Input of one worker invocation.
 *
 * <p>{@code appendOutput} is set for retries and for the second half of a split item: the worker must
 * extend the existing artifact instead of replacing it. {@code attributes} carries paths of shared
 * read-only material such as the delta or the synthesis input.
 */
public record WorkerContext(
        long runId,
        Phase phase,
        String itemId,
        List<String> scope,
        List<String> patterns,
        List<String> checklist,
        Path outputPath,
        boolean appendOutput,
        String feedback,
        int attempt,
        SynthesisMode mode,
        Map<String, String> attributes
) {
    public WorkerContext {
        scope = scope == null ? List.of() : List.copyOf(scope);
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        checklist = checklist == null ? List.of() : List.copyOf(checklist);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
