package io.auditforge.scheduler;

import io.auditforge.coverage.DeclaredScope;

import java.util.List;

/**
 * JSON work plan: {@code {"items": [...], "scope": {...}}}.
 */
public record PlanFile(
        List<PlanItem> items,
        DeclaredScope scope
) {
    public PlanFile {
        items = items == null ? List.of() : List.copyOf(items);
        scope = scope == null ? DeclaredScope.empty() : scope;
    }

    public record PlanItem(
            String id,
            String worker,
            List<String> scope,
            List<String> patterns,
            List<String> checklist,
            String output
    ) {
    }
}
