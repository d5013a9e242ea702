package io.auditforge.coverage;

import java.util.List;

/**
 * What a phase is expected to touch: scope units, catalog patterns and checklist entries.
 */
public record DeclaredScope(
        List<ScopeUnit> units,
        List<CatalogPattern> patterns,
        List<String> checklist
) {
    public DeclaredScope {
        units = units == null ? List.of() : List.copyOf(units);
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        checklist = checklist == null ? List.of() : List.copyOf(checklist);
    }

    public static DeclaredScope empty() {
        return new DeclaredScope(List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return units.isEmpty() && patterns.isEmpty() && checklist.isEmpty();
    }

    public record ScopeUnit(
            String id,
            boolean externallyReachable
    ) {
    }

    public record CatalogPattern(
            String id,
            boolean highRisk
    ) {
    }
}
