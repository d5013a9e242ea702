package io.auditforge.model;

import java.util.EnumMap;
import java.util.Map;

public record RunConfig(
        Tier tier,
        int maxConcurrency,
        Map<Phase, String> workerClasses
) {
    public RunConfig {
        tier = tier == null ? Tier.STANDARD : tier;
        maxConcurrency = Math.max(0, maxConcurrency);
        EnumMap<Phase, String> copy = new EnumMap<>(Phase.class);
        if (workerClasses != null) {
            copy.putAll(workerClasses);
        }
        workerClasses = Map.copyOf(copy);
    }

    public String workerClassFor(Phase phase, String fallback) {
        String configured = workerClasses.get(phase);
        return configured == null || configured.isBlank() ? fallback : configured;
    }
}
