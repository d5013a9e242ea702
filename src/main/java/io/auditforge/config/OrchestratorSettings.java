package io.auditforge.config;

import io.auditforge.model.Tier;
import io.auditforge.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Plain key/value settings with documented defaults, read from {@code auditforge-settings.json}.
 * Missing or out-of-range values fall back to the defaults below.
 */
public record OrchestratorSettings(
        Tier tier,
        int maxConcurrency,
        Map<String, String> workerClasses,
        String defaultWorkerClass,
        long itemTimeoutMs,
        int qualityThreshold,
        int maxRetriesPerPhase,
        int validatorGroupSize,
        int minOutputBytes,
        List<String> requiredOutputMarkers,
        long templateOverheadTokens,
        long perReferenceTokens,
        long crossReferenceTokens,
        long smallItemTokens,
        long largeItemTokens,
        long splitItemTokens,
        long inlineModeTokens,
        long partialDiskModeTokens,
        double massiveRewriteRatio,
        int majorChangeLines
) {
    public static final long DEFAULT_ITEM_TIMEOUT_MS = 30L * 60L * 1000L;
    public static final int DEFAULT_QUALITY_THRESHOLD = 70;
    public static final int DEFAULT_MAX_RETRIES_PER_PHASE = 3;
    public static final int DEFAULT_VALIDATOR_GROUP_SIZE = 10;
    public static final double DEFAULT_MASSIVE_REWRITE_RATIO = 0.70d;
    public static final int DEFAULT_MAJOR_CHANGE_LINES = 10;

    public OrchestratorSettings {
        workerClasses = workerClasses == null ? Map.of() : Map.copyOf(workerClasses);
        requiredOutputMarkers = requiredOutputMarkers == null ? List.of() : List.copyOf(requiredOutputMarkers);
    }

    public static OrchestratorSettings defaults() {
        return new OrchestratorSettings(
                Tier.STANDARD,
                0,
                Map.of(),
                "echo",
                DEFAULT_ITEM_TIMEOUT_MS,
                DEFAULT_QUALITY_THRESHOLD,
                DEFAULT_MAX_RETRIES_PER_PHASE,
                DEFAULT_VALIDATOR_GROUP_SIZE,
                64,
                List.of(),
                6_000L,
                3_000L,
                2_000L,
                40_000L,
                80_000L,
                120_000L,
                80_000L,
                120_000L,
                DEFAULT_MASSIVE_REWRITE_RATIO,
                DEFAULT_MAJOR_CHANGE_LINES
        );
    }

    public static OrchestratorSettings load(Path file) {
        OrchestratorSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load orchestrator settings: " + file, e);
        }
    }

    static OrchestratorSettings fromFile(SettingsFile file, OrchestratorSettings defaults) {
        if (file == null) {
            return defaults;
        }
        Tier tier = file.tier() == null || file.tier().isBlank() ? defaults.tier() : Tier.fromString(file.tier());
        long smallItem = sanitizeLong(file.smallItemTokens(), defaults.smallItemTokens(), 1L);
        long largeItem = Math.max(smallItem, sanitizeLong(file.largeItemTokens(), defaults.largeItemTokens(), 1L));
        long splitItem = Math.max(largeItem, sanitizeLong(file.splitItemTokens(), defaults.splitItemTokens(), 1L));
        long inlineMode = sanitizeLong(file.inlineModeTokens(), defaults.inlineModeTokens(), 1L);
        long partialMode = Math.max(inlineMode,
                sanitizeLong(file.partialDiskModeTokens(), defaults.partialDiskModeTokens(), 1L));
        double ratio = file.massiveRewriteRatio() == null
                || file.massiveRewriteRatio() <= 0d
                || file.massiveRewriteRatio() > 1d
                ? defaults.massiveRewriteRatio()
                : file.massiveRewriteRatio();
        return new OrchestratorSettings(
                tier,
                sanitizeInt(file.maxConcurrency(), defaults.maxConcurrency(), 0),
                file.workerClasses() == null ? defaults.workerClasses() : file.workerClasses(),
                file.defaultWorkerClass() == null || file.defaultWorkerClass().isBlank()
                        ? defaults.defaultWorkerClass()
                        : file.defaultWorkerClass().trim(),
                sanitizeLong(file.itemTimeoutMs(), defaults.itemTimeoutMs(), 100L),
                Math.min(100, sanitizeInt(file.qualityThreshold(), defaults.qualityThreshold(), 0)),
                sanitizeInt(file.maxRetriesPerPhase(), defaults.maxRetriesPerPhase(), 0),
                sanitizeInt(file.validatorGroupSize(), defaults.validatorGroupSize(), 1),
                sanitizeInt(file.minOutputBytes(), defaults.minOutputBytes(), 0),
                file.requiredOutputMarkers() == null ? defaults.requiredOutputMarkers() : file.requiredOutputMarkers(),
                sanitizeLong(file.templateOverheadTokens(), defaults.templateOverheadTokens(), 0L),
                sanitizeLong(file.perReferenceTokens(), defaults.perReferenceTokens(), 0L),
                sanitizeLong(file.crossReferenceTokens(), defaults.crossReferenceTokens(), 0L),
                smallItem,
                largeItem,
                splitItem,
                inlineMode,
                partialMode,
                ratio,
                sanitizeInt(file.majorChangeLines(), defaults.majorChangeLines(), 1)
        );
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    record SettingsFile(
            String tier,
            Integer maxConcurrency,
            Map<String, String> workerClasses,
            String defaultWorkerClass,
            Long itemTimeoutMs,
            Integer qualityThreshold,
            Integer maxRetriesPerPhase,
            Integer validatorGroupSize,
            Integer minOutputBytes,
            List<String> requiredOutputMarkers,
            Long templateOverheadTokens,
            Long perReferenceTokens,
            Long crossReferenceTokens,
            Long smallItemTokens,
            Long largeItemTokens,
            Long splitItemTokens,
            Long inlineModeTokens,
            Long partialDiskModeTokens,
            Double massiveRewriteRatio,
            Integer majorChangeLines
    ) {
    }
}
