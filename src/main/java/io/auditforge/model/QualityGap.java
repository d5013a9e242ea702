package io.auditforge.model;

public record QualityGap(
        String itemId,
        int score,
        int retryCount,
        String reason
) {
}
