package io.auditforge.budget;

/**
 * Sum of independently estimated input components, in tokens.
 */
public record TokenEstimate(
        String itemId,
        long templateTokens,
        long referenceTokens,
        long crossReferenceTokens
) {
    public long total() {
        return templateTokens + referenceTokens + crossReferenceTokens;
    }
}
