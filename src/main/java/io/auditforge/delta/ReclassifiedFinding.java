package io.auditforge.delta;

import io.auditforge.model.Finding;

/**
 * A prior finding with its re-check instruction. {@code dismissalCarried} is true when a
 * NOT_VULNERABLE verdict is carried into the new run.
 */
public record ReclassifiedFinding(
        Finding finding,
        ReclassifyTag tag,
        ChangeKind fileChange,
        boolean dismissalCarried
) {
}
