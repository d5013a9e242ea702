package io.auditforge.delta;

/**
 * Classification of one path between the prior run and the current tree. {@code magnitude} is only
 * set for {@link ChangeKind#MODIFIED}.
 */
public record DeltaRecord(
        String path,
        ChangeKind kind,
        ChangeMagnitude magnitude,
        int changedLines
) {
}
