package io.auditforge.delta;

public enum ReclassifyTag {
    /** Target file changed or unknown: investigate again. */
    RECHECK,
    /** Target file unchanged: a lightweight verification is enough. */
    VERIFY,
    /** Target file deleted: resolved and dropped from active tracking. */
    RESOLVED_BY_REMOVAL
}
