package io.auditforge.quality;

/**
 * Quality of one worker output, {@code percent} in {@code [0, 100]}. {@code feedback} lists what was
 * missing and is handed to the retry.
 */
public record Score(
        int percent,
        String feedback
) {
    public Score {
        percent = Math.max(0, Math.min(100, percent));
        feedback = feedback == null ? "" : feedback;
    }
}
