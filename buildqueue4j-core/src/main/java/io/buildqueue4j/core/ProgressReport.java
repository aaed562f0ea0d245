package io.buildqueue4j.core;

/**
 * Free-form progress message emitted by a running job.
 * A null level means {@link ProgressLevel#INFO}.
 */
public record ProgressReport(ProgressLevel level, String message) {

    public ProgressReport {
        if (level == null) {
            level = ProgressLevel.INFO;
        }
    }

    public static ProgressReport info(String message) {
        return new ProgressReport(ProgressLevel.INFO, message);
    }

    /**
     * Reports without text are dropped by the queue.
     */
    public boolean isEmpty() {
        return message == null || message.isBlank();
    }
}
