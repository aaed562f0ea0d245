package io.buildqueue4j;

import io.buildqueue4j.core.ProgressLevel;
import io.buildqueue4j.core.ProgressReport;

/**
 * Progress channel handed to a running job. Reports are forwarded to the queue's job logger
 * and have no effect on scheduling.
 */
@FunctionalInterface
public interface ProgressSink {

    void report(ProgressReport report);

    default void report(String message) {
        report(ProgressReport.info(message));
    }

    default void warn(String message) {
        report(new ProgressReport(ProgressLevel.WARN, message));
    }

    default void error(String message) {
        report(new ProgressReport(ProgressLevel.ERROR, message));
    }
}
