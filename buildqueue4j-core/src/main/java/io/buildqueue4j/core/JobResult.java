package io.buildqueue4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Ledger entry for a settled job.
 *
 * value    : job return value (FULFILLED only, may be null)
 * error    : job failure (REJECTED only)
 * duration : finishedAt - startedAt
 * logs     : "[name] message" lines emitted while the job ran
 */
public record JobResult(
        String name,
        JobStatus status,
        Object value,
        Throwable error,
        Instant startedAt,
        Instant finishedAt,
        Duration duration,
        List<String> logs
) {

    public JobResult {
        logs = (logs == null) ? List.of() : List.copyOf(logs);
    }

    public boolean isFulfilled() {
        return status == JobStatus.FULFILLED;
    }

    public boolean isRejected() {
        return status == JobStatus.REJECTED;
    }
}
