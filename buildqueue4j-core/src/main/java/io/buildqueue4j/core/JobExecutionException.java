package io.buildqueue4j.core;

import java.util.List;

/**
 * Job failure carrying the log records produced by the failed work (e.g. build output).
 * The queue writes each non-blank record to the job logger at error level.
 */
public class JobExecutionException extends Exception {

    private final List<String> records;

    public JobExecutionException(String message) {
        this(message, List.of(), null);
    }

    public JobExecutionException(String message, List<String> records) {
        this(message, records, null);
    }

    public JobExecutionException(String message, List<String> records, Throwable cause) {
        super(message, cause);
        this.records = (records == null) ? List.of() : List.copyOf(records);
    }

    public List<String> records() {
        return records;
    }
}
