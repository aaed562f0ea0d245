package io.buildqueue4j.core;

/**
 * Outcome of a settled job.
 */
public enum JobStatus {
    FULFILLED,
    REJECTED
}
