package io.buildqueue4j.internal;

import io.buildqueue4j.BuildJob;
import io.buildqueue4j.core.JobResult;
import io.buildqueue4j.core.JobState;
import io.buildqueue4j.core.JobStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Scheduler-side wrapper around an enqueued job. State is written by the dispatcher thread only;
 * the log buffer is also appended to by the worker running the job.
 */
final class JobRecord {

    private final long sequence;
    private final String name;
    private final BuildJob<?> job;
    private final CompletableFuture<?> handle;
    private final List<String> logs = Collections.synchronizedList(new ArrayList<>());

    private JobState state = JobState.PENDING;
    private Instant startedAt;
    private Instant finishedAt;
    private Object value;
    private Throwable error;

    JobRecord(long sequence, String name, BuildJob<?> job, CompletableFuture<?> handle) {
        this.sequence = sequence;
        this.name = name;
        this.job = job;
        this.handle = handle;
    }

    long sequence() {
        return sequence;
    }

    String name() {
        return name;
    }

    BuildJob<?> job() {
        return job;
    }

    void appendLog(String line) {
        logs.add(line);
    }

    void markRunning(Instant now) {
        if (state != JobState.PENDING) {
            throw new IllegalStateException("Job " + name + " cannot start from state " + state);
        }
        state = JobState.RUNNING;
        startedAt = now;
    }

    void markFulfilled(Instant now, Object value) {
        settle(now, JobState.FULFILLED);
        this.value = value;
    }

    void markRejected(Instant now, Throwable error) {
        settle(now, JobState.REJECTED);
        this.error = error;
    }

    private void settle(Instant now, JobState terminal) {
        if (state != JobState.RUNNING) {
            throw new IllegalStateException("Job " + name + " cannot settle from state " + state);
        }
        state = terminal;
        finishedAt = now;
    }

    Duration duration() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        Duration d = Duration.between(startedAt, finishedAt);
        return d.isNegative() ? Duration.ZERO : d;
    }

    JobResult toResult() {
        if (!state.isTerminal()) {
            throw new IllegalStateException("Job " + name + " has not settled");
        }
        List<String> snapshot;
        synchronized (logs) {
            snapshot = List.copyOf(logs);
        }
        JobStatus status = (state == JobState.FULFILLED) ? JobStatus.FULFILLED : JobStatus.REJECTED;
        return new JobResult(name, status, value, error, startedAt, finishedAt, duration(), snapshot);
    }

    /**
     * Resolves the caller's handle with the settled outcome.
     */
    @SuppressWarnings("unchecked")
    void completeHandle() {
        if (state == JobState.FULFILLED) {
            ((CompletableFuture<Object>) handle).complete(value);
        } else if (state == JobState.REJECTED) {
            handle.completeExceptionally(error);
        }
    }

    /**
     * Fails the handle of a job that will never settle normally (queue stopped).
     */
    void abandon(Throwable reason) {
        handle.completeExceptionally(reason);
    }

    @Override
    public String toString() {
        return "JobRecord[#" + sequence + " " + name + " " + state + "]";
    }
}
