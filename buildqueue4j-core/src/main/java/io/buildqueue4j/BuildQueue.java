package io.buildqueue4j;

import io.buildqueue4j.core.JobResult;
import io.buildqueue4j.core.QueueListener;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Main scheduler API.
 *
 * <p>Jobs are admitted strictly in enqueue order, at most {@link #getCurrentCapacity()} at a time.
 * The capacity starts at one slot per worker and can be widened once with {@link #expand()}.
 *
 * <p>Typical usage:
 * <pre>{@code
 * queue.start();
 *
 * queue.enqueue("moon", progress -> {
 *     progress.report("Preparing build context");
 *     return buildImage("moon");
 * });
 *
 * queue.drain().join();
 * queue.getResults().forEach(System.out::println);
 * queue.stop();
 * }</pre>
 */
public interface BuildQueue {
    void start();

    void stop();

    /**
     * Append a job to the tail of the admission queue. Never blocks.
     *
     * @return handle completing with the job's value, or exceptionally with the job's error
     * @throws IllegalArgumentException if the job, its name or its function is missing
     * @throws IllegalStateException    if the queue has been stopped
     */
    <T> CompletableFuture<T> enqueue(BuildJob<T> job);

    <T> CompletableFuture<T> enqueue(String name, JobFunction<T> function);

    /**
     * Completes once no job is pending or running. Jobs enqueued after this call
     * but before completion are waited for as well. Never completes exceptionally.
     */
    CompletableFuture<Void> drain();

    /**
     * Settled jobs in settlement order. The returned list is an immutable snapshot.
     */
    List<JobResult> getResults();

    int getCurrentCapacity();

    /**
     * Switch to full capacity ({@code workerCount * subprocessSlotsPerWorker}). Idempotent.
     *
     * @return the effective capacity after the call
     */
    int expand();

    void addListener(QueueListener listener);

    void removeListener(QueueListener listener);
}
