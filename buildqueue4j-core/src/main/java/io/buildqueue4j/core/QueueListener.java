package io.buildqueue4j.core;

/**
 * Observer for queue activity, e.g. to drive a progress panel.
 *
 * <p>Callbacks run on the queue's dispatcher or worker threads and must return quickly.
 * Exceptions thrown by a listener are logged and otherwise ignored.
 */
public interface QueueListener {

    default void onEnqueued(String name, int queueSize) {
    }

    default void onCapacityChange(int capacity) {
    }

    default void onLog(String name, ProgressLevel level, String message) {
    }

    default void onSettled(JobResult result) {
    }

    /**
     * Nothing pending and nothing running.
     */
    default void onIdle() {
    }
}
