package io.buildqueue4j.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Number of jobs allowed to run at once.
 *
 * <p>One slot per worker until {@link #expand()} is called, then
 * {@code workerCount * subprocessSlotsPerWorker}. The expansion is one-way.
 */
public final class CapacityModel {

    private final int workerCount;
    private final int subprocessSlotsPerWorker;
    private final AtomicBoolean expanded = new AtomicBoolean(false);

    public CapacityModel(int workerCount, int subprocessSlotsPerWorker) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be a positive integer: " + workerCount);
        }
        if (subprocessSlotsPerWorker < 1) {
            throw new IllegalArgumentException("subprocessSlotsPerWorker must be a positive integer: " + subprocessSlotsPerWorker);
        }
        if ((long) workerCount * subprocessSlotsPerWorker > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("maximum capacity out of range: " + workerCount + " x " + subprocessSlotsPerWorker);
        }
        this.workerCount = workerCount;
        this.subprocessSlotsPerWorker = subprocessSlotsPerWorker;
    }

    public int getCurrentCapacity() {
        return expanded.get() ? maxCapacity() : workerCount;
    }

    /**
     * @return true if this call switched the model to full capacity
     */
    public boolean expand() {
        return expanded.compareAndSet(false, true);
    }

    public boolean isExpanded() {
        return expanded.get();
    }

    public int maxCapacity() {
        return workerCount * subprocessSlotsPerWorker;
    }

    public int workerCount() {
        return workerCount;
    }

    public int subprocessSlotsPerWorker() {
        return subprocessSlotsPerWorker;
    }

    @Override
    public String toString() {
        return "CapacityModel[workers=" + workerCount
                + ", slotsPerWorker=" + subprocessSlotsPerWorker
                + ", expanded=" + expanded.get() + "]";
    }
}
