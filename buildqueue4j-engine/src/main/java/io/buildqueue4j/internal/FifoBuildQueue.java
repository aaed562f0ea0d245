package io.buildqueue4j.internal;

import io.buildqueue4j.BuildJob;
import io.buildqueue4j.BuildQueue;
import io.buildqueue4j.JobFunction;
import io.buildqueue4j.ProgressSink;
import io.buildqueue4j.config.BuildQueueProperties;
import io.buildqueue4j.core.CapacityModel;
import io.buildqueue4j.core.JobExecutionException;
import io.buildqueue4j.core.JobResult;
import io.buildqueue4j.core.ProgressLevel;
import io.buildqueue4j.core.QueueListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.NOPLogger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-process build queue with FIFO admission and a bounded number of running jobs.
 *
 * <p>All queue state (pending jobs, running set, result ledger) is owned by a single dispatcher
 * thread. Callers and workers never touch it directly: enqueue, settlement, expansion, drain
 * requests and shutdown are posted as commands to the dispatcher's inbox and applied in order.
 *
 * <p>Job handles and drain futures are completed on the dispatcher thread. Dependent stages that
 * block should be attached with the {@code *Async} variants.
 *
 * <p>Typical usage:
 * <pre>{@code
 * BuildQueueProperties props = new BuildQueueProperties();
 * props.setWorkerCount(2);
 * props.setSubprocessSlotsPerWorker(2);
 *
 * FifoBuildQueue queue = new FifoBuildQueue(props, LoggerFactory.getLogger("builds"));
 * queue.start();
 *
 * services.forEach(s -> queue.enqueue(s, progress -> build(s, progress)));
 * queue.drain().join();
 *
 * queue.expand();
 * queue.enqueue("raven", progress -> build("raven", progress));
 * queue.drain().join();
 * }</pre>
 */
public class FifoBuildQueue implements BuildQueue {
    private static final Logger log = LoggerFactory.getLogger(FifoBuildQueue.class);

    private final BuildQueueProperties props;
    private final CapacityModel capacity;
    private final Logger jobLogger;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private final BlockingQueue<Command> inbox = new LinkedBlockingQueue<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong unnamedCounter = new AtomicLong();
    // enqueued and not yet settled, including jobs still sitting in the inbox
    private final AtomicInteger outstanding = new AtomicInteger();
    private final List<QueueListener> listeners = new CopyOnWriteArrayList<>();
    private volatile List<JobResult> resultsView = List.of();

    // dispatcher-owned state
    private final Deque<JobRecord> pending = new ArrayDeque<>();
    private final Set<JobRecord> running = new LinkedHashSet<>();
    private final List<JobResult> results = new ArrayList<>();
    private final List<CompletableFuture<Void>> drainWaiters = new ArrayList<>();
    private boolean closing = false;

    private ExecutorService workerPool;
    private volatile Thread dispatcherThread;

    private interface Command {
    }

    private record Enqueued(JobRecord record) implements Command {
    }

    private record Settled(JobRecord record, Object value, Throwable error, Instant finishedAt) implements Command {
    }

    private record Wake() implements Command {
    }

    private record DrainRequest(CompletableFuture<Void> barrier) implements Command {
    }

    private record Shutdown() implements Command {
    }

    private record Exit() implements Command {
    }

    public FifoBuildQueue(BuildQueueProperties props) {
        this(props, null);
    }

    /**
     * @param jobLogger receives job lines ({@code [name] message}); null means silent
     */
    public FifoBuildQueue(BuildQueueProperties props, Logger jobLogger) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.capacity = new CapacityModel(props.getWorkerCount(), props.getSubprocessSlotsPerWorker());
        this.jobLogger = (jobLogger != null) ? jobLogger : NOPLogger.NOP_LOGGER;

        Duration shutdownTimeout = Objects.requireNonNull(props.getShutdownTimeout(), "buildqueue.shutdownTimeout must not be null");
        if (shutdownTimeout.isZero() || shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("buildqueue.shutdownTimeout must be a positive duration");
        }
    }

    /**
     * Start the dispatcher and worker pool. Idempotent. Jobs enqueued earlier are admitted now.
     */
    @Override
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("build queue has been stopped");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }

        log.info("Build queue starting with workerCount={}, subprocessSlotsPerWorker={}, capacity={}, maxCapacity={}",
                capacity.workerCount(),
                capacity.subprocessSlotsPerWorker(),
                capacity.getCurrentCapacity(),
                capacity.maxCapacity());

        AtomicInteger workerIndex = new AtomicInteger();
        workerPool = Executors.newFixedThreadPool(capacity.maxCapacity(), r -> {
            Thread t = new Thread(r);
            t.setName("buildqueue.worker-" + workerIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        dispatcherThread = new Thread(this::dispatchLoop);
        dispatcherThread.setName("buildqueue.dispatcher");
        dispatcherThread.setDaemon(true);
        dispatcherThread.start();

        inbox.add(new Wake());
        log.info("Build queue started successfully.");
    }

    /**
     * Stop the queue. Idempotent. Running jobs get up to {@code shutdownTimeout} to settle;
     * pending jobs are failed with {@link IllegalStateException}.
     */
    @Override
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }

        log.info("Build queue stopping...");

        if (!started.get()) {
            abandonUnstarted();
            log.info("Build queue stopped before it was started.");
            return;
        }

        inbox.add(new Shutdown());

        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Build queue jobs still running after {}; interrupting", props.getShutdownTimeout());
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workerPool.shutdownNow();
        }

        inbox.add(new Exit());
        try {
            dispatcherThread.join(props.getShutdownTimeout().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (dispatcherThread.isAlive()) {
            log.warn("Build queue dispatcher did not exit within {}", props.getShutdownTimeout());
            dispatcherThread.interrupt();
        }
        log.info("Build queue stopped successfully.");
    }

    @Override
    public <T> CompletableFuture<T> enqueue(BuildJob<T> job) {
        if (job == null) {
            throw new IllegalArgumentException("job must not be null");
        }
        String name = job.name();
        if (name == null) {
            throw new IllegalArgumentException("job name must not be null");
        }
        if (stopped.get()) {
            throw new IllegalStateException("build queue has been stopped");
        }
        if (name.isBlank()) {
            name = "job-" + unnamedCounter.incrementAndGet();
        }

        CompletableFuture<T> handle = new CompletableFuture<>();
        JobRecord record = new JobRecord(sequence.incrementAndGet(), name, job, handle);

        outstanding.incrementAndGet();
        inbox.add(new Enqueued(record));
        return handle;
    }

    @Override
    public <T> CompletableFuture<T> enqueue(String name, JobFunction<T> function) {
        if (name == null) {
            throw new IllegalArgumentException("job name must not be null");
        }
        return enqueue(BuildJob.of(name, function));
    }

    @Override
    public CompletableFuture<Void> drain() {
        if (outstanding.get() == 0 || (stopped.get() && !isDispatcherAlive())) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> barrier = new CompletableFuture<>();
        inbox.add(new DrainRequest(barrier));
        return barrier;
    }

    @Override
    public List<JobResult> getResults() {
        return resultsView;
    }

    @Override
    public int getCurrentCapacity() {
        return capacity.getCurrentCapacity();
    }

    @Override
    public int expand() {
        boolean changed = capacity.expand();
        int limit = capacity.getCurrentCapacity();
        if (changed) {
            log.info("Build queue capacity expanded to {}", limit);
        }
        notifyListeners(l -> l.onCapacityChange(limit));
        inbox.add(new Wake());
        return limit;
    }

    @Override
    public void addListener(QueueListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    @Override
    public void removeListener(QueueListener listener) {
        listeners.remove(listener);
    }

    /**
     * Number of jobs enqueued and not yet settled.
     */
    public int outstandingJobs() {
        return outstanding.get();
    }

    private boolean isDispatcherAlive() {
        Thread t = dispatcherThread;
        return t != null && t.isAlive();
    }

    private void dispatchLoop() {
        while (true) {
            Command command;
            try {
                command = inbox.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (command instanceof Exit) {
                finishShutdown();
                break;
            }
            try {
                handle(command);
            } catch (Exception e) {
                log.error("build queue dispatcher failed command={} msg={}", command, e.getMessage(), e);
            }
        }
    }

    private void handle(Command command) {
        if (command instanceof Enqueued c) {
            onEnqueued(c.record());
        } else if (command instanceof Settled c) {
            onSettled(c);
        } else if (command instanceof DrainRequest c) {
            if (outstanding.get() == 0) {
                c.barrier().complete(null);
            } else {
                drainWaiters.add(c.barrier());
            }
        } else if (command instanceof Shutdown) {
            onShutdown();
        } else if (command instanceof Wake) {
            dispatch();
        }
    }

    private void onEnqueued(JobRecord record) {
        if (closing) {
            abandon(record, new IllegalStateException("build queue stopped"));
            return;
        }
        pending.addLast(record);
        int size = pending.size();
        log.debug("Build queue job enqueued name={} seq={} queueSize={}", record.name(), record.sequence(), size);
        notifyListeners(l -> l.onEnqueued(record.name(), size));
        dispatch();
    }

    private void dispatch() {
        if (closing) {
            return;
        }
        while (running.size() < capacity.getCurrentCapacity() && !pending.isEmpty()) {
            runNext(pending.pollFirst());
        }
    }

    private void runNext(JobRecord record) {
        record.markRunning(Instant.now());
        running.add(record);
        logLine(record, ProgressLevel.INFO, "started (active " + running.size() + "/" + capacity.getCurrentCapacity() + ")");

        try {
            workerPool.execute(() -> execute(record));
        } catch (RejectedExecutionException e) {
            // only happens while stop() is shutting the pool down
            log.warn("build queue worker pool rejected job name={} seq={}", record.name(), record.sequence());
            running.remove(record);
            abandon(record, new IllegalStateException("build queue stopped", e));
        }
    }

    // Runs on a worker thread; only the completion notice goes back to the dispatcher.
    private void execute(JobRecord record) {
        Object value = null;
        Throwable error = null;
        try {
            value = record.job().execute(progressSink(record));
        } catch (Throwable t) {
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            error = t;
        }
        inbox.add(new Settled(record, value, error, Instant.now()));
    }

    private ProgressSink progressSink(JobRecord record) {
        return report -> {
            if (report == null || report.isEmpty()) {
                return;
            }
            logLine(record, report.level(), report.message());
        };
    }

    private void onSettled(Settled settled) {
        JobRecord record = settled.record();
        if (!running.remove(record)) {
            log.warn("build queue ignoring settlement of job that is not running record={}", record);
            return;
        }

        if (settled.error() == null) {
            record.markFulfilled(settled.finishedAt(), settled.value());
            logLine(record, ProgressLevel.INFO, "completed in " + record.duration().toMillis() + "ms");
        } else {
            Throwable error = settled.error();
            record.markRejected(settled.finishedAt(), error);
            String reason = (error.getMessage() != null && !error.getMessage().isBlank())
                    ? error.getMessage()
                    : "Unknown error";
            logLine(record, ProgressLevel.ERROR, "failed after " + record.duration().toMillis() + "ms: " + reason);
            if (error instanceof JobExecutionException jee) {
                for (String line : jee.records()) {
                    if (line != null && !line.isBlank()) {
                        logLine(record, ProgressLevel.ERROR, line.trim());
                    }
                }
            }
            log.debug("Build queue job failed name={} seq={}", record.name(), record.sequence(), error);
        }

        JobResult result = record.toResult();
        results.add(result);
        resultsView = List.copyOf(results);
        outstanding.decrementAndGet();

        notifyListeners(l -> l.onSettled(result));
        record.completeHandle();

        dispatch();

        if (outstanding.get() == 0) {
            releaseDrainWaiters();
            notifyListeners(QueueListener::onIdle);
        }
    }

    private void onShutdown() {
        closing = true;
        IllegalStateException reason = new IllegalStateException("build queue stopped");
        while (!pending.isEmpty()) {
            abandon(pending.pollFirst(), reason);
        }
        if (outstanding.get() == 0) {
            releaseDrainWaiters();
        }
    }

    private void finishShutdown() {
        closing = true;
        IllegalStateException reason = new IllegalStateException("build queue stopped");
        for (Command leftover : inbox) {
            if (leftover instanceof Enqueued c) {
                abandon(c.record(), reason);
            } else if (leftover instanceof DrainRequest c) {
                c.barrier().complete(null);
            }
        }
        inbox.clear();
        for (JobRecord record : running) {
            log.warn("Build queue stopped while job was running name={} seq={}", record.name(), record.sequence());
            abandon(record, reason);
        }
        running.clear();
        drainWaiters.forEach(w -> w.complete(null));
        drainWaiters.clear();
    }

    private void abandonUnstarted() {
        IllegalStateException reason = new IllegalStateException("build queue stopped");
        List<Command> leftovers = new ArrayList<>();
        inbox.drainTo(leftovers);
        for (Command leftover : leftovers) {
            if (leftover instanceof Enqueued c) {
                abandon(c.record(), reason);
            } else if (leftover instanceof DrainRequest c) {
                c.barrier().complete(null);
            }
        }
    }

    private void abandon(JobRecord record, Throwable reason) {
        outstanding.decrementAndGet();
        record.abandon(reason);
    }

    private void releaseDrainWaiters() {
        if (drainWaiters.isEmpty()) {
            return;
        }
        List<CompletableFuture<Void>> waiters = new ArrayList<>(drainWaiters);
        drainWaiters.clear();
        waiters.forEach(w -> w.complete(null));
    }

    private void logLine(JobRecord record, ProgressLevel level, String message) {
        String text = "[" + record.name() + "] " + message;
        record.appendLog(text);
        switch (level) {
            case ERROR -> jobLogger.error(text);
            case WARN -> jobLogger.warn(text);
            default -> jobLogger.info(text);
        }
        notifyListeners(l -> l.onLog(record.name(), level, message));
    }

    private void notifyListeners(Consumer<QueueListener> event) {
        for (QueueListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (Exception e) {
                log.warn("build queue listener failed listener={} msg={}", listener, e.getMessage(), e);
            }
        }
    }
}
