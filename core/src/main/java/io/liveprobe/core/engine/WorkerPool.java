package io.liveprobe.core.engine;

import io.liveprobe.core.config.ConfigurationException;
import io.liveprobe.core.limit.TokenBucketLimiter;
import io.liveprobe.core.routing.DocumentKeyRouter;
import io.liveprobe.core.routing.KeySpace;
import io.liveprobe.core.storage.StorageClient;
import io.liveprobe.core.workload.OperationSelector;
import io.liveprobe.core.workload.PayloadGenerator;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Dispatcher for N concurrent workload workers sharing one rate limiter.
 *
 * Responsibilities:
 *  - Start workerCount worker threads against the shared TokenBucketLimiter.
 *  - Expose per-worker counters for aggregation.
 *  - Shut down with an explicit drain contract: stop new work at once, let
 *    in-flight storage calls finish, wait at most a grace period, then
 *    abandon (never interrupt) whoever is still busy.
 *
 * The pool takes over the limiter's lifecycle: shutdown closes it so that
 * workers blocked in acquire() return immediately.
 */
public final class WorkerPool {
    private static final Logger log = Logger.getLogger(WorkerPool.class.getName());

    private final TokenBucketLimiter limiter;
    private final OperationSelector selector;
    private final DocumentKeyRouter router;
    private final KeySpace keySpace;
    private final StorageClient storage;
    private final PayloadGenerator payloads;
    private final OutcomeSink sink;
    private final Duration acquireTimeout;
    private final Duration errorBackoff;

    // guarded by this
    private ExecutorService executor;
    private ShutdownSignal signal;
    private final List<WorkerState> states = new ArrayList<>();
    private final List<Future<?>> futures = new ArrayList<>();

    public WorkerPool(TokenBucketLimiter limiter,
                      OperationSelector selector,
                      DocumentKeyRouter router,
                      KeySpace keySpace,
                      StorageClient storage,
                      PayloadGenerator payloads,
                      OutcomeSink sink,
                      Duration acquireTimeout,
                      Duration errorBackoff) {
        this.limiter = Objects.requireNonNull(limiter, "limiter");
        this.selector = Objects.requireNonNull(selector, "selector");
        this.router = Objects.requireNonNull(router, "router");
        this.keySpace = Objects.requireNonNull(keySpace, "keySpace");
        this.storage = Objects.requireNonNull(storage, "storage");
        this.payloads = Objects.requireNonNull(payloads, "payloads");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.acquireTimeout = requirePositive(acquireTimeout, "acquireTimeout");
        this.errorBackoff = Objects.requireNonNull(errorBackoff, "errorBackoff");
        if (errorBackoff.isNegative()) {
            throw new ConfigurationException("errorBackoff must be >= 0");
        }
    }

    /**
     * Start workerCount workers. They run until the signal is raised or
     * {@link #shutdown(Duration)} is called.
     */
    public synchronized void start(int workerCount, ShutdownSignal signal) {
        if (workerCount <= 0) {
            throw new ConfigurationException("workerCount must be > 0, got " + workerCount);
        }
        Objects.requireNonNull(signal, "signal");
        if (executor != null) {
            throw new IllegalStateException("worker pool already started");
        }
        this.signal = signal;

        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(workerCount, r -> {
            Thread t = new Thread(r, "worker-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        });

        for (int i = 0; i < workerCount; i++) {
            WorkerState state = new WorkerState("worker-" + i);
            Worker worker = new Worker(
                    state, signal, limiter, selector, router, keySpace,
                    storage, payloads, sink, acquireTimeout, errorBackoff
            );
            states.add(state);
            futures.add(executor.submit(worker));
        }
        log.info(() -> String.format("Started %d workers at %.2f ops/s (burst=%.0f)",
                workerCount, limiter.refillRatePerSecond(), limiter.capacity()));
    }

    /**
     * Raise the shutdown signal and wait up to grace for all workers to exit.
     *
     * After the signal no worker begins a new acquisition. Storage calls in
     * flight are allowed to complete. Workers still running when grace
     * elapses are reported as abandoned and left to finish on their own
     * (their threads are daemons).
     */
    public DrainReport shutdown(Duration grace) throws InterruptedException {
        Objects.requireNonNull(grace, "grace");
        ExecutorService exec;
        synchronized (this) {
            exec = executor;
            if (signal != null) {
                signal.raise();
            }
        }
        limiter.close();
        if (exec == null) {
            return new DrainReport(true, List.of(), Duration.ZERO);
        }

        long start = System.nanoTime();
        exec.shutdown();
        boolean terminated = exec.awaitTermination(Math.max(0L, grace.toNanos()), TimeUnit.NANOSECONDS);
        Duration waited = Duration.ofNanos(System.nanoTime() - start);

        List<String> abandoned = new ArrayList<>();
        if (!terminated) {
            synchronized (this) {
                for (int i = 0; i < futures.size(); i++) {
                    if (!futures.get(i).isDone()) {
                        abandoned.add(states.get(i).workerId());
                    }
                }
            }
        }

        DrainReport report = new DrainReport(terminated, abandoned, waited);
        if (terminated) {
            log.info(() -> String.format("All workers drained in %dms", waited.toMillis()));
        } else {
            log.warning(() -> String.format("Grace period of %dms elapsed; abandoning %d busy worker(s): %s",
                    grace.toMillis(), abandoned.size(), abandoned));
        }
        return report;
    }

    /** Counters of every worker, in start order. */
    public synchronized List<WorkerStats> workerStats() {
        List<WorkerStats> out = new ArrayList<>(states.size());
        for (WorkerState s : states) {
            out.add(s.snapshot());
        }
        return out;
    }

    public synchronized int workerCount() {
        return states.size();
    }

    private static Duration requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isZero() || d.isNegative()) {
            throw new ConfigurationException(name + " must be > 0");
        }
        return d;
    }
}
