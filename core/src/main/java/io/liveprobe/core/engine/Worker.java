package io.liveprobe.core.engine;

import io.liveprobe.core.limit.AcquireResult;
import io.liveprobe.core.limit.TokenBucketLimiter;
import io.liveprobe.core.routing.DocumentKey;
import io.liveprobe.core.routing.DocumentKeyRouter;
import io.liveprobe.core.routing.KeySpace;
import io.liveprobe.core.storage.DocumentNotFoundException;
import io.liveprobe.core.storage.DocumentRecord;
import io.liveprobe.core.storage.FieldUpdate;
import io.liveprobe.core.storage.StorageClient;
import io.liveprobe.core.storage.StorageException;
import io.liveprobe.core.workload.OperationKind;
import io.liveprobe.core.workload.OperationSelector;
import io.liveprobe.core.workload.PayloadGenerator;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One workload loop.
 *
 * Each iteration:
 *   1. stop if the shutdown signal is raised,
 *   2. acquire one token (a timeout just means "try again"),
 *   3. select an operation kind and build its key,
 *   4. call storage, classify the result, report it to the sink.
 *
 * Storage failures are counted and reported; they never end the loop.
 */
final class Worker implements Runnable {
    private static final Logger log = Logger.getLogger(Worker.class.getName());

    private final WorkerState state;
    private final ShutdownSignal signal;
    private final TokenBucketLimiter limiter;
    private final OperationSelector selector;
    private final DocumentKeyRouter router;
    private final KeySpace keySpace;
    private final StorageClient storage;
    private final PayloadGenerator payloads;
    private final OutcomeSink sink;
    private final Duration acquireTimeout;
    private final Duration errorBackoff;

    Worker(WorkerState state,
           ShutdownSignal signal,
           TokenBucketLimiter limiter,
           OperationSelector selector,
           DocumentKeyRouter router,
           KeySpace keySpace,
           StorageClient storage,
           PayloadGenerator payloads,
           OutcomeSink sink,
           Duration acquireTimeout,
           Duration errorBackoff) {
        this.state = state;
        this.signal = signal;
        this.limiter = limiter;
        this.selector = selector;
        this.router = router;
        this.keySpace = keySpace;
        this.storage = storage;
        this.payloads = payloads;
        this.sink = sink;
        this.acquireTimeout = acquireTimeout;
        this.errorBackoff = errorBackoff;
    }

    @Override
    public void run() {
        state.markRunning();
        Random rnd = ThreadLocalRandom.current();
        try {
            while (!signal.isRaised()) {
                AcquireResult r;
                try {
                    r = limiter.acquire(1, acquireTimeout);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                if (r == AcquireResult.CLOSED) {
                    break;
                }
                if (r == AcquireResult.TIMED_OUT) {
                    continue;
                }
                // A token granted after shutdown is dropped.
                if (signal.isRaised()) {
                    break;
                }

                OperationOutcome outcome = executeOne(rnd);
                if (!outcome.success() && !backOff()) {
                    break;
                }
            }
        } finally {
            state.markStopped();
        }
    }

    OperationOutcome executeOne(Random rnd) {
        OperationKind kind = selector.select(rnd);
        state.recordAttempt();

        DocumentKey key = null;
        OutcomeType type;
        Throwable error = null;
        long start = System.nanoTime();
        try {
            key = keyFor(kind, rnd);
            invoke(kind, key, rnd);
            type = OutcomeType.SUCCESS;
        } catch (StorageException e) {
            type = OutcomeType.OPERATION_ERROR;
            error = e;
        } catch (RuntimeException e) {
            type = OutcomeType.UNEXPECTED_ERROR;
            error = e;
        }
        long durationNanos = System.nanoTime() - start;

        if (type == OutcomeType.SUCCESS) {
            state.recordSuccess();
        } else {
            state.recordFailure(kind);
            logFailure(kind, key, type, error);
        }

        OperationOutcome outcome = new OperationOutcome(state.workerId(), kind, key, type, durationNanos, error);
        try {
            sink.record(outcome);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Outcome sink failed for op=" + kind.wireName(), e);
        }
        return outcome;
    }

    // ---------- internals ----------

    private DocumentKey keyFor(OperationKind kind, Random rnd) {
        long sequence = kind == OperationKind.INSERT
                ? keySpace.nextSequence()
                : keySpace.randomExisting(rnd);
        return router.buildKey(sequence);
    }

    private void invoke(OperationKind kind, DocumentKey key, Random rnd) {
        switch (kind) {
            case FIND -> storage.find(key);
            case INSERT -> storage.insert(new DocumentRecord(key, payloads.generate(key, rnd)));
            case UPDATE -> {
                if (!storage.update(key, FieldUpdate.touch(System.currentTimeMillis()))) {
                    throw new DocumentNotFoundException(key);
                }
            }
        }
    }

    private void logFailure(OperationKind kind, DocumentKey key, OutcomeType type, Throwable error) {
        String id = key == null ? "-" : key.id();
        if (type == OutcomeType.OPERATION_ERROR) {
            log.warning(() -> String.format("Operation failed: op=%s id=%s: %s", kind.wireName(), id, error));
        } else {
            log.log(Level.SEVERE, String.format("Unexpected error: op=%s id=%s", kind.wireName(), id), error);
        }
    }

    /**
     * Short pause after a failure so a persistent error does not turn into a hot loop.
     *
     * @return false if interrupted
     */
    private boolean backOff() {
        if (errorBackoff.isZero()) {
            return true;
        }
        try {
            Thread.sleep(errorBackoff.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
