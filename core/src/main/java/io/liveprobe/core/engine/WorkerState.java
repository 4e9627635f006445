package io.liveprobe.core.engine;

import io.liveprobe.core.workload.OperationKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters of a single worker.
 *
 * Single writer (the owning worker thread), single reader (whoever
 * aggregates). Atomics only provide visibility here; they are never contended.
 */
final class WorkerState {

    private final String workerId;
    private volatile boolean running;
    private final AtomicLong attempts = new AtomicLong();
    private final AtomicLong successes = new AtomicLong();
    private final EnumMap<OperationKind, AtomicLong> failures = new EnumMap<>(OperationKind.class);

    WorkerState(String workerId) {
        this.workerId = workerId;
        for (OperationKind k : OperationKind.values()) {
            failures.put(k, new AtomicLong());
        }
    }

    String workerId() {
        return workerId;
    }

    boolean running() {
        return running;
    }

    void markRunning() {
        running = true;
    }

    void markStopped() {
        running = false;
    }

    void recordAttempt() {
        attempts.incrementAndGet();
    }

    void recordSuccess() {
        successes.incrementAndGet();
    }

    void recordFailure(OperationKind kind) {
        failures.get(kind).incrementAndGet();
    }

    WorkerStats snapshot() {
        EnumMap<OperationKind, Long> f = new EnumMap<>(OperationKind.class);
        for (var e : failures.entrySet()) {
            f.put(e.getKey(), e.getValue().get());
        }
        return new WorkerStats(workerId, running, attempts.get(), successes.get(), Map.copyOf(f));
    }
}
