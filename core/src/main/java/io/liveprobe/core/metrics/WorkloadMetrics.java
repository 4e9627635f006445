package io.liveprobe.core.metrics;

import io.liveprobe.core.engine.OperationOutcome;
import io.liveprobe.core.engine.OutcomeSink;
import io.liveprobe.core.workload.OperationKind;

import java.util.EnumMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Aggregate workload counters, fed by every worker.
 *
 * Thread-safe via AtomicLong; latencies go to an {@link OperationLatencyTracker}.
 * Throughput is measured from construction (or the last {@link #reset()}).
 */
public final class WorkloadMetrics implements OutcomeSink {

    private static final double DEFAULT_ALPHA = 0.2;
    private static final int DEFAULT_SAMPLES = 1024;

    private static final class KindCounters {
        final AtomicLong total = new AtomicLong();
        final AtomicLong successes = new AtomicLong();
        final AtomicLong operationErrors = new AtomicLong();
        final AtomicLong unexpectedErrors = new AtomicLong();
    }

    private final LongSupplier nanoClock;
    private final OperationLatencyTracker latencies;
    private final EnumMap<OperationKind, KindCounters> counters = new EnumMap<>(OperationKind.class);
    private volatile long startNanos;

    public WorkloadMetrics() {
        this(System::nanoTime);
    }

    public WorkloadMetrics(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
        this.latencies = new OperationLatencyTracker(DEFAULT_ALPHA, DEFAULT_SAMPLES);
        for (OperationKind k : OperationKind.values()) {
            counters.put(k, new KindCounters());
        }
        this.startNanos = nanoClock.getAsLong();
    }

    @Override
    public void record(OperationOutcome outcome) {
        KindCounters c = counters.get(outcome.kind());
        c.total.incrementAndGet();
        switch (outcome.type()) {
            case SUCCESS -> c.successes.incrementAndGet();
            case OPERATION_ERROR -> c.operationErrors.incrementAndGet();
            case UNEXPECTED_ERROR -> c.unexpectedErrors.incrementAndGet();
        }
        latencies.recordSample(outcome.kind(), outcome.durationMillis());
    }

    /** Restart the throughput clock, e.g. once preload has finished. */
    public void reset() {
        startNanos = nanoClock.getAsLong();
    }

    public MetricsSnapshot snapshot() {
        long elapsedNanos = Math.max(0L, nanoClock.getAsLong() - startNanos);
        long total = 0, successes = 0, opErrors = 0, unexpected = 0;

        EnumMap<OperationKind, MetricsSnapshot.KindSnapshot> byKind = new EnumMap<>(OperationKind.class);
        for (var e : counters.entrySet()) {
            KindCounters c = e.getValue();
            OperationLatencyTracker.Stats s = latencies.stats(e.getKey());
            var k = new MetricsSnapshot.KindSnapshot(
                    c.total.get(),
                    c.successes.get(),
                    c.operationErrors.get(),
                    c.unexpectedErrors.get(),
                    s.ewmaMillis(),
                    s.p95Millis(),
                    s.p99Millis()
            );
            byKind.put(e.getKey(), k);
            total += k.total();
            successes += k.successes();
            opErrors += k.operationErrors();
            unexpected += k.unexpectedErrors();
        }

        double seconds = elapsedNanos / 1_000_000_000.0;
        double throughput = seconds > 0.0 ? total / seconds : 0.0;
        return new MetricsSnapshot(elapsedNanos / 1_000_000L, total, successes, opErrors, unexpected, throughput, byKind);
    }

    @Override
    public String toString() {
        MetricsSnapshot s = snapshot();
        return "WorkloadMetrics{" +
                "total=" + s.total() +
                ", successes=" + s.successes() +
                ", operationErrors=" + s.operationErrors() +
                ", unexpectedErrors=" + s.unexpectedErrors() +
                ", throughput=" + String.format("%.2f", s.throughputPerSecond()) +
                '}';
    }
}
