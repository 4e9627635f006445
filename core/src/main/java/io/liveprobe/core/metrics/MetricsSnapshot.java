package io.liveprobe.core.metrics;

import io.liveprobe.core.workload.OperationKind;

import java.util.Map;

/**
 * Point-in-time view of {@link WorkloadMetrics}.
 */
public record MetricsSnapshot(
        long elapsedMillis,
        long total,
        long successes,
        long operationErrors,
        long unexpectedErrors,
        double throughputPerSecond,
        Map<OperationKind, KindSnapshot> byKind
) {

    public record KindSnapshot(
            long total,
            long successes,
            long operationErrors,
            long unexpectedErrors,
            double ewmaMillis,
            double p95Millis,
            double p99Millis
    ) {}

    public MetricsSnapshot {
        byKind = Map.copyOf(byKind);
    }

    public long failures() {
        return operationErrors + unexpectedErrors;
    }
}
