package io.liveprobe.core.engine;

import io.liveprobe.core.routing.DocumentKey;
import io.liveprobe.core.workload.OperationKind;

import java.util.Objects;

/**
 * Per-operation event emitted by a worker.
 *
 * @param workerId      emitting worker
 * @param kind          operation kind that was selected
 * @param key           targeted key; null only if the failure happened before a key was built
 * @param type          classification
 * @param durationNanos wall time of the storage call
 * @param error         failure cause, null on success
 */
public record OperationOutcome(
        String workerId,
        OperationKind kind,
        DocumentKey key,
        OutcomeType type,
        long durationNanos,
        Throwable error
) {

    public OperationOutcome {
        Objects.requireNonNull(workerId, "workerId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(type, "type");
    }

    public boolean success() {
        return type == OutcomeType.SUCCESS;
    }

    public double durationMillis() {
        return durationNanos / 1_000_000.0;
    }
}
