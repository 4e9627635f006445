package io.liveprobe.core.engine;

import io.liveprobe.core.workload.OperationKind;

import java.util.Map;

/**
 * Point-in-time copy of one worker's counters.
 */
public record WorkerStats(
        String workerId,
        boolean running,
        long attempts,
        long successes,
        Map<OperationKind, Long> failuresByKind
) {

    public long failures() {
        long sum = 0;
        for (long v : failuresByKind.values()) {
            sum += v;
        }
        return sum;
    }
}
