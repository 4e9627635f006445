package io.liveprobe.core.engine;

import java.time.Duration;
import java.util.List;

/**
 * Result of {@link WorkerPool#shutdown(Duration)}.
 *
 * @param drained          true if every worker exited within the grace period
 * @param abandonedWorkers workers still busy at the grace deadline (not interrupted)
 * @param waited           how long shutdown waited
 */
public record DrainReport(boolean drained, List<String> abandonedWorkers, Duration waited) {

    public DrainReport {
        abandonedWorkers = List.copyOf(abandonedWorkers);
    }
}
