package io.liveprobe.core.config;

import io.liveprobe.core.routing.ClusterTopology;
import io.liveprobe.core.routing.ZoneSet;
import io.liveprobe.core.workload.OperationMix;

import java.time.Duration;
import java.util.Objects;

/**
 * Validated settings of the workload engine.
 *
 * Semantics:
 *  - opsPerSecond is the aggregate target across all workers.
 *  - burst is the token-bucket ceiling; it must be >= max(1, opsPerSecond).
 *  - acquireTimeout bounds one limiter wait; a timeout is retried, not reported.
 *  - shutdownGrace bounds how long shutdown waits for in-flight operations.
 *
 * Any violation raises {@link ConfigurationException} at construction, so a
 * running engine never sees an invalid value.
 */
public record WorkloadConfig(
        double opsPerSecond,
        double burst,
        int workerCount,
        OperationMix operationMix,
        ClusterTopology topology,
        ZoneSet zones,
        long totalDocs,
        Duration acquireTimeout,
        Duration shutdownGrace,
        Duration errorBackoff,
        Duration heartbeatInterval,
        int degradedThreshold
) {

    public static final double DEFAULT_OPS_PER_SECOND = 50.0;
    public static final int DEFAULT_WORKERS = 4;
    public static final long DEFAULT_TOTAL_DOCS = 1000L;
    public static final Duration DEFAULT_ACQUIRE_TIMEOUT = Duration.ofMillis(250);
    public static final Duration DEFAULT_SHUTDOWN_GRACE = Duration.ofMillis(5000);
    public static final Duration DEFAULT_ERROR_BACKOFF = Duration.ofMillis(50);
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofMillis(1000);
    public static final int DEFAULT_DEGRADED_THRESHOLD = 3;

    public WorkloadConfig {
        if (!(opsPerSecond > 0.0) || Double.isInfinite(opsPerSecond)) {
            throw new ConfigurationException("opsPerSecond must be > 0, got " + opsPerSecond);
        }
        if (!(burst >= Math.max(1.0, opsPerSecond)) || Double.isInfinite(burst)) {
            throw new ConfigurationException(
                    "burst must be >= max(1, opsPerSecond), got burst=" + burst + " opsPerSecond=" + opsPerSecond);
        }
        if (workerCount <= 0) {
            throw new ConfigurationException("workerCount must be > 0, got " + workerCount);
        }
        if (operationMix == null) {
            throw new ConfigurationException("operationMix is required");
        }
        if (topology == null) {
            throw new ConfigurationException("topology is required");
        }
        if (zones == null) {
            zones = ZoneSet.defaults();
        }
        if (totalDocs < 0) {
            throw new ConfigurationException("totalDocs must be >= 0, got " + totalDocs);
        }
        requirePositive(acquireTimeout, "acquireTimeout");
        requirePositive(shutdownGrace, "shutdownGrace");
        requireNonNegative(errorBackoff, "errorBackoff");
        requirePositive(heartbeatInterval, "heartbeatInterval");
        if (degradedThreshold <= 0) {
            throw new ConfigurationException("degradedThreshold must be > 0, got " + degradedThreshold);
        }
    }

    /**
     * Defaults for everything but the rate, workers, mix and topology.
     */
    public static WorkloadConfig of(double opsPerSecond, int workerCount, OperationMix mix, ClusterTopology topology) {
        return new WorkloadConfig(
                opsPerSecond,
                Math.max(1.0, opsPerSecond),
                workerCount,
                mix,
                topology,
                ZoneSet.defaults(),
                DEFAULT_TOTAL_DOCS,
                DEFAULT_ACQUIRE_TIMEOUT,
                DEFAULT_SHUTDOWN_GRACE,
                DEFAULT_ERROR_BACKOFF,
                DEFAULT_HEARTBEAT_INTERVAL,
                DEFAULT_DEGRADED_THRESHOLD
        );
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isZero() || d.isNegative()) {
            throw new ConfigurationException(name + " must be > 0, got " + d);
        }
    }

    private static void requireNonNegative(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative()) {
            throw new ConfigurationException(name + " must be >= 0, got " + d);
        }
    }
}
