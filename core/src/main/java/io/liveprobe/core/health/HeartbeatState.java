package io.liveprobe.core.health;

import java.time.Instant;

/**
 * Immutable view of the heartbeat.
 *
 * @param status              HEALTHY until the degradation threshold is reached
 * @param consecutiveFailures failed probes since the last success
 * @param lastSuccess         time of the last successful probe, null if none yet
 * @param lastFailure         time of the last failed probe, null if none yet
 * @param probes              total probes run
 */
public record HeartbeatState(
        HealthStatus status,
        int consecutiveFailures,
        Instant lastSuccess,
        Instant lastFailure,
        long probes
) {

    public static HeartbeatState initial() {
        return new HeartbeatState(HealthStatus.HEALTHY, 0, null, null, 0L);
    }

    public boolean healthy() {
        return status == HealthStatus.HEALTHY;
    }
}
