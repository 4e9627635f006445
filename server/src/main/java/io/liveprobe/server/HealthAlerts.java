package io.liveprobe.server;

import io.liveprobe.core.health.HeartbeatListener;
import io.liveprobe.core.health.HeartbeatState;
import io.liveprobe.core.report.ErrorReporter;

import java.util.Map;

/**
 * Forwards heartbeat transitions to the error sink.
 */
final class HealthAlerts implements HeartbeatListener {

    private final ErrorReporter reporter;

    HealthAlerts(ErrorReporter reporter) {
        this.reporter = reporter;
    }

    @Override
    public void onDegraded(HeartbeatState state, Throwable cause) {
        reporter.report("Connectivity degraded", cause, context(state));
    }

    @Override
    public void onRecovered(HeartbeatState state) {
        reporter.report("Connectivity recovered", null, context(state));
    }

    private static Map<String, String> context(HeartbeatState s) {
        return Map.of(
                "source", "heartbeat",
                "status", s.status().name(),
                "consecutiveFailures", Integer.toString(s.consecutiveFailures())
        );
    }
}
