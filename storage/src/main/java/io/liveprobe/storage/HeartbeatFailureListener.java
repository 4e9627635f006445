package io.liveprobe.storage;

import com.mongodb.event.ServerHeartbeatFailedEvent;
import com.mongodb.event.ServerMonitorListener;
import io.liveprobe.core.report.ErrorReporter;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Surfaces the driver's own server-monitor heartbeat failures.
 *
 * These are independent of the application-level heartbeat: the driver
 * probes every known server and a failure here usually names the exact host.
 */
public final class HeartbeatFailureListener implements ServerMonitorListener {
    private static final Logger log = Logger.getLogger(HeartbeatFailureListener.class.getName());

    private final ErrorReporter reporter;

    public HeartbeatFailureListener(ErrorReporter reporter) {
        this.reporter = Objects.requireNonNull(reporter, "reporter");
    }

    @Override
    public void serverHeartbeatFailed(ServerHeartbeatFailedEvent event) {
        String host = event.getConnectionId().getServerId().getAddress().toString();
        long micros = event.getElapsedTime(TimeUnit.MICROSECONDS);
        String msg = "MongoDB server heartbeat failed host=" + host + " duration_us=" + micros;
        log.severe(msg + ": " + event.getThrowable());
        reporter.report(msg, event.getThrowable(), Map.of(
                "source", "driver-heartbeat",
                "host", host
        ));
    }
}
