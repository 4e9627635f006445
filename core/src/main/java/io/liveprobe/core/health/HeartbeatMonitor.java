package io.liveprobe.core.health;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic connectivity probe, independent of the workload path.
 *
 * Responsibilities:
 *  - Run a probe on a fixed period on its own single-threaded scheduler.
 *    It never draws from the workload's rate limiter.
 *  - Track consecutive failures. Reaching the threshold flips the state to
 *    DEGRADED and emits one "connectivity degraded" event; the next success
 *    flips it back to HEALTHY and emits one recovery event.
 *
 * A single failed workload operation is expected under load. A run of failed
 * heartbeats means the connection or pool itself is unusable, which is why
 * this signal is kept apart from operation-level errors. It never stops the
 * dispatcher; escalation is up to whoever listens.
 */
public final class HeartbeatMonitor {
    private static final Logger log = Logger.getLogger(HeartbeatMonitor.class.getName());

    private final int degradedThreshold;
    private final Clock clock;
    private final HeartbeatListener listener;
    private final ScheduledExecutorService scheduler;

    // written under this, read lock-free
    private volatile HeartbeatState state = HeartbeatState.initial();
    private volatile boolean started = false;

    public HeartbeatMonitor(int degradedThreshold, HeartbeatListener listener) {
        this(degradedThreshold, Clock.systemUTC(), listener);
    }

    public HeartbeatMonitor(int degradedThreshold, Clock clock, HeartbeatListener listener) {
        if (degradedThreshold <= 0) {
            throw new IllegalArgumentException("degradedThreshold must be > 0");
        }
        this.degradedThreshold = degradedThreshold;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.listener = listener == null ? HeartbeatListener.NO_OP : listener;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "heartbeat");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start probing every interval, beginning immediately. Calling start twice is a no-op.
     */
    public synchronized void start(Duration interval, HealthProbe probe) {
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(probe, "probe");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        if (started) {
            return;
        }
        started = true;
        scheduler.scheduleAtFixedRate(() -> tickSafe(probe), 0L, interval.toNanos(), TimeUnit.NANOSECONDS);
        log.info(() -> "Heartbeat started: interval=" + interval.toMillis() + "ms threshold=" + degradedThreshold);
    }

    /**
     * Cancel future probes. A probe already running is allowed to finish.
     */
    public void stop() {
        scheduler.shutdown();
    }

    /**
     * Wait for an in-flight probe after {@link #stop()}.
     */
    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return scheduler.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public HeartbeatState state() {
        return state;
    }

    public int degradedThreshold() {
        return degradedThreshold;
    }

    /**
     * Run one probe synchronously and apply its result.
     *
     * @return the state after this probe
     */
    public HeartbeatState runOnce(HealthProbe probe) {
        Exception failure = null;
        try {
            probe.probe();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = e;
        } catch (Exception e) {
            failure = e;
        }
        return failure == null ? recordSuccess() : recordFailure(failure);
    }

    // ---------- internals ----------

    private void tickSafe(HealthProbe probe) {
        try {
            runOnce(probe);
        } catch (RuntimeException e) {
            // An escaping exception would silently cancel the periodic task.
            log.log(Level.WARNING, "Heartbeat tick failed", e);
        }
    }

    private HeartbeatState recordSuccess() {
        HeartbeatState next;
        boolean recovered;
        synchronized (this) {
            HeartbeatState prev = state;
            recovered = prev.status() == HealthStatus.DEGRADED;
            next = new HeartbeatState(
                    HealthStatus.HEALTHY,
                    0,
                    clock.instant(),
                    prev.lastFailure(),
                    prev.probes() + 1
            );
            state = next;
        }
        if (recovered) {
            log.info("Connectivity recovered: heartbeat probe succeeded");
            notifyRecovered(next);
        }
        return next;
    }

    private HeartbeatState recordFailure(Exception failure) {
        HeartbeatState next;
        boolean degradedNow;
        synchronized (this) {
            HeartbeatState prev = state;
            int failures = prev.consecutiveFailures() + 1;
            HealthStatus status = failures >= degradedThreshold ? HealthStatus.DEGRADED : prev.status();
            degradedNow = status == HealthStatus.DEGRADED && prev.status() == HealthStatus.HEALTHY;
            next = new HeartbeatState(
                    status,
                    failures,
                    prev.lastSuccess(),
                    clock.instant(),
                    prev.probes() + 1
            );
            state = next;
        }

        if (degradedNow) {
            log.log(Level.SEVERE, String.format(
                    "Connectivity degraded: %d consecutive heartbeat failures (threshold=%d)",
                    next.consecutiveFailures(), degradedThreshold), failure);
            notifyDegraded(next, failure);
        } else {
            log.warning(String.format("Heartbeat probe failed (%d consecutive): %s",
                    next.consecutiveFailures(), failure));
        }
        return next;
    }

    private void notifyDegraded(HeartbeatState s, Throwable cause) {
        try {
            listener.onDegraded(s, cause);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Heartbeat listener failed on degradation", e);
        }
    }

    private void notifyRecovered(HeartbeatState s) {
        try {
            listener.onRecovered(s);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Heartbeat listener failed on recovery", e);
        }
    }
}
