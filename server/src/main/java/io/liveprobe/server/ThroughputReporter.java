package io.liveprobe.server;

import io.liveprobe.core.health.HeartbeatMonitor;
import io.liveprobe.core.limit.TokenBucketLimiter;
import io.liveprobe.core.metrics.MetricsSnapshot;
import io.liveprobe.core.metrics.WorkloadMetrics;
import io.liveprobe.core.workload.OperationKind;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logs one throughput line per interval: achieved vs target rate, error
 * counts, per-kind p95 and heartbeat status.
 */
final class ThroughputReporter {
    private static final Logger log = Logger.getLogger(ThroughputReporter.class.getName());

    private final WorkloadMetrics metrics;
    private final TokenBucketLimiter limiter;
    private final HeartbeatMonitor heartbeat;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;

    private long lastTotal;
    private long lastNanos;

    ThroughputReporter(WorkloadMetrics metrics, TokenBucketLimiter limiter, HeartbeatMonitor heartbeat, Duration interval) {
        this.metrics = metrics;
        this.limiter = limiter;
        this.heartbeat = heartbeat;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "throughput-reporter");
            t.setDaemon(true);
            return t;
        });
    }

    void start() {
        lastNanos = System.nanoTime();
        scheduler.scheduleAtFixedRate(this::tickSafe, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    void stop() {
        scheduler.shutdownNow();
    }

    // ---------- internals ----------

    private void tickSafe() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Throughput report failed", e);
        }
    }

    private void tick() {
        long now = System.nanoTime();
        MetricsSnapshot s = metrics.snapshot();
        double windowSeconds = (now - lastNanos) / 1_000_000_000.0;
        double windowRate = windowSeconds > 0 ? (s.total() - lastTotal) / windowSeconds : 0.0;
        lastTotal = s.total();
        lastNanos = now;

        log.info(summary(s, windowRate, limiter.refillRatePerSecond(), heartbeat.state().status().name()));
    }

    static String summary(MetricsSnapshot s, double windowRate, double targetRate, String health) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "ops/s=%.1f (target %.1f, overall %.1f) total=%d ok=%d opErrors=%d unexpected=%d",
                windowRate, targetRate, s.throughputPerSecond(), s.total(), s.successes(),
                s.operationErrors(), s.unexpectedErrors()));
        for (OperationKind k : OperationKind.values()) {
            MetricsSnapshot.KindSnapshot ks = s.byKind().get(k);
            if (ks != null && ks.total() > 0) {
                sb.append(String.format(Locale.ROOT, " %s[n=%d p95=%.1fms]", k.wireName(), ks.total(), ks.p95Millis()));
            }
        }
        sb.append(" heartbeat=").append(health);
        return sb.toString();
    }
}
