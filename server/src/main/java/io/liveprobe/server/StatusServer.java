package io.liveprobe.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.liveprobe.core.engine.WorkerStats;
import io.liveprobe.core.health.HealthStatus;
import io.liveprobe.core.health.HeartbeatState;
import io.liveprobe.core.metrics.MetricsSnapshot;
import io.liveprobe.server.dto.HealthResponse;
import io.liveprobe.server.dto.MetricsResponse;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-only HTTP surface over the running probe.
 *
 * Path layout:
 *   - GET /admin/health    heartbeat state; 200 when HEALTHY, 503 when DEGRADED
 *   - GET /admin/metrics   throughput counters, latency quantiles, per-worker counters
 *
 * Anything else is 404; non-GET methods on known paths are 405.
 */
public final class StatusServer {
    private static final Logger log = Logger.getLogger(StatusServer.class.getName());

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final Supplier<HeartbeatState> health;
    private final Supplier<MetricsSnapshot> metrics;
    private final Supplier<List<WorkerStats>> workers;
    private final LongSupplier tokensGranted;

    public StatusServer(int port,
                        Supplier<HeartbeatState> health,
                        Supplier<MetricsSnapshot> metrics,
                        Supplier<List<WorkerStats>> workers,
                        LongSupplier tokensGranted) {
        this.health = health;
        this.metrics = metrics;
        this.workers = workers;
        this.tokensGranted = tokensGranted;

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    long start = System.nanoTime();
                    var path = exchange.getRequestPath();
                    var method = exchange.getRequestMethod().toString();
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

                    int status;
                    Throwable error = null;
                    try {
                        status = route(exchange, method, path);
                    } catch (RuntimeException e) {
                        error = e;
                        status = 500;
                        send(exchange, status, Map.of("error", e.getClass().getSimpleName(),
                                "message", String.valueOf(e.getMessage())));
                    }
                    RequestLogger.logRequest(method, path, status,
                            (System.nanoTime() - start) / 1_000_000L, error);
                })
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- routing ----------

    private int route(HttpServerExchange ex, String method, String path) {
        boolean known = "/admin/health".equals(path) || "/admin/metrics".equals(path);
        if (!known) {
            send(ex, 404, Map.of("error", "not found"));
            return 404;
        }
        if (!"GET".equals(method)) {
            send(ex, 405, Map.of("error", "method not allowed"));
            return 405;
        }
        if ("/admin/health".equals(path)) {
            HeartbeatState s = health.get();
            int status = s.status() == HealthStatus.HEALTHY ? 200 : 503;
            send(ex, status, toHealthResponse(s));
            return status;
        }
        send(ex, 200, toMetricsResponse(metrics.get(), workers.get(), tokensGranted.getAsLong()));
        return 200;
    }

    // ---------- mapping ----------

    static HealthResponse toHealthResponse(HeartbeatState s) {
        HealthResponse dto = new HealthResponse();
        dto.status = s.status().name();
        dto.consecutiveFailures = s.consecutiveFailures();
        dto.lastSuccess = s.lastSuccess() == null ? null : s.lastSuccess().toString();
        dto.lastFailure = s.lastFailure() == null ? null : s.lastFailure().toString();
        dto.probes = s.probes();
        return dto;
    }

    static MetricsResponse toMetricsResponse(MetricsSnapshot m, List<WorkerStats> workerStats, long granted) {
        MetricsResponse dto = new MetricsResponse();
        dto.elapsedMillis = m.elapsedMillis();
        dto.total = m.total();
        dto.successes = m.successes();
        dto.operationErrors = m.operationErrors();
        dto.unexpectedErrors = m.unexpectedErrors();
        dto.throughputPerSecond = m.throughputPerSecond();
        dto.tokensGranted = granted;

        dto.byKind = new LinkedHashMap<>();
        m.byKind().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> {
                    var k = new MetricsResponse.KindMetrics();
                    var s = e.getValue();
                    k.total = s.total();
                    k.successes = s.successes();
                    k.operationErrors = s.operationErrors();
                    k.unexpectedErrors = s.unexpectedErrors();
                    k.ewmaMillis = finiteOrNull(s.ewmaMillis());
                    k.p95Millis = finiteOrNull(s.p95Millis());
                    k.p99Millis = finiteOrNull(s.p99Millis());
                    dto.byKind.put(e.getKey().wireName(), k);
                });

        dto.workers = new ArrayList<>(workerStats.size());
        for (WorkerStats w : workerStats) {
            var wm = new MetricsResponse.WorkerMetrics();
            wm.workerId = w.workerId();
            wm.running = w.running();
            wm.attempts = w.attempts();
            wm.successes = w.successes();
            wm.failures = w.failures();
            dto.workers.add(wm);
        }
        return dto;
    }

    private static Double finiteOrNull(double v) {
        return Double.isFinite(v) ? v : null;
    }

    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            log.log(Level.WARNING, "Failed to write response for " + ex.getRequestPath(), e);
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
