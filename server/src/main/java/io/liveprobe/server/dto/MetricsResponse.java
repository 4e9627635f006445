package io.liveprobe.server.dto;

import java.util.List;
import java.util.Map;

/**
 * JSON response for GET /admin/metrics.
 * Latency fields are null until the kind has at least one sample.
 */
public class MetricsResponse {
    public long elapsedMillis;
    public long total;
    public long successes;
    public long operationErrors;
    public long unexpectedErrors;
    public double throughputPerSecond;
    public long tokensGranted;
    public Map<String, KindMetrics> byKind;
    public List<WorkerMetrics> workers;

    public static class KindMetrics {
        public long total;
        public long successes;
        public long operationErrors;
        public long unexpectedErrors;
        public Double ewmaMillis;
        public Double p95Millis;
        public Double p99Millis;
    }

    public static class WorkerMetrics {
        public String workerId;
        public boolean running;
        public long attempts;
        public long successes;
        public long failures;
    }
}
