package io.liveprobe.server.dto;

/**
 * JSON response for GET /admin/health.
 * Example:
 *   {
 *     "status": "DEGRADED",
 *     "consecutiveFailures": 4,
 *     "lastSuccess": "2024-05-01T10:15:30Z",
 *     "lastFailure": "2024-05-01T10:15:34Z",
 *     "probes": 120
 *   }
 */
public class HealthResponse {
    public String status;
    public int consecutiveFailures;
    public String lastSuccess;   // ISO-8601, null before the first success
    public String lastFailure;   // ISO-8601, null before the first failure
    public long probes;
}
