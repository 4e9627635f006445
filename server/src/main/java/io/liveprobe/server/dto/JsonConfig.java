package io.liveprobe.server.dto;

import java.util.List;

/**
 * JSON config file layout (--config). Every field is optional; absent
 * fields fall through to defaults, and environment variables and CLI flags
 * override whatever is set here.
 * Example:
 *   {
 *     "uri": "mongodb+srv://cluster0.example.net",
 *     "opsPerSecond": 200,
 *     "workerCount": 8,
 *     "operationMix": "find=60,insert=30,update=10",
 *     "clusterTopology": "geosharded",
 *     "zones": ["US", "DE", "JP"]
 *   }
 */
public class JsonConfig {
    public String uri;
    public String db;
    public String collection;
    public Long totalDocs;
    public Double opsPerSecond;
    public Double burst;
    public Integer workerCount;
    public Integer maxPoolSize;
    public String operationMix;
    public String clusterTopology;
    public List<String> zones;
    public String errorSinkTarget;
    public String logLevel;
    public Integer statusPort;
    public Integer reportIntervalSeconds;
    public Long heartbeatIntervalMillis;
    public Integer degradedThreshold;
    public Long acquireTimeoutMillis;
    public Long shutdownGraceMillis;
    public Long errorBackoffMillis;
    public Boolean upsertOnUpdate;
}
