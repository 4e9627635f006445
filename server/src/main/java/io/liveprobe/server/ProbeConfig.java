package io.liveprobe.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.liveprobe.core.config.ConfigurationException;
import io.liveprobe.core.config.WorkloadConfig;
import io.liveprobe.core.routing.ClusterTopology;
import io.liveprobe.core.routing.ZoneSet;
import io.liveprobe.core.workload.OperationMix;
import io.liveprobe.server.dto.JsonConfig;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;

/**
 * Process configuration: connection settings, outer surfaces and the typed
 * {@link WorkloadConfig} for the engine.
 *
 * Sources, highest precedence first:
 *  - CLI flags,
 *  - environment variables (including values loaded from .env),
 *  - the JSON file named by --config / LIVEPROBE_CONFIG,
 *  - defaults.
 *
 * Any invalid or missing required value raises {@link ConfigurationException}.
 */
public record ProbeConfig(
        String uri,
        String database,
        String collection,
        int maxPoolSize,
        boolean upsertOnUpdate,
        String errorSinkTarget,
        Level logLevel,
        int statusPort,
        int reportIntervalSeconds,
        WorkloadConfig workload
) {

    public static final String DEFAULT_DATABASE = "liveness";
    public static final String DEFAULT_COLLECTION = "probe";
    public static final int DEFAULT_MAX_POOL_SIZE = 50;
    public static final int DEFAULT_STATUS_PORT = 9090;
    public static final int DEFAULT_REPORT_INTERVAL_SECONDS = 10;

    // Canonical option names shared by all three sources.
    static final String URI_KEY = "uri";
    static final String DB = "db";
    static final String COLL = "coll";
    static final String TOTAL_DOCS = "total-docs";
    static final String OPS_PER_SEC = "ops-per-sec";
    static final String BURST = "burst";
    static final String WORKERS = "workers";
    static final String MAX_POOL_SIZE = "max-pool-size";
    static final String OP_MIX = "op-mix";
    static final String CLUSTER_TYPE = "cluster-type";
    static final String ZONES = "zones";
    static final String ERROR_SINK = "error-sink";
    static final String LOG_LEVEL = "log-level";
    static final String STATUS_PORT = "status-port";
    static final String REPORT_INTERVAL = "report-interval";
    static final String HEARTBEAT_INTERVAL_MS = "heartbeat-interval-ms";
    static final String DEGRADED_THRESHOLD = "degraded-threshold";
    static final String ACQUIRE_TIMEOUT_MS = "acquire-timeout-ms";
    static final String SHUTDOWN_GRACE_MS = "shutdown-grace-ms";
    static final String ERROR_BACKOFF_MS = "error-backoff-ms";
    static final String UPSERT_ON_UPDATE = "upsert-on-update";
    static final String CONFIG = "config";

    /** Environment variable -> option name. */
    private static final Map<String, String> ENV_NAMES = envNames();

    public ProbeConfig {
        if (uri == null || uri.isBlank()) {
            throw new ConfigurationException("MongoDB URI is required (--uri or MONGODB_URI)");
        }
        if (database == null || database.isBlank()) {
            throw new ConfigurationException("database name must not be blank");
        }
        if (collection == null || collection.isBlank()) {
            throw new ConfigurationException("collection name must not be blank");
        }
        if (maxPoolSize <= 0) {
            throw new ConfigurationException("maxPoolSize must be > 0, got " + maxPoolSize);
        }
        if (statusPort < 0 || statusPort > 65535) {
            throw new ConfigurationException("statusPort out of range: " + statusPort);
        }
        if (reportIntervalSeconds < 0) {
            throw new ConfigurationException("reportIntervalSeconds must be >= 0, got " + reportIntervalSeconds);
        }
        if (errorSinkTarget != null && errorSinkTarget.isBlank()) {
            errorSinkTarget = null;
        }
        if (errorSinkTarget != null) {
            checkHttpUrl(errorSinkTarget);
        }
        if (logLevel == null) {
            logLevel = Level.INFO;
        }
        if (workload == null) {
            throw new ConfigurationException("workload settings are required");
        }
    }

    public boolean statusEndpointEnabled() {
        return statusPort > 0;
    }

    /**
     * Build the configuration from CLI args layered over env and an optional JSON file.
     *
     * Supported flags (all take a value):
     *   --uri, --db, --coll, --total-docs, --ops-per-sec, --burst, --workers,
     *   --max-pool-size, --op-mix, --cluster-type, --zones, --error-sink,
     *   --log-level, --status-port, --report-interval, --heartbeat-interval-ms,
     *   --degraded-threshold, --acquire-timeout-ms, --shutdown-grace-ms,
     *   --error-backoff-ms, --upsert-on-update, --config
     */
    public static ProbeConfig fromArgs(String[] args, Map<String, String> env) {
        Map<String, String> cli = parseFlags(args);
        Map<String, String> fromEnv = fromEnv(env);

        String configPath = cli.getOrDefault(CONFIG, fromEnv.get(CONFIG));
        Map<String, String> values = new HashMap<>();
        if (configPath != null && !configPath.isBlank()) {
            values.putAll(fromJsonFile(Path.of(configPath)));
        }
        values.putAll(fromEnv);
        values.putAll(cli);
        return fromValues(values);
    }

    public static boolean isHelp(String[] args) {
        for (String a : args) {
            if ("--help".equals(a) || "-h".equals(a)) {
                return true;
            }
        }
        return false;
    }

    public static String usage() {
        return """
            Usage: liveprobe [options]

            Options (environment variable in brackets):
              --uri                  MongoDB connection string (required) [MONGODB_URI]
              --db                   Database name (default: liveness) [MONGO_DB]
              --coll                 Collection name (default: probe) [MONGO_COLL]
              --total-docs           Documents to preload (default: 1000) [TOTAL_DOCS]
              --ops-per-sec          Aggregate operations per second (default: 50) [OPS_PER_SEC]
              --burst                Token bucket ceiling (default: max(1, ops-per-sec)) [BURST]
              --workers              Concurrent workers (default: 4) [WORKERS]
              --max-pool-size        Driver connection pool size (default: 50) [MAX_POOL_SIZE]
              --op-mix               Weighted mix (default: find=70,insert=20,update=10) [OP_MIX]
              --cluster-type         replica_set | sharded | geosharded (default: replica_set) [CLUSTER_TYPE]
              --zones                Comma-separated zone codes for geosharded routing [ZONES]
              --error-sink           HTTP(S) URL receiving error events as JSON [ERROR_SINK_URL]
              --log-level            DEBUG | INFO | WARNING | ERROR (default: INFO) [LOG_LEVEL]
              --status-port          Status endpoint port, 0 disables (default: 9090) [STATUS_PORT]
              --report-interval      Seconds between throughput log lines, 0 disables (default: 10)
              --heartbeat-interval-ms  Heartbeat period (default: 1000)
              --degraded-threshold   Consecutive heartbeat failures before DEGRADED (default: 3)
              --acquire-timeout-ms   Max wait for one token before re-checking shutdown (default: 250)
              --shutdown-grace-ms    Max wait for in-flight operations on shutdown (default: 5000)
              --error-backoff-ms     Pause after a failed operation (default: 50)
              --upsert-on-update     Upsert when an update matches nothing (default: true)
              --config               JSON config file [LIVEPROBE_CONFIG]
              --help,          -h    Show this help message
            """;
    }

    // ---------- sources ----------

    static Map<String, String> parseFlags(String[] args) {
        Map<String, String> out = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--help".equals(arg) || "-h".equals(arg)) {
                continue;
            }
            if (!arg.startsWith("--")) {
                throw new ConfigurationException("Unexpected argument: " + arg);
            }
            String name = arg.substring(2);
            String value = null;
            int eq = name.indexOf('=');
            if (eq >= 0) {
                value = name.substring(eq + 1);
                name = name.substring(0, eq);
            }
            if (!isKnownOption(name)) {
                throw new ConfigurationException("Unknown option: --" + name);
            }
            if (value == null) {
                if (i + 1 >= args.length) {
                    throw new ConfigurationException("Missing value for option: --" + name);
                }
                value = args[++i];
            }
            out.put(name, value);
        }
        return out;
    }

    static Map<String, String> fromEnv(Map<String, String> env) {
        Map<String, String> out = new HashMap<>();
        for (Map.Entry<String, String> e : ENV_NAMES.entrySet()) {
            String v = env.get(e.getKey());
            if (v != null && !v.isBlank()) {
                out.put(e.getValue(), v.trim());
            }
        }
        return out;
    }

    static Map<String, String> fromJsonFile(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Config file not found: " + path);
        }
        JsonConfig cfg;
        try {
            cfg = new ObjectMapper().readValue(path.toFile(), JsonConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load config from " + path + ": " + e.getMessage(), e);
        }
        Map<String, String> out = new HashMap<>();
        put(out, URI_KEY, cfg.uri);
        put(out, DB, cfg.db);
        put(out, COLL, cfg.collection);
        put(out, TOTAL_DOCS, cfg.totalDocs);
        put(out, OPS_PER_SEC, cfg.opsPerSecond);
        put(out, BURST, cfg.burst);
        put(out, WORKERS, cfg.workerCount);
        put(out, MAX_POOL_SIZE, cfg.maxPoolSize);
        put(out, OP_MIX, cfg.operationMix);
        put(out, CLUSTER_TYPE, cfg.clusterTopology);
        put(out, ZONES, cfg.zones == null ? null : String.join(",", cfg.zones));
        put(out, ERROR_SINK, cfg.errorSinkTarget);
        put(out, LOG_LEVEL, cfg.logLevel);
        put(out, STATUS_PORT, cfg.statusPort);
        put(out, REPORT_INTERVAL, cfg.reportIntervalSeconds);
        put(out, HEARTBEAT_INTERVAL_MS, cfg.heartbeatIntervalMillis);
        put(out, DEGRADED_THRESHOLD, cfg.degradedThreshold);
        put(out, ACQUIRE_TIMEOUT_MS, cfg.acquireTimeoutMillis);
        put(out, SHUTDOWN_GRACE_MS, cfg.shutdownGraceMillis);
        put(out, ERROR_BACKOFF_MS, cfg.errorBackoffMillis);
        put(out, UPSERT_ON_UPDATE, cfg.upsertOnUpdate);
        return out;
    }

    // ---------- typed build ----------

    static ProbeConfig fromValues(Map<String, String> v) {
        double ops = parseDouble(v, OPS_PER_SEC, WorkloadConfig.DEFAULT_OPS_PER_SECOND);
        double burst = parseDouble(v, BURST, Math.max(1.0, ops));

        WorkloadConfig workload = new WorkloadConfig(
                ops,
                burst,
                parseInt(v, WORKERS, WorkloadConfig.DEFAULT_WORKERS),
                OperationMix.parse(v.getOrDefault(OP_MIX, OperationMix.DEFAULT_MIX)),
                ClusterTopology.fromName(v.getOrDefault(CLUSTER_TYPE, ClusterTopology.REPLICA_SET.configName())),
                ZoneSet.parse(v.get(ZONES)),
                parseLong(v, TOTAL_DOCS, WorkloadConfig.DEFAULT_TOTAL_DOCS),
                parseMillis(v, ACQUIRE_TIMEOUT_MS, WorkloadConfig.DEFAULT_ACQUIRE_TIMEOUT),
                parseMillis(v, SHUTDOWN_GRACE_MS, WorkloadConfig.DEFAULT_SHUTDOWN_GRACE),
                parseMillis(v, ERROR_BACKOFF_MS, WorkloadConfig.DEFAULT_ERROR_BACKOFF),
                parseMillis(v, HEARTBEAT_INTERVAL_MS, WorkloadConfig.DEFAULT_HEARTBEAT_INTERVAL),
                parseInt(v, DEGRADED_THRESHOLD, WorkloadConfig.DEFAULT_DEGRADED_THRESHOLD)
        );

        return new ProbeConfig(
                v.get(URI_KEY),
                v.getOrDefault(DB, DEFAULT_DATABASE),
                v.getOrDefault(COLL, DEFAULT_COLLECTION),
                parseInt(v, MAX_POOL_SIZE, DEFAULT_MAX_POOL_SIZE),
                parseBoolean(v, UPSERT_ON_UPDATE, true),
                v.get(ERROR_SINK),
                LoggingSetup.parseLevel(v.getOrDefault(LOG_LEVEL, "INFO")),
                parseInt(v, STATUS_PORT, DEFAULT_STATUS_PORT),
                parseInt(v, REPORT_INTERVAL, DEFAULT_REPORT_INTERVAL_SECONDS),
                workload
        );
    }

    // ---------- helpers ----------

    private static Map<String, String> envNames() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("MONGODB_URI", URI_KEY);
        m.put("MONGO_DB", DB);
        m.put("MONGO_COLL", COLL);
        m.put("TOTAL_DOCS", TOTAL_DOCS);
        m.put("OPS_PER_SEC", OPS_PER_SEC);
        m.put("BURST", BURST);
        m.put("WORKERS", WORKERS);
        m.put("MAX_POOL_SIZE", MAX_POOL_SIZE);
        m.put("OP_MIX", OP_MIX);
        m.put("CLUSTER_TYPE", CLUSTER_TYPE);
        m.put("ZONES", ZONES);
        m.put("ERROR_SINK_URL", ERROR_SINK);
        m.put("LOG_LEVEL", LOG_LEVEL);
        m.put("STATUS_PORT", STATUS_PORT);
        m.put("LIVEPROBE_CONFIG", CONFIG);
        return Map.copyOf(m);
    }

    private static boolean isKnownOption(String name) {
        return switch (name) {
            case URI_KEY, DB, COLL, TOTAL_DOCS, OPS_PER_SEC, BURST, WORKERS, MAX_POOL_SIZE, OP_MIX,
                    CLUSTER_TYPE, ZONES, ERROR_SINK, LOG_LEVEL, STATUS_PORT, REPORT_INTERVAL,
                    HEARTBEAT_INTERVAL_MS, DEGRADED_THRESHOLD, ACQUIRE_TIMEOUT_MS, SHUTDOWN_GRACE_MS,
                    ERROR_BACKOFF_MS, UPSERT_ON_UPDATE, CONFIG -> true;
            default -> false;
        };
    }

    private static void put(Map<String, String> out, String key, Object value) {
        if (value != null) {
            out.put(key, value.toString());
        }
    }

    private static int parseInt(Map<String, String> v, String key, int def) {
        String raw = v.get(key);
        if (raw == null) return def;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid " + key + ": " + raw, e);
        }
    }

    private static long parseLong(Map<String, String> v, String key, long def) {
        String raw = v.get(key);
        if (raw == null) return def;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid " + key + ": " + raw, e);
        }
    }

    private static double parseDouble(Map<String, String> v, String key, double def) {
        String raw = v.get(key);
        if (raw == null) return def;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid " + key + ": " + raw, e);
        }
    }

    private static Duration parseMillis(Map<String, String> v, String key, Duration def) {
        String raw = v.get(key);
        return raw == null ? def : Duration.ofMillis(parseLong(v, key, 0L));
    }

    private static boolean parseBoolean(Map<String, String> v, String key, boolean def) {
        String raw = v.get(key);
        if (raw == null) return def;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1", "on" -> true;
            case "false", "no", "0", "off" -> false;
            default -> throw new ConfigurationException("Invalid " + key + ": " + raw);
        };
    }

    private static void checkHttpUrl(String url) {
        try {
            URI u = new URI(url);
            String scheme = u.getScheme();
            if (u.getHost() == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new ConfigurationException("error sink must be an http(s) URL: " + url);
            }
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Invalid error sink URL: " + url, e);
        }
    }
}
