package io.liveprobe.server;

import com.mongodb.client.MongoClient;
import io.liveprobe.core.config.ConfigurationException;
import io.liveprobe.core.config.WorkloadConfig;
import io.liveprobe.core.engine.DrainReport;
import io.liveprobe.core.engine.OutcomeSink;
import io.liveprobe.core.engine.ShutdownSignal;
import io.liveprobe.core.engine.WorkerPool;
import io.liveprobe.core.health.HeartbeatMonitor;
import io.liveprobe.core.limit.TokenBucketLimiter;
import io.liveprobe.core.metrics.WorkloadMetrics;
import io.liveprobe.core.report.ErrorReporter;
import io.liveprobe.core.report.ErrorReportingSink;
import io.liveprobe.core.report.LoggingErrorReporter;
import io.liveprobe.core.routing.DocumentKeyRouter;
import io.liveprobe.core.routing.KeySpace;
import io.liveprobe.core.storage.DatasetPreloader;
import io.liveprobe.core.storage.StorageException;
import io.liveprobe.core.workload.OperationSelector;
import io.liveprobe.core.workload.RandomPayloadGenerator;
import io.liveprobe.storage.ClusterInspector;
import io.liveprobe.storage.HeartbeatFailureListener;
import io.liveprobe.storage.MongoClientFactory;
import io.liveprobe.storage.MongoStorageClient;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for the liveness probe.
 *
 * Responsibilities:
 *  - Load configuration (CLI, env, .env, JSON file); exit 2 if it is invalid.
 *  - Connect, inspect the cluster, apply the shard key for the routing
 *    strategy and preload the dataset.
 *  - Start the worker pool, the heartbeat, the status endpoint and the
 *    throughput reporter.
 *  - Run until SIGINT/SIGTERM, then drain the pool within the grace period.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_RUNTIME_ERROR = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        int code = run(args, EnvFile.overlay(Path.of(".env"), System.getenv()));
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    static int run(String[] args, Map<String, String> env) {
        if (ProbeConfig.isHelp(args)) {
            System.out.println(ProbeConfig.usage());
            return EXIT_OK;
        }

        ProbeConfig cfg;
        try {
            cfg = ProbeConfig.fromArgs(args, env);
        } catch (ConfigurationException e) {
            System.err.println("Configuration error: " + e.getMessage());
            System.err.println("Run with --help for usage.");
            return EXIT_CONFIG_ERROR;
        }
        LoggingSetup.configure(cfg.logLevel());

        ErrorReporter reporter = cfg.errorSinkTarget() == null
                ? new LoggingErrorReporter()
                : new WebhookErrorReporter(URI.create(cfg.errorSinkTarget()));

        MongoClient client;
        try {
            client = MongoClientFactory.create(cfg.uri(), cfg.maxPoolSize(), new HeartbeatFailureListener(reporter));
        } catch (ConfigurationException e) {
            System.err.println("Configuration error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        }
        var storage = new MongoStorageClient(client, cfg.database(), cfg.collection(), cfg.upsertOnUpdate());

        try {
            return runProbe(cfg, client, storage, reporter);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warning("Interrupted; exiting");
            return EXIT_RUNTIME_ERROR;
        } finally {
            storage.close();
            reporter.close();
        }
    }

    private static int runProbe(ProbeConfig cfg, MongoClient client, MongoStorageClient storage, ErrorReporter reporter)
            throws InterruptedException {
        WorkloadConfig w = cfg.workload();
        log.info(() -> String.format(
                "Starting liveprobe: ns=%s topology=%s ops/s=%.1f workers=%d mix=%s",
                storage.namespace(), w.topology().configName(), w.opsPerSecond(), w.workerCount(), w.operationMix()));

        // ------ Cluster preparation (best effort) ------
        var inspector = new ClusterInspector(client);
        inspector.logClusterInfo(cfg.database(), cfg.collection());
        inspector.prepareCollection(w.topology(), cfg.database(), cfg.collection());

        // ------ Dataset ------
        var router = new DocumentKeyRouter(w.topology(), w.zones());
        var payloads = new RandomPayloadGenerator();
        long existing;
        try {
            storage.ensureIndexes();
            existing = new DatasetPreloader(storage, router, payloads).preload(w.totalDocs(), new Random());
        } catch (StorageException e) {
            log.log(Level.SEVERE, "Dataset preparation failed; is the cluster reachable?", e);
            reporter.report("Dataset preparation failed", e, Map.of("ns", storage.namespace()));
            return EXIT_RUNTIME_ERROR;
        }

        // ------ Engine ------
        var limiter = new TokenBucketLimiter(w.opsPerSecond(), w.burst());
        var metrics = new WorkloadMetrics();
        var pool = new WorkerPool(
                limiter,
                new OperationSelector(w.operationMix()),
                router,
                new KeySpace(existing),
                storage,
                payloads,
                OutcomeSink.fanOut(metrics, new ErrorReportingSink(reporter)),
                w.acquireTimeout(),
                w.errorBackoff()
        );

        var heartbeat = new HeartbeatMonitor(w.degradedThreshold(), new HealthAlerts(reporter));
        var signal = new ShutdownSignal();
        var finished = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            signal.raise();
            try {
                // Let main drain the pool before the JVM halts.
                finished.await(w.shutdownGrace().toMillis() + 2_000L, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "shutdown-hook"));

        StatusServer status = null;
        ThroughputReporter throughput = null;
        try {
            heartbeat.start(w.heartbeatInterval(), storage::ping);
            metrics.reset();
            pool.start(w.workerCount(), signal);

            if (cfg.statusEndpointEnabled()) {
                status = new StatusServer(cfg.statusPort(), heartbeat::state, metrics::snapshot,
                        pool::workerStats, limiter::grantedTotal);
                status.start();
                log.info("Status endpoint on http://localhost:" + cfg.statusPort() + "/admin/health");
            }
            if (cfg.reportIntervalSeconds() > 0) {
                throughput = new ThroughputReporter(metrics, limiter, heartbeat,
                        Duration.ofSeconds(cfg.reportIntervalSeconds()));
                throughput.start();
            }

            signal.await();
            log.info("Shutdown requested; draining workers");

            DrainReport drain = pool.shutdown(w.shutdownGrace());
            if (!drain.drained()) {
                log.warning("Abandoned workers: " + drain.abandonedWorkers());
            }
            log.info("Final: " + metrics);
            return EXIT_OK;
        } finally {
            if (throughput != null) {
                throughput.stop();
            }
            if (status != null) {
                status.stop();
            }
            heartbeat.stop();
            finished.countDown();
        }
    }
}
