package io.liveprobe.core.storage;

import io.liveprobe.core.routing.DocumentKeyRouter;
import io.liveprobe.core.workload.PayloadGenerator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Brings the target collection up to a configured size before the workload starts.
 *
 * Documents are keyed by sequence numbers continuing after the current
 * (estimated) count, so a restarted process tops the dataset up instead of
 * rewriting it. Inserts go out in fixed-size batches.
 */
public final class DatasetPreloader {
    private static final Logger log = Logger.getLogger(DatasetPreloader.class.getName());

    public static final int DEFAULT_BATCH_SIZE = 1000;

    private final StorageClient storage;
    private final DocumentKeyRouter router;
    private final PayloadGenerator payloads;
    private final int batchSize;

    public DatasetPreloader(StorageClient storage, DocumentKeyRouter router, PayloadGenerator payloads) {
        this(storage, router, payloads, DEFAULT_BATCH_SIZE);
    }

    public DatasetPreloader(StorageClient storage, DocumentKeyRouter router, PayloadGenerator payloads, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        this.storage = Objects.requireNonNull(storage, "storage");
        this.router = Objects.requireNonNull(router, "router");
        this.payloads = Objects.requireNonNull(payloads, "payloads");
        this.batchSize = batchSize;
    }

    /**
     * Insert documents until the collection holds at least targetDocs.
     *
     * @return the number of documents known to exist afterwards; this is the
     *         size of the key space the workers read from.
     * @throws StorageException if counting or a batch insert fails.
     */
    public long preload(long targetDocs, Random rnd) {
        long target = Math.max(0L, targetDocs);
        long existing = storage.estimatedCount();
        long toInsert = target - existing;
        if (toInsert <= 0) {
            log.info(() -> String.format("Dataset already sized: existing=%d target=%d", existing, target));
            return existing;
        }

        log.info(() -> String.format("Preloading dataset: inserting %d docs (existing=%d target=%d)",
                toInsert, existing, target));

        List<DocumentRecord> batch = new ArrayList<>(batchSize);
        for (long i = 0; i < toInsert; i++) {
            var key = router.buildKey(existing + i);
            batch.add(new DocumentRecord(key, payloads.generate(key, rnd)));
            if (batch.size() >= batchSize) {
                storage.insertMany(List.copyOf(batch));
                batch.clear();
            }
        }
        if (!batch.isEmpty()) {
            storage.insertMany(List.copyOf(batch));
        }

        log.info("Preload complete");
        return existing + toInsert;
    }
}
