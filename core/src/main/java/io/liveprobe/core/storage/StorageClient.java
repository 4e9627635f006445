package io.liveprobe.core.storage;

import io.liveprobe.core.routing.DocumentKey;

import java.util.List;

/**
 * Abstract storage collaborator driven by the workers.
 *
 * Connection management, pooling, retries and the wire protocol all live
 * behind this interface. Implementations must be safe for concurrent use by
 * every worker thread.
 *
 * Every method reports failure by throwing {@link StorageException}.
 */
public interface StorageClient {

    /**
     * Point lookup by id (and location, when the key carries one).
     *
     * @return true if a document was found; a miss is not an error.
     */
    boolean find(DocumentKey key);

    /** Insert one new document. */
    void insert(DocumentRecord document);

    /**
     * Apply field changes to the document addressed by key.
     *
     * @return false if nothing matched (and nothing was upserted).
     */
    boolean update(DocumentKey key, FieldUpdate update);

    /** Cheapest possible round trip, used as the heartbeat probe. */
    void ping();

    /** Approximate number of documents in the target collection. */
    long estimatedCount();

    /**
     * Bulk insert used by the preloader. Implementations with a native
     * batch API should override this.
     */
    default void insertMany(List<DocumentRecord> documents) {
        for (DocumentRecord d : documents) {
            insert(d);
        }
    }
}
