package io.liveprobe.storage;

import com.mongodb.MongoBulkWriteException;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.InsertManyOptions;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.UpdateOptions;
import com.mongodb.client.result.UpdateResult;
import io.liveprobe.core.routing.DocumentKey;
import io.liveprobe.core.storage.DocumentRecord;
import io.liveprobe.core.storage.FieldUpdate;
import io.liveprobe.core.storage.StorageClient;
import io.liveprobe.core.storage.StorageException;
import org.bson.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link StorageClient} backed by one MongoDB collection.
 *
 * The driver owns pooling, retries and server selection; this class only
 * shapes requests and maps driver errors onto {@link StorageException}.
 * Closing it closes the underlying client.
 */
public final class MongoStorageClient implements StorageClient, AutoCloseable {
    private static final Logger log = Logger.getLogger(MongoStorageClient.class.getName());

    private static final Document PING = new Document("ping", 1);
    private static final int DUPLICATE_KEY = 11000;

    private final MongoClient client;
    private final MongoCollection<Document> collection;
    private final String namespace;
    private final boolean upsertOnUpdate;

    public MongoStorageClient(MongoClient client, String database, String collection, boolean upsertOnUpdate) {
        this.client = Objects.requireNonNull(client, "client");
        this.collection = client.getDatabase(database).getCollection(collection);
        this.namespace = database + "." + collection;
        this.upsertOnUpdate = upsertOnUpdate;
    }

    /** Index on the sequence field k; idempotent. */
    public void ensureIndexes() {
        try {
            String name = collection.createIndex(Indexes.ascending("k"));
            log.info(() -> "Index ready on " + namespace + ": " + name);
        } catch (MongoException e) {
            throw MongoErrors.wrap("createIndex", e);
        }
    }

    @Override
    public boolean find(DocumentKey key) {
        try {
            return collection.find(DocumentMapper.filterFor(key))
                    .projection(Projections.include(DocumentMapper.ID))
                    .limit(1)
                    .first() != null;
        } catch (MongoException e) {
            throw MongoErrors.wrap("find", e);
        }
    }

    @Override
    public void insert(DocumentRecord document) {
        try {
            collection.insertOne(DocumentMapper.toDocument(document));
        } catch (MongoException e) {
            throw MongoErrors.wrap("insert", e);
        }
    }

    @Override
    public boolean update(DocumentKey key, FieldUpdate update) {
        try {
            UpdateResult r = collection.updateOne(
                    DocumentMapper.filterFor(key),
                    DocumentMapper.toUpdate(update),
                    new UpdateOptions().upsert(upsertOnUpdate)
            );
            return r.getMatchedCount() > 0 || r.getUpsertedId() != null;
        } catch (MongoException e) {
            throw MongoErrors.wrap("update", e);
        }
    }

    @Override
    public void ping() {
        try {
            client.getDatabase("admin").runCommand(PING);
        } catch (MongoException e) {
            throw MongoErrors.wrap("ping", e);
        }
    }

    @Override
    public long estimatedCount() {
        try {
            return collection.estimatedDocumentCount();
        } catch (MongoException e) {
            throw MongoErrors.wrap("estimatedDocumentCount", e);
        }
    }

    /**
     * Unordered bulk insert. Duplicate-key errors are tolerated (a previous
     * run may already have written part of the range); any other write error
     * fails the batch.
     */
    @Override
    public void insertMany(List<DocumentRecord> documents) {
        if (documents.isEmpty()) {
            return;
        }
        List<Document> docs = new ArrayList<>(documents.size());
        for (DocumentRecord d : documents) {
            docs.add(DocumentMapper.toDocument(d));
        }
        try {
            collection.insertMany(docs, new InsertManyOptions().ordered(false));
        } catch (MongoBulkWriteException e) {
            boolean onlyDuplicates = e.getWriteConcernError() == null
                    && e.getWriteErrors().stream().allMatch(w -> w.getCode() == DUPLICATE_KEY);
            if (!onlyDuplicates) {
                throw MongoErrors.wrap("insertMany", e);
            }
            log.info(() -> String.format("insertMany into %s: skipped %d existing document(s)",
                    namespace, e.getWriteErrors().size()));
        } catch (MongoException e) {
            throw MongoErrors.wrap("insertMany", e);
        }
    }

    public String namespace() {
        return namespace;
    }

    @Override
    public void close() {
        client.close();
    }
}
