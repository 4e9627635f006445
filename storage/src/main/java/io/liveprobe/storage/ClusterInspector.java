package io.liveprobe.storage;

import com.mongodb.MongoCommandException;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import io.liveprobe.core.routing.ClusterTopology;
import org.bson.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Read-mostly view of the cluster behind a client, plus best-effort shard-key setup.
 *
 * Responsibilities:
 *  - Detect what the client is connected to (standalone, replica set,
 *    sharded cluster, global cluster) from hello and listShards.
 *  - Log topology and collection sharding state at startup.
 *  - Shard the probe collection to fit the configured routing strategy.
 *
 * Nothing here is required for the workload to run: every failure is
 * logged and the caller carries on.
 */
public final class ClusterInspector {
    private static final Logger log = Logger.getLogger(ClusterInspector.class.getName());

    /** Substrings of shard names that indicate region-pinned (global) shards. */
    static final List<String> REGION_INDICATORS = List.of("us-east", "us-west", "eu-", "ap-", "sa-", "global");

    public enum DetectedTopology {
        STANDALONE,
        REPLICA_SET,
        SHARDED_CLUSTER,
        GLOBAL_CLUSTER,
        UNKNOWN
    }

    private final MongoClient client;

    public ClusterInspector(MongoClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    // ---------- detection ----------

    public DetectedTopology detect() {
        Document hello;
        try {
            hello = admin("hello");
        } catch (MongoException e) {
            log.warning("hello failed, cluster type unknown: " + e.getMessage());
            return DetectedTopology.UNKNOWN;
        }
        if (!isMongos(hello)) {
            return classify(hello, List.of());
        }
        try {
            return classify(hello, shardIds(admin("listShards")));
        } catch (MongoException e) {
            log.fine(() -> "listShards failed: " + e.getMessage());
            return DetectedTopology.SHARDED_CLUSTER;
        }
    }

    /**
     * Pure classification of a hello reply and (when connected to mongos) the shard names.
     */
    static DetectedTopology classify(Document hello, List<String> shardIds) {
        if (hello == null) {
            return DetectedTopology.UNKNOWN;
        }
        if (!isMongos(hello)) {
            return hello.containsKey("setName") ? DetectedTopology.REPLICA_SET : DetectedTopology.STANDALONE;
        }
        for (String id : shardIds) {
            String lower = id.toLowerCase(Locale.ROOT);
            for (String indicator : REGION_INDICATORS) {
                if (lower.contains(indicator)) {
                    return DetectedTopology.GLOBAL_CLUSTER;
                }
            }
        }
        return DetectedTopology.SHARDED_CLUSTER;
    }

    static boolean isMongos(Document hello) {
        return "isdbgrid".equals(hello.getString("msg"));
    }

    static List<String> shardIds(Document listShardsReply) {
        List<String> out = new ArrayList<>();
        List<Document> shards = listShardsReply.getList("shards", Document.class, List.of());
        for (Document s : shards) {
            Object id = s.get("_id");
            if (id != null) {
                out.add(id.toString());
            }
        }
        return out;
    }

    // ---------- logging ----------

    public void logClusterInfo(String database, String collection) {
        DetectedTopology type = detect();
        switch (type) {
            case GLOBAL_CLUSTER, SHARDED_CLUSTER -> logShards(type);
            case REPLICA_SET -> logReplicaSet();
            default -> log.info("Topology: " + type);
        }
        logCollectionStats(database, collection);
    }

    private void logShards(DetectedTopology type) {
        try {
            List<String> ids = shardIds(admin("listShards"));
            log.info(() -> String.format("Topology: %s with %d shard(s)", type, ids.size()));
            if (type == DetectedTopology.GLOBAL_CLUSTER) {
                ids.forEach(id -> log.info("  Shard: " + id));
            }
        } catch (MongoException e) {
            log.info("Topology: " + type + " (listShards unavailable: " + e.getMessage() + ")");
        }
    }

    private void logReplicaSet() {
        try {
            Document hello = admin("hello");
            log.info("Topology: REPLICA_SET name=" + hello.getString("setName"));
        } catch (MongoException e) {
            log.info("Topology: REPLICA_SET (" + e.getMessage() + ")");
        }
    }

    private void logCollectionStats(String database, String collection) {
        Document stats;
        try {
            stats = collStats(database, collection);
        } catch (MongoException e) {
            log.fine(() -> "collStats unavailable for " + database + "." + collection + ": " + e.getMessage());
            return;
        }
        if (!stats.getBoolean("sharded", false)) {
            log.info(() -> "Collection " + database + "." + collection + " is not sharded");
            return;
        }
        log.info(() -> "Collection " + database + "." + collection + " is sharded");
        Document shards = stats.get("shards", Document.class);
        if (shards == null) {
            return;
        }
        for (Map.Entry<String, Object> e : shards.entrySet()) {
            if (e.getValue() instanceof Document s) {
                log.info(String.format("  Shard %s: count=%s size=%s", e.getKey(), s.get("count"), s.get("size")));
            }
        }
    }

    // ---------- sharding ----------

    /**
     * Apply the shard key that matches the routing strategy. Replica sets need none.
     */
    public void prepareCollection(ClusterTopology topology, String database, String collection) {
        switch (topology) {
            case REPLICA_SET -> log.fine("Replica set routing: no shard key to apply");
            case SHARDED -> ensureShardedIdHashed(database, collection);
            case GEOSHARDED -> ensureShardedLocationCompound(database, collection, "location");
        }
    }

    /** Best effort: shard on {_id: "hashed"} when connected via mongos. */
    public boolean ensureShardedIdHashed(String database, String collection) {
        if (!readyToShard(database, collection)) {
            return false;
        }
        return shardCollection(database, collection, new Document("_id", "hashed"));
    }

    /**
     * Best effort: shard on {keyField: 1, _id: "hashed"} so writes route by
     * zone while spreading within it; falls back to {_id: "hashed"}.
     */
    public boolean ensureShardedLocationCompound(String database, String collection, String keyField) {
        if (!readyToShard(database, collection)) {
            return false;
        }
        if (shardCollection(database, collection, new Document(keyField, 1).append("_id", "hashed"))) {
            return true;
        }
        log.info("Compound shard key failed; falling back to {_id: \"hashed\"}");
        return shardCollection(database, collection, new Document("_id", "hashed"));
    }

    // ---------- internals ----------

    /**
     * Connected via mongos, collection not yet sharded, collection created and
     * sharding enabled on the database.
     */
    private boolean readyToShard(String database, String collection) {
        Document hello;
        try {
            hello = admin("hello");
        } catch (MongoException e) {
            log.warning("hello failed; skipping sharding step: " + e.getMessage());
            return false;
        }
        if (!isMongos(hello)) {
            log.info("Not connected via mongos; skipping sharding step");
            return false;
        }

        try {
            if (collStats(database, collection).getBoolean("sharded", false)) {
                log.info(() -> "Collection " + database + "." + collection + " already sharded; skipping");
                return false;
            }
        } catch (MongoException e) {
            log.fine(() -> "collStats failed (collection may not exist yet): " + e.getMessage());
        }

        try {
            client.getDatabase(database).createCollection(collection);
        } catch (MongoCommandException e) {
            log.fine(() -> "createCollection skipped: " + e.getErrorCodeName());
        } catch (MongoException e) {
            log.warning("createCollection failed; skipping sharding step: " + e.getMessage());
            return false;
        }

        try {
            client.getDatabase("admin").runCommand(new Document("enableSharding", database));
        } catch (MongoException e) {
            log.fine(() -> "enableSharding skipped: " + e.getMessage());
        }
        return true;
    }

    private boolean shardCollection(String database, String collection, Document key) {
        try {
            client.getDatabase("admin").runCommand(
                    new Document("shardCollection", database + "." + collection).append("key", key));
            log.info(() -> "Sharded " + database + "." + collection + " on " + key.toJson());
            return true;
        } catch (MongoException e) {
            log.info("Shard step on " + key.toJson()
                    + " skipped or failed (already sharded or unauthorized): " + e.getMessage());
            return false;
        }
    }

    private Document admin(String command) {
        return client.getDatabase("admin").runCommand(new Document(command, 1));
    }

    private Document collStats(String database, String collection) {
        return client.getDatabase(database).runCommand(new Document("collStats", collection));
    }
}
