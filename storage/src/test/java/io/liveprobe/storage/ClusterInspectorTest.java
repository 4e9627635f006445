package io.liveprobe.storage;

import io.liveprobe.storage.ClusterInspector.DetectedTopology;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClusterInspectorTest {

    private static final Document MONGOS_HELLO = new Document("msg", "isdbgrid").append("ok", 1.0);

    @Test
    void replicaSetAndStandaloneAreToldApartBySetName() {
        assertEquals(DetectedTopology.REPLICA_SET,
                ClusterInspector.classify(new Document("setName", "atlas-abc-shard-0"), List.of()));
        assertEquals(DetectedTopology.STANDALONE,
                ClusterInspector.classify(new Document("isWritablePrimary", true), List.of()));
    }

    @Test
    void mongosWithRegionalShardNamesIsGlobal() {
        assertEquals(DetectedTopology.GLOBAL_CLUSTER,
                ClusterInspector.classify(MONGOS_HELLO, List.of("atlas-x-shard-0", "EU-West-1-shard")));
    }

    @Test
    void mongosWithPlainShardNamesIsSharded() {
        assertEquals(DetectedTopology.SHARDED_CLUSTER,
                ClusterInspector.classify(MONGOS_HELLO, List.of("shard-0", "shard-1")));
        assertEquals(DetectedTopology.SHARDED_CLUSTER,
                ClusterInspector.classify(MONGOS_HELLO, List.of()));
    }

    @Test
    void shardIdsAreReadFromListShardsReply() {
        Document reply = new Document("shards", List.of(
                new Document("_id", "shard-a").append("host", "h1:27017"),
                new Document("_id", "shard-b").append("host", "h2:27017")
        ));
        assertEquals(List.of("shard-a", "shard-b"), ClusterInspector.shardIds(reply));
        assertEquals(List.of(), ClusterInspector.shardIds(new Document("ok", 1)));
    }
}
