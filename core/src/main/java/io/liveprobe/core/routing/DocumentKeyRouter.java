package io.liveprobe.core.routing;

import io.liveprobe.core.config.ConfigurationException;

import java.util.Objects;

/**
 * Topology-aware key generation.
 *
 * Responsibilities:
 *  - replica_set: a unique, readable id ("doc-42"); no location.
 *  - sharded:     a unique id spread over the hash space, so a {_id: "hashed"}
 *                 shard key distributes writes. The hashing itself is done by
 *                 the cluster; we only guarantee uniqueness and scatter.
 *  - geosharded:  the scattered id plus a location picked deterministically
 *                 from the zone set.
 *
 * Properties:
 *  - Deterministic: the same sequence always yields the same key, including
 *    its location. Finds and updates re-derive the routing field from the
 *    sequence instead of looking it up.
 *  - Unique: the id mixer is a bijection on 64-bit values, so distinct
 *    sequences never share an id.
 */
public final class DocumentKeyRouter {

    private final ClusterTopology topology;
    private final ZoneSet zones;

    public DocumentKeyRouter(ClusterTopology topology, ZoneSet zones) {
        this.topology = Objects.requireNonNull(topology, "topology");
        if (topology.usesLocation() && zones == null) {
            throw new ConfigurationException("a zone set is required for the geosharded topology");
        }
        this.zones = zones;
    }

    public DocumentKey buildKey(long sequence) {
        return switch (topology) {
            case REPLICA_SET -> new DocumentKey(sequence, "doc-" + sequence, null);
            case SHARDED -> new DocumentKey(sequence, scatteredId(sequence), null);
            case GEOSHARDED -> new DocumentKey(sequence, scatteredId(sequence), locationFor(sequence));
        };
    }

    /**
     * Zone for a sequence: floorMod(mix(sequence), |zones|).
     */
    public String locationFor(long sequence) {
        if (zones == null) {
            throw new IllegalStateException("no zone set configured for topology " + topology.configName());
        }
        return zones.get(Math.floorMod(mix64(sequence), zones.size()));
    }

    public ClusterTopology topology() {
        return topology;
    }

    // ---------- helpers ----------

    private static String scatteredId(long sequence) {
        return String.format("%016x", mix64(sequence));
    }

    /**
     * SplitMix64 finalizer. Every step (xor-shift, odd multiply) is invertible,
     * which makes the whole function a permutation of the 64-bit values.
     */
    static long mix64(long z) {
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        return z ^ (z >>> 31);
    }
}
