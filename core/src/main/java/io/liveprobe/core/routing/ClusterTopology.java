package io.liveprobe.core.routing;

import io.liveprobe.core.config.ConfigurationException;

import java.util.Locale;

/**
 * Data-distribution strategy of the target cluster. Fixed for the process lifetime.
 */
public enum ClusterTopology {
    /** Unsharded replica set: plain unique ids. */
    REPLICA_SET("replica_set"),
    /** Hash-sharded on _id: ids must be unique and spread over the hash space. */
    SHARDED("sharded"),
    /** Zone-sharded on {location, _id}: every document carries a location from the zone set. */
    GEOSHARDED("geosharded");

    private final String configName;

    ClusterTopology(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public boolean usesLocation() {
        return this == GEOSHARDED;
    }

    public static ClusterTopology fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("cluster topology must not be empty");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ClusterTopology t : values()) {
            if (t.configName.equals(normalized)) {
                return t;
            }
        }
        throw new ConfigurationException(
                "invalid cluster topology '" + name + "', expected one of replica_set, sharded, geosharded");
    }
}
