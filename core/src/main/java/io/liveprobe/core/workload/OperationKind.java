package io.liveprobe.core.workload;

import io.liveprobe.core.config.ConfigurationException;

import java.util.Locale;

/**
 * Kinds of storage operation a worker can issue.
 */
public enum OperationKind {
    FIND("find"),
    INSERT("insert"),
    UPDATE("update");

    private final String wireName;

    OperationKind(String wireName) {
        this.wireName = wireName;
    }

    /** Lower-case name used in configuration strings and logs. */
    public String wireName() {
        return wireName;
    }

    public static OperationKind fromName(String name) {
        if (name == null) {
            throw new ConfigurationException("operation kind must not be null");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (OperationKind k : values()) {
            if (k.wireName.equals(normalized)) {
                return k;
            }
        }
        throw new ConfigurationException("unknown operation kind: '" + name + "'");
    }
}
