package io.liveprobe.core.storage;

import java.util.Map;

/**
 * Field changes for {@link StorageClient#update}: values to overwrite and
 * numeric fields to increment.
 */
public record FieldUpdate(Map<String, Object> set, Map<String, Number> increment) {

    public FieldUpdate {
        set = set == null ? Map.of() : Map.copyOf(set);
        increment = increment == null ? Map.of() : Map.copyOf(increment);
        if (set.isEmpty() && increment.isEmpty()) {
            throw new IllegalArgumentException("update must change at least one field");
        }
    }

    /** The workload's standard touch: bump the counter n and refresh the timestamp ts. */
    public static FieldUpdate touch(long nowMillis) {
        return new FieldUpdate(Map.of("ts", nowMillis), Map.of("n", 1));
    }
}
