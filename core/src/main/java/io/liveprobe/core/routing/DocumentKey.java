package io.liveprobe.core.routing;

import java.util.Objects;

/**
 * Routing identity of one document.
 *
 * @param sequence insertion sequence the key was derived from
 * @param id       unique document id (stored as _id)
 * @param location zone code, non-null iff the topology is geosharded
 */
public record DocumentKey(long sequence, String id, String location) {

    public DocumentKey {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
    }

    public boolean hasLocation() {
        return location != null;
    }
}
