package io.liveprobe.core.storage;

import io.liveprobe.core.routing.DocumentKey;

import java.util.Map;
import java.util.Objects;

/**
 * Document handed to {@link StorageClient#insert}: its routing key plus
 * generated payload fields. Payload maps may be nested (maps, lists).
 */
public record DocumentRecord(DocumentKey key, Map<String, Object> payload) {

    public DocumentRecord {
        Objects.requireNonNull(key, "key");
        payload = payload == null ? Map.of() : payload;
    }
}
