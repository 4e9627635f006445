package io.liveprobe.core.storage;

import io.liveprobe.core.routing.DocumentKey;

/**
 * An update addressed a document that does not exist.
 */
public class DocumentNotFoundException extends StorageException {

    public DocumentNotFoundException(DocumentKey key) {
        super("no document matched id=" + key.id()
                + (key.hasLocation() ? " location=" + key.location() : ""), false);
    }
}
