package io.liveprobe.core.routing;

import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Allocator for document sequence numbers.
 *
 * Sequences [0, size) are assumed to exist in the collection (preloaded or
 * inserted by this process). Inserts take fresh sequences, reads and updates
 * pick uniformly among the allocated ones.
 */
public final class KeySpace {

    private final AtomicLong next;

    public KeySpace(long existingDocuments) {
        if (existingDocuments < 0) {
            throw new IllegalArgumentException("existingDocuments must be >= 0");
        }
        this.next = new AtomicLong(existingDocuments);
    }

    /** Fresh, never handed out before. */
    public long nextSequence() {
        return next.getAndIncrement();
    }

    /**
     * Uniformly random sequence among those allocated so far. With an empty
     * key space this returns 0, which targets a document that may not exist.
     */
    public long randomExisting(Random rnd) {
        long bound = Math.max(1L, next.get());
        return bound == 1L ? 0L : rnd.nextLong(bound);
    }

    public long size() {
        return next.get();
    }
}
