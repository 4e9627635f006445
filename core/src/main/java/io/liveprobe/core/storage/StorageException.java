package io.liveprobe.core.storage;

/**
 * A single storage call failed.
 *
 * The transient hint tells reporting whether the failure is the kind a
 * retry would likely fix (timeouts, dropped sockets, elections) or a fatal
 * one (authorization, bad command, duplicate key). Workers treat both as an
 * operation error and continue.
 */
public class StorageException extends RuntimeException {

    private final boolean transientFailure;

    public StorageException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public StorageException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean transientFailure() {
        return transientFailure;
    }
}
