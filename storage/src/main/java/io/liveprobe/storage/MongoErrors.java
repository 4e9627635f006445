package io.liveprobe.storage;

import com.mongodb.MongoException;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoNodeIsRecoveringException;
import com.mongodb.MongoNotPrimaryException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import io.liveprobe.core.storage.StorageException;

/**
 * Maps driver exceptions onto {@link StorageException}.
 *
 * Transient: network errors, server selection / execution timeouts,
 * elections (not primary, node recovering) and anything the server labels
 * retryable. Everything else (auth, bad command, duplicate key) is fatal
 * for that operation.
 */
final class MongoErrors {

    static final String RETRYABLE_WRITE_LABEL = "RetryableWriteError";
    static final String TRANSIENT_TXN_LABEL = "TransientTransactionError";

    private MongoErrors() {
    }

    static boolean isTransient(MongoException e) {
        if (e instanceof MongoSocketException
                || e instanceof MongoTimeoutException
                || e instanceof MongoExecutionTimeoutException
                || e instanceof MongoNotPrimaryException
                || e instanceof MongoNodeIsRecoveringException) {
            return true;
        }
        return e.hasErrorLabel(RETRYABLE_WRITE_LABEL) || e.hasErrorLabel(TRANSIENT_TXN_LABEL);
    }

    static StorageException wrap(String operation, MongoException e) {
        boolean transientFailure = isTransient(e);
        return new StorageException(
                operation + " failed (code=" + e.getCode() + ", transient=" + transientFailure + "): " + e.getMessage(),
                transientFailure,
                e
        );
    }
}
