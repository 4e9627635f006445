package io.liveprobe.storage;

import com.mongodb.MongoCommandException;
import com.mongodb.MongoException;
import com.mongodb.MongoSocketReadException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.ServerAddress;
import io.liveprobe.core.storage.StorageException;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MongoErrorsTest {

    @Test
    void networkAndTimeoutFailuresAreTransient() {
        assertTrue(MongoErrors.isTransient(new MongoSocketReadException("connection reset", new ServerAddress())));
        assertTrue(MongoErrors.isTransient(new MongoTimeoutException("no server selected within 10000 ms")));
    }

    @Test
    void retryableLabelMakesAnyErrorTransient() {
        MongoException e = new MongoException("write interrupted");
        assertFalse(MongoErrors.isTransient(e));

        e.addLabel(MongoErrors.RETRYABLE_WRITE_LABEL);
        assertTrue(MongoErrors.isTransient(e));
    }

    @Test
    void commandErrorsAreFatalAndKeepTheirCause() {
        BsonDocument reply = new BsonDocument("ok", new BsonInt32(0))
                .append("code", new BsonInt32(13))
                .append("codeName", new BsonString("Unauthorized"))
                .append("errmsg", new BsonString("not authorized on liveness"));
        MongoCommandException cause = new MongoCommandException(reply, new ServerAddress());

        StorageException wrapped = MongoErrors.wrap("insert", cause);

        assertFalse(wrapped.transientFailure());
        assertSame(cause, wrapped.getCause());
        assertTrue(wrapped.getMessage().startsWith("insert failed (code=13"), wrapped.getMessage());
    }
}
