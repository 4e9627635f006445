package io.liveprobe.storage;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.event.ServerMonitorListener;
import io.liveprobe.core.config.ConfigurationException;

import java.util.concurrent.TimeUnit;

/**
 * Builds the process-wide {@link MongoClient}.
 */
public final class MongoClientFactory {

    public static final String APPLICATION_NAME = "liveprobe";
    public static final int SERVER_SELECTION_TIMEOUT_MS = 10_000;

    private MongoClientFactory() {
    }

    public static MongoClient create(String uri, int maxPoolSize, ServerMonitorListener monitorListener) {
        return MongoClients.create(settings(uri, maxPoolSize, monitorListener));
    }

    static MongoClientSettings settings(String uri, int maxPoolSize, ServerMonitorListener monitorListener) {
        if (maxPoolSize <= 0) {
            throw new ConfigurationException("maxPoolSize must be > 0, got " + maxPoolSize);
        }
        ConnectionString cs;
        try {
            cs = new ConnectionString(uri);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("invalid MongoDB connection string: " + e.getMessage(), e);
        }
        MongoClientSettings.Builder b = MongoClientSettings.builder()
                .applyConnectionString(cs)
                .applicationName(APPLICATION_NAME)
                .retryWrites(true)
                .applyToClusterSettings(c -> c.serverSelectionTimeout(SERVER_SELECTION_TIMEOUT_MS, TimeUnit.MILLISECONDS))
                .applyToConnectionPoolSettings(p -> p.maxSize(maxPoolSize));
        if (monitorListener != null) {
            b.applyToServerSettings(s -> s.addServerMonitorListener(monitorListener));
        }
        return b.build();
    }
}
