package io.liveprobe.storage;

import com.mongodb.MongoClientSettings;
import io.liveprobe.core.config.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MongoClientFactoryTest {

    @Test
    void settingsCarryPoolSizeAndApplicationName() {
        MongoClientSettings s = MongoClientFactory.settings("mongodb://localhost:27017", 25, null);

        assertEquals("liveprobe", s.getApplicationName());
        assertEquals(25, s.getConnectionPoolSettings().getMaxSize());
        assertEquals(10_000L, s.getClusterSettings().getServerSelectionTimeout(TimeUnit.MILLISECONDS));
        assertTrue(s.getServerSettings().getServerMonitorListeners().isEmpty());
    }

    @Test
    void monitorListenerIsRegistered() {
        HeartbeatFailureListener listener = new HeartbeatFailureListener((m, e, c) -> { });
        MongoClientSettings s = MongoClientFactory.settings("mongodb://localhost", 5, listener);

        assertEquals(1, s.getServerSettings().getServerMonitorListeners().size());
    }

    @Test
    void invalidInputsAreConfigurationErrors() {
        assertThrows(ConfigurationException.class, () -> MongoClientFactory.settings("localhost:27017", 5, null));
        assertThrows(ConfigurationException.class, () -> MongoClientFactory.settings("mongodb://localhost", 0, null));
    }
}
