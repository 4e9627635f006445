package io.liveprobe.core.engine;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ShutdownSignalTest {

    @Test
    void raiseReleasesWaitersAndIsIdempotent() throws Exception {
        ShutdownSignal signal = new ShutdownSignal();
        CountDownLatch released = new CountDownLatch(1);
        Thread waiter = new Thread(() -> {
            try {
                signal.await();
                released.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();

        assertFalse(signal.isRaised());
        assertFalse(released.await(50, TimeUnit.MILLISECONDS));

        signal.raise();
        signal.raise();

        assertTrue(released.await(2, TimeUnit.SECONDS));
        assertTrue(signal.isRaised());
        waiter.join(2_000);
    }
}
