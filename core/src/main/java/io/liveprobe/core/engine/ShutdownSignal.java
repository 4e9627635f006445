package io.liveprobe.core.engine;

import java.util.concurrent.CountDownLatch;

/**
 * Cooperative cancellation token shared by the dispatcher, its workers and
 * the surrounding process. Raising it is idempotent and irreversible.
 */
public final class ShutdownSignal {

    private final CountDownLatch raised = new CountDownLatch(1);

    public void raise() {
        raised.countDown();
    }

    public boolean isRaised() {
        return raised.getCount() == 0;
    }

    /** Block until the signal is raised. */
    public void await() throws InterruptedException {
        raised.await();
    }
}
