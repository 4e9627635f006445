package io.liveprobe.core.health;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class HeartbeatMonitorTest {

    /** Records transitions in order. */
    private static final class RecordingListener implements HeartbeatListener {
        final List<String> events = new ArrayList<>();
        final List<Throwable> causes = new ArrayList<>();

        @Override
        public synchronized void onDegraded(HeartbeatState state, Throwable cause) {
            events.add("degraded@" + state.consecutiveFailures());
            causes.add(cause);
        }

        @Override
        public synchronized void onRecovered(HeartbeatState state) {
            events.add("recovered");
        }
    }

    private static final HealthProbe OK = () -> { };
    private static final HealthProbe FAIL = () -> {
        throw new IOException("connection refused");
    };

    @Test
    void degradesExactlyOnTheThresholdFailure() {
        RecordingListener listener = new RecordingListener();
        HeartbeatMonitor monitor = new HeartbeatMonitor(3, listener);

        assertEquals(HealthStatus.HEALTHY, monitor.runOnce(FAIL).status());
        assertEquals(HealthStatus.HEALTHY, monitor.runOnce(FAIL).status());
        assertTrue(listener.events.isEmpty());

        HeartbeatState third = monitor.runOnce(FAIL);
        assertEquals(HealthStatus.DEGRADED, third.status());
        assertEquals(3, third.consecutiveFailures());
        assertEquals(List.of("degraded@3"), listener.events);
        assertEquals("connection refused", listener.causes.get(0).getMessage());

        // further failures stay degraded without re-emitting
        monitor.runOnce(FAIL);
        monitor.runOnce(FAIL);
        assertEquals(5, monitor.state().consecutiveFailures());
        assertEquals(List.of("degraded@3"), listener.events);
    }

    @Test
    void nextSuccessRecoversImmediately() {
        RecordingListener listener = new RecordingListener();
        HeartbeatMonitor monitor = new HeartbeatMonitor(2, listener);

        monitor.runOnce(FAIL);
        monitor.runOnce(FAIL);
        assertFalse(monitor.state().healthy());

        HeartbeatState after = monitor.runOnce(OK);
        assertTrue(after.healthy());
        assertEquals(0, after.consecutiveFailures());
        assertNotNull(after.lastSuccess());
        assertNotNull(after.lastFailure());
        assertEquals(3L, after.probes());
        assertEquals(List.of("degraded@2", "recovered"), listener.events);
    }

    @Test
    void successBelowThresholdResetsTheCountWithoutEvents() {
        RecordingListener listener = new RecordingListener();
        HeartbeatMonitor monitor = new HeartbeatMonitor(3, listener);

        monitor.runOnce(FAIL);
        monitor.runOnce(FAIL);
        monitor.runOnce(OK);
        monitor.runOnce(FAIL);
        monitor.runOnce(FAIL);

        assertTrue(monitor.state().healthy());
        assertEquals(2, monitor.state().consecutiveFailures());
        assertTrue(listener.events.isEmpty());
    }

    @Test
    void throwingListenerDoesNotBreakTheMonitor() {
        HeartbeatListener broken = new HeartbeatListener() {
            @Override
            public void onDegraded(HeartbeatState state, Throwable cause) {
                throw new IllegalStateException("listener bug");
            }

            @Override
            public void onRecovered(HeartbeatState state) {
                throw new IllegalStateException("listener bug");
            }
        };
        HeartbeatMonitor monitor = new HeartbeatMonitor(1, broken);

        assertEquals(HealthStatus.DEGRADED, monitor.runOnce(FAIL).status());
        assertEquals(HealthStatus.HEALTHY, monitor.runOnce(OK).status());
    }

    @Test
    void scheduledProbesRunUntilStopped() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch three = new CountDownLatch(3);
        HeartbeatMonitor monitor = new HeartbeatMonitor(3, HeartbeatListener.NO_OP);

        monitor.start(Duration.ofMillis(20), () -> {
            calls.incrementAndGet();
            three.countDown();
        });
        assertTrue(three.await(2, TimeUnit.SECONDS), "expected at least three probes");

        monitor.stop();
        assertTrue(monitor.awaitStopped(Duration.ofSeconds(1)));
        int afterStop = calls.get();
        Thread.sleep(100);
        assertEquals(afterStop, calls.get(), "no probes after stop");
        assertTrue(monitor.state().probes() >= 3);
    }

    @Test
    void subMillisecondIntervalIsScheduled() throws Exception {
        CountDownLatch five = new CountDownLatch(5);
        HeartbeatMonitor monitor = new HeartbeatMonitor(3, HeartbeatListener.NO_OP);

        monitor.start(Duration.ofNanos(500_000), five::countDown);

        assertTrue(five.await(2, TimeUnit.SECONDS));
        monitor.stop();
        assertTrue(monitor.awaitStopped(Duration.ofSeconds(1)));
    }

    @Test
    void stopLetsTheInFlightProbeFinish() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        AtomicBoolean completed = new AtomicBoolean();
        HeartbeatMonitor monitor = new HeartbeatMonitor(3, HeartbeatListener.NO_OP);

        monitor.start(Duration.ofSeconds(10), () -> {
            entered.countDown();
            Thread.sleep(150);
            completed.set(true);
        });
        assertTrue(entered.await(2, TimeUnit.SECONDS));
        monitor.stop();

        assertTrue(monitor.awaitStopped(Duration.ofSeconds(2)));
        assertTrue(completed.get());
        assertTrue(monitor.state().healthy());
        assertEquals(1L, monitor.state().probes());
    }

    @Test
    void invalidSettingsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new HeartbeatMonitor(0, null));
        HeartbeatMonitor monitor = new HeartbeatMonitor(1, null);
        assertThrows(IllegalArgumentException.class, () -> monitor.start(Duration.ZERO, OK));
    }
}
