package io.liveprobe.core.limit;

import io.liveprobe.core.config.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class TokenBucketLimiterTest {

    private static final long SECOND = 1_000_000_000L;

    @Test
    void startsEmptyAndRefillsLinearlyUpToCapacity() {
        AtomicLong clock = new AtomicLong();
        TokenBucketLimiter limiter = new TokenBucketLimiter(10.0, 20.0, clock::get);

        assertFalse(limiter.tryAcquire(1));

        clock.addAndGet(SECOND / 2); // +5 tokens
        for (int i = 0; i < 5; i++) {
            assertTrue(limiter.tryAcquire(1));
        }
        assertFalse(limiter.tryAcquire(1));

        clock.addAndGet(10 * SECOND); // would be +100, capped at 20
        assertEquals(20.0, limiter.availableTokens(), 1e-9);
        assertTrue(limiter.tryAcquire(20));
        assertEquals(25L, limiter.grantedTotal());
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(ConfigurationException.class, () -> new TokenBucketLimiter(0.0, 10.0));
        assertThrows(ConfigurationException.class, () -> new TokenBucketLimiter(-1.0, 10.0));
        assertThrows(ConfigurationException.class, () -> new TokenBucketLimiter(50.0, 10.0));
        assertThrows(ConfigurationException.class, () -> new TokenBucketLimiter(0.5, 0.5));
        assertThrows(ConfigurationException.class, () -> new TokenBucketLimiter(10.0, Double.NaN));
        assertThrows(ConfigurationException.class, () -> new TokenBucketLimiter(10.0, Double.POSITIVE_INFINITY));
        assertEquals(1.0, TokenBucketLimiter.forRate(0.5).capacity());
    }

    @Test
    void requestLargerThanCapacityIsRejected() {
        TokenBucketLimiter limiter = new TokenBucketLimiter(5.0, 5.0);
        assertThrows(IllegalArgumentException.class, () -> limiter.tryAcquire(6));
        assertThrows(IllegalArgumentException.class, () -> limiter.acquire(0, Duration.ofMillis(1)));
    }

    @Test
    void acquireTimesOutWhenTokensCannotArriveInTime() throws Exception {
        TokenBucketLimiter limiter = new TokenBucketLimiter(1.0, 1.0); // one token per second, bucket empty

        long start = System.nanoTime();
        AcquireResult r = limiter.acquire(1, Duration.ofMillis(50));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;

        assertEquals(AcquireResult.TIMED_OUT, r);
        assertTrue(elapsedMs >= 40, "should have waited roughly the timeout, waited " + elapsedMs + "ms");
        assertEquals(0L, limiter.grantedTotal());
    }

    @Test
    void closeWakesBlockedWaiters() throws Exception {
        TokenBucketLimiter limiter = new TokenBucketLimiter(0.01, 1.0); // next token in 100s
        ExecutorService exec = Executors.newFixedThreadPool(3);
        try {
            CountDownLatch started = new CountDownLatch(3);
            List<Future<AcquireResult>> results = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                results.add(exec.submit(() -> {
                    started.countDown();
                    return limiter.acquire(1, Duration.ofSeconds(30));
                }));
            }
            assertTrue(started.await(2, TimeUnit.SECONDS));
            Thread.sleep(50);

            limiter.close();

            for (Future<AcquireResult> f : results) {
                assertEquals(AcquireResult.CLOSED, f.get(2, TimeUnit.SECONDS));
            }
            assertFalse(limiter.tryAcquire(1));
            assertEquals(AcquireResult.CLOSED, limiter.acquire(1, Duration.ofSeconds(1)));
        } finally {
            exec.shutdownNow();
        }
    }

    @Test
    void concurrentAcquirersNeverOversubscribe() throws Exception {
        double rate = 200.0;
        double capacity = 20.0;
        TokenBucketLimiter limiter = new TokenBucketLimiter(rate, capacity);
        int threads = 8;
        long runNanos = TimeUnit.MILLISECONDS.toNanos(1000);

        ExecutorService exec = Executors.newFixedThreadPool(threads);
        AtomicLong granted = new AtomicLong();
        long start = System.nanoTime();
        try {
            List<Future<?>> fs = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                fs.add(exec.submit(() -> {
                    while (System.nanoTime() - start < runNanos) {
                        try {
                            if (limiter.acquire(1, Duration.ofMillis(20)) == AcquireResult.GRANTED) {
                                granted.incrementAndGet();
                            }
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            return;
                        }
                    }
                }));
            }
            for (Future<?> f : fs) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            exec.shutdownNow();
        }
        double elapsedSeconds = (System.nanoTime() - start) / 1e9;

        assertEquals(granted.get(), limiter.grantedTotal());
        assertTrue(granted.get() <= capacity + rate * elapsedSeconds + 1e-6,
                "granted " + granted.get() + " in " + elapsedSeconds + "s");
    }

    @Test
    void aggregateRateConvergesOnTarget() throws Exception {
        double rate = 100.0;
        TokenBucketLimiter limiter = TokenBucketLimiter.forRate(rate);
        int threads = 6;
        long runMillis = 2500;

        ExecutorService exec = Executors.newFixedThreadPool(threads);
        long start = System.nanoTime();
        long deadline = start + TimeUnit.MILLISECONDS.toNanos(runMillis);
        try {
            List<Future<?>> fs = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                fs.add(exec.submit(() -> {
                    while (System.nanoTime() < deadline) {
                        try {
                            limiter.acquire(1, Duration.ofMillis(50));
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            return;
                        }
                    }
                }));
            }
            for (Future<?> f : fs) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            exec.shutdownNow();
        }
        double elapsedSeconds = (System.nanoTime() - start) / 1e9;
        double expected = rate * elapsedSeconds;

        long granted = limiter.grantedTotal();
        assertEquals(expected, granted, expected * 0.05,
                "granted " + granted + " over " + elapsedSeconds + "s, expected ~" + expected);
    }
}
