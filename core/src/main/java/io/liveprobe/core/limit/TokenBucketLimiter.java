// file: core/src/main/java/io/liveprobe/core/limit/TokenBucketLimiter.java
package io.liveprobe.core.limit;

import io.liveprobe.core.config.ConfigurationException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Shared token-bucket rate gate for all workers of a pool.
 *
 * Semantics:
 *   - capacity: maximum burst size (upper bound for bucket contents), never below the rate.
 *   - refillRatePerSecond: how quickly the bucket refills over time.
 *   - Every acquisition attempt lazily refills the bucket based on elapsed
 *     monotonic time, then either consumes the requested tokens or waits
 *     roughly (n - tokens) / rate before checking again.
 *
 * The bucket starts empty, so the number of grants over T seconds tracks
 * rate * T rather than rate * T + capacity.
 *
 * One lock guards all state: concurrent acquirers never oversubscribe tokens.
 * Waiters are not served in FIFO order.
 */
public final class TokenBucketLimiter {

    private static final long MIN_WAIT_NANOS = TimeUnit.MICROSECONDS.toNanos(200);

    private final double capacity;
    private final double refillRatePerSecond;
    private final LongSupplier nanoClock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition stateChanged = lock.newCondition();

    // guarded by lock
    private double tokens;
    private long lastRefillNanos;
    private long grantedTotal;
    private boolean closed;

    public TokenBucketLimiter(double refillRatePerSecond, double capacity) {
        this(refillRatePerSecond, capacity, System::nanoTime);
    }

    TokenBucketLimiter(double refillRatePerSecond, double capacity, LongSupplier nanoClock) {
        if (!(refillRatePerSecond > 0.0) || Double.isInfinite(refillRatePerSecond)) {
            throw new ConfigurationException("refillRatePerSecond must be > 0, got " + refillRatePerSecond);
        }
        if (!(capacity >= 1.0) || Double.isInfinite(capacity)) {
            throw new ConfigurationException("capacity must be >= 1, got " + capacity);
        }
        if (capacity < refillRatePerSecond) {
            throw new ConfigurationException(
                    "capacity (" + capacity + ") must be >= refillRatePerSecond (" + refillRatePerSecond + ")");
        }
        this.refillRatePerSecond = refillRatePerSecond;
        this.capacity = capacity;
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        this.tokens = 0.0;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    /**
     * Bucket sized for a target rate: burst ceiling of max(1, opsPerSecond).
     */
    public static TokenBucketLimiter forRate(double opsPerSecond) {
        return new TokenBucketLimiter(opsPerSecond, Math.max(1.0, opsPerSecond));
    }

    /**
     * Block until n tokens are available and consume them, or give up once
     * the timeout elapses.
     *
     * @return GRANTED, TIMED_OUT (rate wait, caller should simply retry) or CLOSED.
     */
    public AcquireResult acquire(int n, Duration timeout) throws InterruptedException {
        checkRequest(n);
        Objects.requireNonNull(timeout, "timeout");

        lock.lock();
        try {
            long deadline = nanoClock.getAsLong() + Math.max(0L, saturatedNanos(timeout));
            while (!closed) {
                long now = nanoClock.getAsLong();
                refill(now);
                if (tokens >= n) {
                    tokens -= n;
                    grantedTotal += n;
                    return AcquireResult.GRANTED;
                }

                long remaining = deadline - now;
                if (remaining <= 0L) {
                    return AcquireResult.TIMED_OUT;
                }

                double missing = n - tokens;
                long needNanos = (long) Math.ceil(missing / refillRatePerSecond * 1_000_000_000.0);
                long waitNanos = Math.max(MIN_WAIT_NANOS, Math.min(needNanos, remaining));
                // Spurious and early wake-ups are fine: the loop re-checks.
                stateChanged.awaitNanos(waitNanos);
            }
            return AcquireResult.CLOSED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Non-blocking variant: consume n tokens if they are available right now.
     */
    public boolean tryAcquire(int n) {
        checkRequest(n);
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            refill(nanoClock.getAsLong());
            if (tokens < n) {
                return false;
            }
            tokens -= n;
            grantedTotal += n;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Close the limiter: all current and future waiters return CLOSED.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /** Total number of tokens handed out since construction. */
    public long grantedTotal() {
        lock.lock();
        try {
            return grantedTotal;
        } finally {
            lock.unlock();
        }
    }

    /** Current bucket contents after a lazy refill. */
    public double availableTokens() {
        lock.lock();
        try {
            refill(nanoClock.getAsLong());
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    public double capacity() {
        return capacity;
    }

    public double refillRatePerSecond() {
        return refillRatePerSecond;
    }

    // ---------- internals ----------

    private void refill(long now) {
        long deltaNanos = now - lastRefillNanos;
        if (deltaNanos <= 0L) {
            return;
        }
        double added = (deltaNanos / 1_000_000_000.0) * refillRatePerSecond;
        tokens = Math.min(capacity, tokens + added);
        lastRefillNanos = now;
    }

    private void checkRequest(int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("requested tokens must be > 0, got " + n);
        }
        if (n > capacity) {
            throw new IllegalArgumentException(
                    "requested tokens (" + n + ") exceed bucket capacity (" + capacity + ")");
        }
    }

    private static long saturatedNanos(Duration d) {
        try {
            return d.toNanos();
        } catch (ArithmeticException overflow) {
            return d.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE / 2;
        }
    }
}
