package io.liveprobe.core.limit;

/**
 * Outcome of a blocking {@link TokenBucketLimiter#acquire} call.
 */
public enum AcquireResult {
    /** Tokens were consumed; the caller may do one unit of work per token. */
    GRANTED,
    /** The deadline elapsed first. A normal rate wait, not an error. */
    TIMED_OUT,
    /** The limiter was closed while (or before) waiting. */
    CLOSED
}
