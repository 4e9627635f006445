package io.liveprobe.core.engine;

/**
 * Classification of one storage call.
 */
public enum OutcomeType {
    SUCCESS,
    /** The storage call failed (timeout, network, nothing matched). Expected under load. */
    OPERATION_ERROR,
    /** Anything else the call threw. Still never stops the pool. */
    UNEXPECTED_ERROR
}
