package io.liveprobe.core.engine;

import java.util.List;

/**
 * Consumer of per-operation outcomes (metrics, error reporting, ...).
 *
 * Called concurrently from every worker thread; implementations must be thread-safe.
 */
@FunctionalInterface
public interface OutcomeSink {

    void record(OperationOutcome outcome);

    /** Deliver every outcome to each sink, in order. */
    static OutcomeSink fanOut(OutcomeSink... sinks) {
        List<OutcomeSink> all = List.of(sinks);
        return outcome -> {
            for (OutcomeSink s : all) {
                s.record(outcome);
            }
        };
    }
}
