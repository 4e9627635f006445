package io.liveprobe.core.report;

import java.util.Map;

/**
 * Destination for error events (operation failures, connectivity
 * degradation, driver heartbeat failures).
 *
 * Implementations must not throw into the caller; delivery problems are
 * theirs to log.
 */
public interface ErrorReporter {

    void report(String message, Throwable error, Map<String, String> context);

    default void close() {
    }
}
