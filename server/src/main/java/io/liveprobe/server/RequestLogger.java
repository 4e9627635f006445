package io.liveprobe.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request-level logging for the status endpoint.
 *
 * Successful polls are logged at FINE: monitoring systems hit these paths
 * every few seconds.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method      HTTP method
     * @param path        request path
     * @param status      HTTP status code
     * @param totalMillis wall-clock latency for the whole request
     * @param error       optional exception (for 5xx logging), null if none
     */
    public static void logRequest(String method, String path, int status, long totalMillis, Throwable error) {
        String msg = String.format("HTTP %s %s -> %d (total=%dms)", method, path, status, totalMillis);

        if (error != null && status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (status >= 500 && status != 503) {
            log.log(Level.WARNING, msg);
        } else if (status >= 400) {
            log.log(Level.INFO, msg);
        } else {
            log.log(Level.FINE, msg);
        }
    }
}
