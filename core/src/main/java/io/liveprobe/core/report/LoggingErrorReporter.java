package io.liveprobe.core.report;

import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default reporter: writes events to the "liveprobe.errors" logger.
 */
public final class LoggingErrorReporter implements ErrorReporter {
    private static final Logger log = Logger.getLogger("liveprobe.errors");

    private final Level level;

    public LoggingErrorReporter() {
        this(Level.WARNING);
    }

    public LoggingErrorReporter(Level level) {
        this.level = level;
    }

    @Override
    public void report(String message, Throwable error, Map<String, String> context) {
        if (!log.isLoggable(level)) {
            return;
        }
        String line = message + " " + new TreeMap<>(context);
        if (error == null) {
            log.log(level, line);
        } else {
            log.log(level, line + ": " + error);
        }
    }
}
