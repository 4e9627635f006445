package io.liveprobe.core.config;

/**
 * Raised when configuration is malformed: an operation mix with no positive
 * weight, an unknown topology, a non-positive rate, and so on.
 *
 * Always thrown at construction time, before any worker is started.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
