package io.liveprobe.core.health;

/**
 * One lightweight health check. Returning normally means success; any
 * exception counts as a failed probe.
 */
@FunctionalInterface
public interface HealthProbe {

    void probe() throws Exception;
}
