package io.liveprobe.core.health;

public enum HealthStatus {
    HEALTHY,
    DEGRADED
}
