package io.liveprobe.core.health;

/**
 * Receives health transitions. Called on the heartbeat thread, once per
 * transition (not once per failed probe).
 */
public interface HeartbeatListener {

    /**
     * Connectivity degraded: the threshold of consecutive probe failures was
     * just reached.
     *
     * @param cause the exception of the failure that crossed the threshold
     */
    void onDegraded(HeartbeatState state, Throwable cause);

    /** First successful probe after a degradation. */
    void onRecovered(HeartbeatState state);

    HeartbeatListener NO_OP = new HeartbeatListener() {
        @Override
        public void onDegraded(HeartbeatState state, Throwable cause) {
        }

        @Override
        public void onRecovered(HeartbeatState state) {
        }
    };
}
