package agentswarm.coordinator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why the reaper reclaimed a resource. Evaluated in declaration order, first match wins.
 */
public enum KillReason {
    /** Terminal status record present */
    TASK_DONE("task_done"),
    /** No lease: crashed, hung before first heartbeat, or partitioned */
    HEARTBEAT_LOST("heartbeat_lost"),
    /** Lease is live but the run exceeded maxTurnTimeout */
    TIMEOUT("timeout");

    private final String wire;

    KillReason(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @Override
    public String toString() {
        return wire;
    }
}
