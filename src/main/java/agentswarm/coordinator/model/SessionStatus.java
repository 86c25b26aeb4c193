package agentswarm.coordinator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Session lifecycle status.
 * pending -> running -> {done, error} -> destroyed
 */
public enum SessionStatus {
    /** Mapping written, worker has not reported yet */
    PENDING("pending"),
    /** Worker lease is live */
    RUNNING("running"),
    /** Worker finished successfully */
    DONE("done"),
    /** Worker reported a failure */
    ERROR("error"),
    /** Resource reclaimed and registry keys removed */
    DESTROYED("destroyed");

    private final String wire;

    SessionStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    /** Terminal worker outcomes (written once into the status record). */
    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }

    @JsonCreator
    public static SessionStatus fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("status is required");
        }
        for (SessionStatus s : values()) {
            if (s.wire.equalsIgnoreCase(value.trim())) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown session status: " + value);
    }
}
