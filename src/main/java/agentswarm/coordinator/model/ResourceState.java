package agentswarm.coordinator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * State of a compute resource as reported by the provisioner.
 */
public enum ResourceState {
    CREATED("created"),
    STARTING("starting"),
    STARTED("started"),
    STOPPING("stopping"),
    STOPPED("stopped"),
    DESTROYING("destroying"),
    DESTROYED("destroyed"),
    /** Any state this build does not know about */
    UNKNOWN("unknown");

    private final String wire;

    ResourceState(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    /** States the reaper inspects. */
    public boolean isLive() {
        return this == STARTED || this == STARTING;
    }

    /** True once the resource is on its way out or gone. */
    public boolean isTerminating() {
        return this == STOPPING || this == STOPPED || this == DESTROYING || this == DESTROYED;
    }

    @JsonCreator
    public static ResourceState fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (ResourceState s : values()) {
            if (s.wire.equalsIgnoreCase(value.trim())) {
                return s;
            }
        }
        return UNKNOWN;
    }
}
