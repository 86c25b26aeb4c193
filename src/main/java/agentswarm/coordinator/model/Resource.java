package agentswarm.coordinator.model;

import java.util.Objects;

/**
 * A compute instance owned by the provisioner. Its state is the ground truth for
 * "is this thing still running".
 */
public record Resource(String id, String name, ResourceState state) {

    public Resource {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(name, "name is required");
        state = state == null ? ResourceState.UNKNOWN : state;
    }

    public boolean isLive() {
        return state.isLive();
    }

    public Resource withState(ResourceState newState) {
        return new Resource(id, name, newState);
    }
}
