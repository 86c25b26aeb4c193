package agentswarm.cloud;

import agentswarm.coordinator.model.Resource;
import agentswarm.coordinator.model.ResourceState;

import java.util.EnumSet;
import java.util.Set;

/**
 * Selects resources by state and name. Empty states means any state; null name fields match any name.
 */
public record ResourceFilter(Set<ResourceState> states, String namePrefix, String exactName) {

    public ResourceFilter {
        states = states == null || states.isEmpty() ? Set.of() : Set.copyOf(states);
    }

    /** Resources in {@code started} or {@code starting}. */
    public static ResourceFilter live() {
        return new ResourceFilter(EnumSet.of(ResourceState.STARTED, ResourceState.STARTING), null, null);
    }

    public static ResourceFilter named(String name) {
        return new ResourceFilter(Set.of(), null, name);
    }

    public ResourceFilter withNamePrefix(String prefix) {
        return new ResourceFilter(states, prefix, exactName);
    }

    public boolean matches(Resource resource) {
        if (!states.isEmpty() && !states.contains(resource.state())) {
            return false;
        }
        if (namePrefix != null && !resource.name().startsWith(namePrefix)) {
            return false;
        }
        return exactName == null || exactName.equals(resource.name());
    }
}
