package agentswarm.cloud;

import agentswarm.coordinator.model.Resource;

import java.util.List;

/**
 * Contract of the platform that creates and reclaims compute resources.
 * Calls never throw for platform failures; they return a {@link ProvisionResult} whose
 * failure kind tells retryable problems apart from fatal ones.
 * {@code stop} and {@code destroy} must be safe to repeat.
 */
public interface ResourceProvisioner extends AutoCloseable {

    /**
     * Create a resource. A name already in use yields a {@link ProvisionerFailure.Kind#CONFLICT} failure.
     */
    ProvisionResult<Resource> create(String name, ResourceConfig config);

    /**
     * List resources matching the filter.
     */
    ProvisionResult<List<Resource>> list(ResourceFilter filter);

    /**
     * Ask the platform to stop a resource.
     */
    ProvisionResult<Void> stop(String resourceId);

    /**
     * Destroy a resource, stopping it first if needed.
     */
    ProvisionResult<Void> destroy(String resourceId);

    @Override
    default void close() {
    }
}
