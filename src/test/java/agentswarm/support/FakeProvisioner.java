package agentswarm.support;

import agentswarm.cloud.ProvisionResult;
import agentswarm.cloud.ProvisionerFailure;
import agentswarm.cloud.ResourceConfig;
import agentswarm.cloud.ResourceFilter;
import agentswarm.cloud.ResourceProvisioner;
import agentswarm.coordinator.model.Resource;
import agentswarm.coordinator.model.ResourceState;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory provisioner. Names are unique among resources that are not destroyed.
 */
public final class FakeProvisioner implements ResourceProvisioner {

    private final Map<String, Resource> resources = new LinkedHashMap<>();
    private final Map<String, ResourceConfig> configs = new LinkedHashMap<>();
    private final List<String> stopCalls = new ArrayList<>();
    private final List<String> destroyCalls = new ArrayList<>();
    private int nextId = 1;
    private int createCalls;
    private int listCalls;

    private boolean failStops;
    private boolean failLists;
    private ProvisionerFailure.Kind createFailure;

    @Override
    public synchronized ProvisionResult<Resource> create(String name, ResourceConfig config) {
        createCalls++;
        if (createFailure != null) {
            return ProvisionResult.failure(new ProvisionerFailure(createFailure, "create", name, 500, "injected"));
        }
        for (Resource r : resources.values()) {
            if (r.name().equals(name) && r.state() != ResourceState.DESTROYED) {
                return ProvisionResult.failure(new ProvisionerFailure(
                        ProvisionerFailure.Kind.CONFLICT, "create", name, 409, "name taken"));
            }
        }
        Resource resource = new Resource("res-" + nextId++, name, ResourceState.STARTED);
        resources.put(resource.id(), resource);
        configs.put(resource.id(), config);
        return ProvisionResult.success(resource);
    }

    @Override
    public synchronized ProvisionResult<List<Resource>> list(ResourceFilter filter) {
        listCalls++;
        if (failLists) {
            return ProvisionResult.failure(ProvisionerFailure.retryable("list", null, "injected"));
        }
        List<Resource> out = new ArrayList<>();
        for (Resource r : resources.values()) {
            if (filter.matches(r)) {
                out.add(r);
            }
        }
        return ProvisionResult.success(out);
    }

    @Override
    public synchronized ProvisionResult<Void> stop(String resourceId) {
        stopCalls.add(resourceId);
        if (failStops) {
            return ProvisionResult.failure(ProvisionerFailure.retryable("stop", resourceId, "injected"));
        }
        Resource r = resources.get(resourceId);
        if (r == null || r.state() == ResourceState.DESTROYED) {
            return ProvisionResult.failure(new ProvisionerFailure(
                    ProvisionerFailure.Kind.NOT_FOUND, "stop", resourceId, 404, "not found"));
        }
        resources.put(resourceId, r.withState(ResourceState.STOPPED));
        return ProvisionResult.done();
    }

    @Override
    public synchronized ProvisionResult<Void> destroy(String resourceId) {
        destroyCalls.add(resourceId);
        Resource r = resources.get(resourceId);
        if (r == null || r.state() == ResourceState.DESTROYED) {
            return ProvisionResult.failure(new ProvisionerFailure(
                    ProvisionerFailure.Kind.NOT_FOUND, "destroy", resourceId, 404, "not found"));
        }
        resources.put(resourceId, r.withState(ResourceState.DESTROYED));
        return ProvisionResult.done();
    }

    /** Seed a resource directly. */
    public synchronized Resource add(String id, String name, ResourceState state) {
        Resource resource = new Resource(id, name, state);
        resources.put(id, resource);
        return resource;
    }

    public synchronized Resource get(String id) {
        return resources.get(id);
    }

    public synchronized ResourceConfig configOf(String id) {
        return configs.get(id);
    }

    public synchronized long countNotDestroyed(String name) {
        return resources.values().stream()
                .filter(r -> r.name().equals(name) && r.state() != ResourceState.DESTROYED)
                .count();
    }

    public synchronized int createCalls() {
        return createCalls;
    }

    public synchronized int listCalls() {
        return listCalls;
    }

    public synchronized List<String> stopCalls() {
        return List.copyOf(stopCalls);
    }

    public synchronized List<String> destroyCalls() {
        return List.copyOf(destroyCalls);
    }

    public synchronized void failStops(boolean fail) {
        this.failStops = fail;
    }

    public synchronized void failLists(boolean fail) {
        this.failLists = fail;
    }

    public synchronized void failCreates(ProvisionerFailure.Kind kind) {
        this.createFailure = kind;
    }
}
