package agentswarm.coordinator.service;

import agentswarm.cloud.ProvisionResult;
import agentswarm.cloud.ProvisionerException;
import agentswarm.cloud.ProvisionerFailure;
import agentswarm.cloud.ResourceConfig;
import agentswarm.cloud.ResourceFilter;
import agentswarm.cloud.ResourceProvisioner;
import agentswarm.coordinator.config.CoordinatorConfig;
import agentswarm.coordinator.model.Lease;
import agentswarm.coordinator.model.Resource;
import agentswarm.coordinator.model.ResourceState;
import agentswarm.coordinator.model.SessionIds;
import agentswarm.coordinator.model.SessionInfo;
import agentswarm.coordinator.model.SessionMapping;
import agentswarm.coordinator.model.SessionStatus;
import agentswarm.coordinator.model.StatusRecord;
import agentswarm.coordinator.registry.RegistryClient;
import agentswarm.coordinator.registry.RegistryCodec;
import agentswarm.coordinator.registry.RegistryKeys;
import agentswarm.coordinator.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Maps logical sessions onto worker resources.
 *
 * At most one resource exists per session: the resource name is derived from the session id,
 * so concurrent creators collide on the platform, and the mapping is written with set-if-absent,
 * so they all converge on the same record.
 */
public class SessionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SessionOrchestrator.class);

    private final RegistryClient registry;
    private final ResourceProvisioner provisioner;
    private final CoordinatorConfig config;
    private final Clock clock;
    private final Sleeper sleeper;
    private final PollPolicy pollPolicy;

    public SessionOrchestrator(RegistryClient registry, ResourceProvisioner provisioner, CoordinatorConfig config,
            Clock clock, Sleeper sleeper) {
        this.registry = registry;
        this.provisioner = provisioner;
        this.config = config;
        this.clock = clock;
        this.sleeper = sleeper;
        this.pollPolicy = new PollPolicy(config.pollInterval(), config.pollMultiplier(), config.pollMaxInterval());
    }

    /**
     * Return the session's mapping, creating its resource first if the session is new.
     *
     * @throws IllegalArgumentException    if the session id is malformed
     * @throws ProvisionerException        if the resource could not be created
     */
    public SessionMapping getOrCreateSession(String sessionId, SessionRequest request) {
        SessionIds.requireValid(sessionId);

        Optional<SessionMapping> existing = readMapping(sessionId);
        if (existing.isPresent()) {
            log.debug("Session {} already mapped to resource {}", sessionId, existing.get().resourceId());
            return existing.get();
        }

        Instant now = clock.instant();
        String name = SessionIds.resourceName(config.resourceNamePrefix(), sessionId);
        Resource resource = createOrAdopt(name, resourceConfig(sessionId, request, now));

        SessionMapping mapping = new SessionMapping(sessionId, resource.id(), now);
        String key = RegistryKeys.mapping(sessionId);
        if (registry.setIfAbsentWithTtl(key, RegistryCodec.encode(mapping), config.mappingTtl())) {
            log.info("Session {} mapped to resource {}", sessionId, resource.id());
            return mapping;
        }

        Optional<SessionMapping> winner = readMapping(sessionId);
        if (winner.isPresent()) {
            if (!winner.get().resourceId().equals(resource.id())) {
                log.warn("Session {} mapped to resource {} by a concurrent request, not {}", sessionId,
                        winner.get().resourceId(), resource.id());
            }
            return winner.get();
        }

        // Mapping vanished or was unreadable between the two calls
        registry.setWithTtl(key, RegistryCodec.encode(mapping), config.mappingTtl());
        log.info("Session {} mapped to resource {}", sessionId, resource.id());
        return mapping;
    }

    /**
     * Current view of a session from its registry keys.
     *
     * @throws SessionNotFoundException if none of the session's keys exist
     */
    public SessionInfo getSessionStatus(String sessionId) {
        SessionIds.requireValid(sessionId);

        Optional<SessionMapping> mapping = readMapping(sessionId);
        String resourceId = mapping.map(SessionMapping::resourceId).orElse(null);
        Instant createdAt = mapping.map(SessionMapping::createdAt).orElse(null);

        Optional<StatusRecord> status = readStatus(sessionId);
        if (status.isPresent()) {
            return new SessionInfo(sessionId, resourceId, status.get().status(), createdAt, status.get().message());
        }

        String rawLease = registry.get(RegistryKeys.heartbeat(sessionId));
        if (rawLease != null) {
            if (resourceId == null) {
                try {
                    Lease lease = RegistryCodec.decodeLease(rawLease);
                    resourceId = lease.resourceId();
                } catch (IllegalArgumentException e) {
                    log.debug("Unreadable lease for session {}: {}", sessionId, e.getMessage());
                }
            }
            return new SessionInfo(sessionId, resourceId, SessionStatus.RUNNING, createdAt, null);
        }

        if (mapping.isPresent()) {
            return new SessionInfo(sessionId, resourceId, SessionStatus.PENDING, createdAt, null);
        }
        throw new SessionNotFoundException(sessionId);
    }

    /**
     * Block until the session writes its terminal status.
     *
     * @throws SessionTimeoutException if no terminal status appears before {@code timeout}
     * @throws InterruptedException    if the waiting thread is interrupted
     */
    public StatusRecord waitForSession(String sessionId, Duration timeout) throws InterruptedException {
        SessionIds.requireValid(sessionId);
        Instant deadline = clock.instant().plus(timeout);
        Duration interval = pollPolicy.initial();

        while (true) {
            if (Thread.interrupted()) {
                throw new InterruptedException("Interrupted waiting for session " + sessionId);
            }

            Optional<StatusRecord> status = readStatus(sessionId);
            if (status.isPresent()) {
                log.debug("Session {} finished: {}", sessionId, status.get().status().wire());
                return status.get();
            }

            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                throw new SessionTimeoutException(sessionId, timeout);
            }
            sleeper.sleep(interval.compareTo(remaining) < 0 ? interval : remaining);
            interval = pollPolicy.next(interval);
        }
    }

    /**
     * Destroy the session's resource and remove its registry keys.
     *
     * @return false if there was nothing to destroy
     * @throws ProvisionerException if the platform refused the destroy; registry keys are removed anyway
     */
    public boolean destroySession(String sessionId) {
        SessionIds.requireValid(sessionId);

        String resourceId = readMapping(sessionId)
                .map(SessionMapping::resourceId)
                .orElseGet(() -> findByName(sessionId));

        if (resourceId == null) {
            long deleted = registry.delete(RegistryKeys.all(sessionId));
            if (deleted > 0) {
                log.info("Session {} had no resource, removed {} registry keys", sessionId, deleted);
            }
            return deleted > 0;
        }

        ProvisionResult<Void> destroyed = provisioner.destroy(resourceId);
        long deleted = registry.delete(RegistryKeys.all(sessionId));

        if (!destroyed.isSuccessOrGone()) {
            log.warn("Destroy failed for session {} resource {}: {}", sessionId, resourceId, destroyed.failure());
            throw new ProvisionerException(destroyed.failure());
        }
        boolean didSomething = destroyed.isSuccess() || deleted > 0;
        if (didSomething) {
            log.info("Session {} destroyed (resource {})", sessionId, resourceId);
        }
        return didSomething;
    }

    public boolean isRegistryHealthy() {
        return registry.ping();
    }

    private Resource createOrAdopt(String name, ResourceConfig resourceConfig) {
        ProvisionResult<Resource> created = provisioner.create(name, resourceConfig);
        if (created.isSuccess()) {
            log.info("Created resource {} ({})", created.value().id(), name);
            return created.value();
        }

        ProvisionerFailure failure = created.failure();
        if (failure.kind() != ProvisionerFailure.Kind.CONFLICT) {
            log.error("Failed to create resource {}: {}", name, failure);
            throw new ProvisionerException(failure);
        }

        // Another request created it first
        ProvisionResult<List<Resource>> found = provisioner.list(ResourceFilter.named(name));
        if (found.isSuccess()) {
            for (Resource resource : found.value()) {
                if (!resource.state().isTerminating()) {
                    log.info("Adopted existing resource {} ({})", resource.id(), name);
                    return resource;
                }
            }
        }
        log.error("Resource name {} is taken but no usable resource holds it", name);
        throw new ProvisionerException(failure);
    }

    private String findByName(String sessionId) {
        String name = SessionIds.resourceName(config.resourceNamePrefix(), sessionId);
        ProvisionResult<List<Resource>> found = provisioner.list(ResourceFilter.named(name));
        if (!found.isSuccess()) {
            throw new ProvisionerException(found.failure());
        }
        return found.value().stream()
                .filter(r -> r.state() != ResourceState.DESTROYED)
                .map(Resource::id)
                .findFirst()
                .orElse(null);
    }

    private ResourceConfig resourceConfig(String sessionId, SessionRequest request, Instant now) {
        if (config.flyAgentImage() == null || config.flyAgentImage().isBlank()) {
            throw new IllegalStateException("Worker image is not configured (FLY_AGENT_IMAGE)");
        }
        return ResourceConfig.builder()
                .image(config.flyAgentImage())
                .autoDestroy(true)
                .stopTimeout(config.stopConfigTimeout())
                .idleStopTimeout(config.idleStopTimeout())
                .guest(config.machineCpuKind(), config.machineCpus(), config.machineMemoryMb())
                .env(request.env())
                .env("SESSION_ID", sessionId)
                .env("AGENT_PROMPT", request.prompt())
                .env("SWARM_REGISTRY_URL", config.registryUrl())
                .env("SWARM_HEARTBEAT_INTERVAL", String.valueOf(config.heartbeatInterval().toSeconds()))
                .env("SWARM_HEARTBEAT_TTL", String.valueOf(config.heartbeatTtl().toSeconds()))
                .env("STARTED_AT", now.toString())
                .build();
    }

    private Optional<SessionMapping> readMapping(String sessionId) {
        String raw = registry.get(RegistryKeys.mapping(sessionId));
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(RegistryCodec.decodeMapping(raw));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unreadable mapping for session {}: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<StatusRecord> readStatus(String sessionId) {
        String raw = registry.get(RegistryKeys.status(sessionId));
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(RegistryCodec.decodeStatus(raw));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unreadable status for session {}: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }
}
