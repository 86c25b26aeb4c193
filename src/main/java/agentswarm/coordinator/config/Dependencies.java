package agentswarm.coordinator.config;

import agentswarm.cloud.ResourceProvisioner;
import agentswarm.cloud.fly.FlyMachinesProvisioner;
import agentswarm.coordinator.api.v1.HealthController;
import agentswarm.coordinator.api.v1.SessionController;
import agentswarm.coordinator.registry.RegistryClient;
import agentswarm.coordinator.scheduler.Reaper;
import agentswarm.coordinator.server.RouterHandler;
import agentswarm.coordinator.service.SessionOrchestrator;
import agentswarm.coordinator.store.RegistryClients;
import agentswarm.coordinator.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all control-plane dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * deps.startReaper(); // start background sweeps
 * SessionOrchestrator sessions = deps.orchestrator();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final Clock clock;
    private final RegistryClient registry;
    private final ResourceProvisioner provisioner;
    private final SessionOrchestrator orchestrator;
    private final Reaper reaper;

    // Controllers
    private final HealthController healthController;
    private final SessionController sessionController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(CoordinatorConfig config, RegistryClient registry, ResourceProvisioner provisioner,
            Clock clock, Sleeper sleeper) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.registry = registry;
        this.provisioner = provisioner;

        // Services
        this.orchestrator = new SessionOrchestrator(registry, provisioner, config, clock, sleeper);
        this.reaper = new Reaper(registry, provisioner, config, clock);

        // Controllers (public API)
        this.healthController = new HealthController(orchestrator, reaper);
        this.sessionController = new SessionController(orchestrator, clock);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config: registry from its URL, Fly Machines provisioner.
     */
    public static Dependencies create(CoordinatorConfig config) {
        config.validate();
        Clock clock = Clock.systemUTC();
        RegistryClient registry = RegistryClients.open(config.registryUrl(), config.databasePoolSize(), clock);
        try {
            return new Dependencies(config, registry, FlyMachinesProvisioner.fromConfig(config), clock,
                    Sleeper.SYSTEM);
        } catch (RuntimeException e) {
            registry.close();
            throw e;
        }
    }

    /**
     * Create dependencies over an existing registry and provisioner; both are closed by {@link #close()}.
     */
    public static Dependencies create(CoordinatorConfig config, RegistryClient registry,
            ResourceProvisioner provisioner, Clock clock, Sleeper sleeper) {
        config.validate();
        return new Dependencies(config, registry, provisioner, clock, sleeper);
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public RegistryClient registry() {
        return registry;
    }

    public ResourceProvisioner provisioner() {
        return provisioner;
    }

    public SessionOrchestrator orchestrator() {
        return orchestrator;
    }

    public Reaper reaper() {
        return reaper;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(sessionController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Start the background reaper. Should be called after server startup.
     */
    public void startReaper() {
        reaper.start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop reaper first
        try {
            reaper.stop();
        } catch (Exception e) {
            log.warn("Error stopping reaper: {}", e.getMessage());
        }

        try {
            provisioner.close();
        } catch (Exception e) {
            log.warn("Error closing provisioner: {}", e.getMessage());
        }

        try {
            registry.close();
        } catch (Exception e) {
            log.warn("Error closing registry: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
