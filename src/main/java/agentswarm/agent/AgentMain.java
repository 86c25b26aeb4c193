package agentswarm.agent;

import agentswarm.coordinator.registry.RegistryClient;
import agentswarm.coordinator.store.RegistryClients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Worker entry point. Reads {@link AgentConfig} from the environment and runs
 * {@code AGENT_COMMAND} under a lease.
 */
public final class AgentMain {

    private static final Logger log = LoggerFactory.getLogger(AgentMain.class);

    private AgentMain() {
    }

    public static void main(String[] args) {
        AgentConfig config = AgentConfig.fromEnv();
        String command = args.length > 0 ? String.join(" ", args) : config.command();
        if (command == null) {
            log.error("No task command: set AGENT_COMMAND or pass it as arguments");
            System.exit(64);
            return;
        }

        log.info("Starting worker: {}", config);
        LeaseReporter reporter = reporter(config, RegistryClients.open(config.registryUrl(), 2, Clock.systemUTC()));

        // SIGTERM from the reaper: stop renewing and let the keys be cleaned up by the control plane
        Runtime.getRuntime().addShutdownHook(new Thread(reporter::close, "lease-reporter-shutdown"));

        int exitCode = new AgentRunner(reporter).run(new CommandTask(command));
        System.exit(exitCode);
    }

    /** Build a reporter that owns {@code registry}. */
    static LeaseReporter reporter(AgentConfig config, RegistryClient registry) {
        return LeaseReporter.builder()
                .ownedRegistry(registry)
                .sessionId(config.sessionId())
                .resourceId(config.resourceId())
                .heartbeatInterval(config.heartbeatInterval())
                .heartbeatTtl(config.heartbeatTtl())
                .terminalStatusTtl(config.terminalStatusTtl())
                .startedAt(config.startedAt())
                .build();
    }
}
