package agentswarm.coordinator.store;

import agentswarm.coordinator.registry.RegistryClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Opens a RegistryClient from a connection string.
 * {@code redis://} and {@code rediss://} select Redis, {@code jdbc:} selects the JDBC table store.
 */
public final class RegistryClients {

    private static final Duration REDIS_COMMAND_TIMEOUT = Duration.ofSeconds(5);

    private RegistryClients() {
    }

    public static RegistryClient open(String url, int poolSize, Clock clock) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("registry url is required");
        }
        if (url.startsWith("redis://") || url.startsWith("rediss://")) {
            return new RedisRegistryClient(url, REDIS_COMMAND_TIMEOUT);
        }
        if (url.startsWith("jdbc:")) {
            return new JdbcRegistryClient(new Database(url, poolSize), clock, true);
        }
        throw new IllegalArgumentException("Unsupported registry url scheme: " + url);
    }
}
