package agentswarm.agent;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Worker-side settings, read from the environment the orchestrator passes to each resource.
 */
public final class AgentConfig {

    private String sessionId;
    private String resourceId = "local";
    private String registryUrl = "redis://localhost:6379";
    private Duration heartbeatInterval = Duration.ofSeconds(10);
    private Duration heartbeatTtl = Duration.ofSeconds(30);
    private Duration terminalStatusTtl = Duration.ofHours(1);
    private Instant startedAt;
    private String command;

    private AgentConfig() {
    }

    public static AgentConfig defaults() {
        return new AgentConfig();
    }

    public static AgentConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * @throws IllegalArgumentException if SESSION_ID is missing or a value is malformed
     */
    public static AgentConfig fromEnv(Map<String, String> env) {
        AgentConfig config = new AgentConfig();

        config.sessionId = text(env, "SESSION_ID");
        if (config.sessionId == null) {
            throw new IllegalArgumentException("SESSION_ID is required");
        }

        String machineId = text(env, "FLY_MACHINE_ID");
        if (machineId != null) {
            config.resourceId = machineId;
        }

        String registryUrl = text(env, "SWARM_REGISTRY_URL");
        if (registryUrl == null) {
            registryUrl = text(env, "REDIS_URL");
        }
        if (registryUrl != null) {
            config.registryUrl = registryUrl;
        }

        config.heartbeatInterval = seconds(env, "SWARM_HEARTBEAT_INTERVAL", config.heartbeatInterval);
        config.heartbeatTtl = seconds(env, "SWARM_HEARTBEAT_TTL", config.heartbeatTtl);
        config.terminalStatusTtl = seconds(env, "SWARM_TERMINAL_STATUS_TTL", config.terminalStatusTtl);

        // Set by the orchestrator at creation time, so boot time counts toward the turn budget
        String startedAt = text(env, "STARTED_AT");
        if (startedAt != null) {
            try {
                config.startedAt = Instant.parse(startedAt);
            } catch (java.time.format.DateTimeParseException e) {
                throw new IllegalArgumentException("STARTED_AT must be an ISO-8601 instant, got '" + startedAt + "'", e);
            }
        }

        config.command = text(env, "AGENT_COMMAND");
        return config;
    }

    private static String text(Map<String, String> env, String name) {
        String v = env.get(name);
        return v == null || v.isBlank() ? null : v.trim();
    }

    private static Duration seconds(Map<String, String> env, String name, Duration fallback) {
        String raw = text(env, name);
        if (raw == null) {
            return fallback;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a whole number of seconds, got '" + raw + "'", e);
        }
    }

    public String sessionId() {
        return sessionId;
    }

    public String resourceId() {
        return resourceId;
    }

    public String registryUrl() {
        return registryUrl;
    }

    public Duration heartbeatInterval() {
        return heartbeatInterval;
    }

    public Duration heartbeatTtl() {
        return heartbeatTtl;
    }

    public Duration terminalStatusTtl() {
        return terminalStatusTtl;
    }

    /** Null when the worker should use its own start time. */
    public Instant startedAt() {
        return startedAt;
    }

    public String command() {
        return command;
    }

    public AgentConfig withSessionId(String sessionId) {
        this.sessionId = sessionId;
        return this;
    }

    public AgentConfig withResourceId(String resourceId) {
        this.resourceId = resourceId;
        return this;
    }

    public AgentConfig withRegistryUrl(String registryUrl) {
        this.registryUrl = registryUrl;
        return this;
    }

    public AgentConfig withHeartbeat(Duration interval, Duration ttl) {
        this.heartbeatInterval = interval;
        this.heartbeatTtl = ttl;
        return this;
    }

    public AgentConfig withTerminalStatusTtl(Duration ttl) {
        this.terminalStatusTtl = ttl;
        return this;
    }

    public AgentConfig withCommand(String command) {
        this.command = command;
        return this;
    }

    @Override
    public String toString() {
        return "AgentConfig{sessionId='" + sessionId + "', resourceId='" + resourceId
                + "', heartbeatInterval=" + heartbeatInterval + ", heartbeatTtl=" + heartbeatTtl + '}';
    }
}
