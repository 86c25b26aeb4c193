package agentswarm.coordinator.config;

import java.time.Duration;
import java.util.Map;

/**
 * Configuration holder for the control plane (orchestrator, reaper, HTTP API).
 * All settings have sensible defaults; {@link #fromEnv()} overlays environment variables
 * and, when {@code SWARM_CONFIG} points at an INI file, that file first.
 */
public final class CoordinatorConfig {

    // Registry settings
    private String registryUrl = "redis://localhost:6379";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";
    private String apiKey = null; // If set, callers must provide X-Swarm-Key header

    // Lease settings
    private Duration heartbeatTtl = Duration.ofSeconds(30);
    private Duration heartbeatInterval = Duration.ofSeconds(10);
    private Duration terminalStatusTtl = Duration.ofHours(1);

    // Reaper settings
    private Duration reaperInterval = Duration.ofSeconds(30);
    private int reaperParallelism = 8;
    private boolean explicitDestroy = false;

    // Session settings
    private Duration maxTurnTimeout = Duration.ofSeconds(600);
    private Duration mappingGrace = Duration.ofSeconds(300);
    private Duration pollInterval = Duration.ofMillis(500);
    private double pollMultiplier = 2.0;
    private Duration pollMaxInterval = Duration.ofSeconds(4);
    private String resourceNamePrefix = "agent-session-";

    // Provisioner settings
    private String flyApiBaseUrl = "https://api.machines.dev/v1";
    private String flyApiToken = null;
    private String flyAppName = null;
    private String flyAgentImage = null;
    private Duration provisionerRequestTimeout = Duration.ofSeconds(30);
    private Duration stopConfigTimeout = Duration.ofSeconds(30);
    private Duration idleStopTimeout = Duration.ofMinutes(10);
    private String machineCpuKind = "shared";
    private int machineCpus = 1;
    private int machineMemoryMb = 1024;

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * Build a config from the given environment map.
     * An INI file named by {@code SWARM_CONFIG} is applied before the variables themselves.
     */
    public static CoordinatorConfig fromEnv(Map<String, String> env) {
        CoordinatorConfig config = new CoordinatorConfig();

        String iniPath = env.get("SWARM_CONFIG");
        if (iniPath != null && !iniPath.isBlank()) {
            IniLoader.apply(new java.io.File(iniPath.trim()), config);
        }

        String registryUrl = env.get("SWARM_REGISTRY_URL");
        if (registryUrl == null || registryUrl.isBlank()) {
            registryUrl = env.get("REDIS_URL");
        }
        if (registryUrl != null && !registryUrl.isBlank()) {
            config.registryUrl = registryUrl.trim();
        }

        String port = env.get("SWARM_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port.trim());
        }

        String apiKey = env.get("SWARM_API_KEY");
        if (apiKey != null && !apiKey.isBlank()) {
            config.apiKey = apiKey;
        }

        config.heartbeatTtl = seconds(env, "SWARM_HEARTBEAT_TTL", config.heartbeatTtl);
        config.heartbeatInterval = seconds(env, "SWARM_HEARTBEAT_INTERVAL", config.heartbeatInterval);
        config.reaperInterval = seconds(env, "SWARM_REAPER_INTERVAL", config.reaperInterval);
        config.maxTurnTimeout = seconds(env, "SWARM_MAX_TURN_TIMEOUT", config.maxTurnTimeout);
        config.stopConfigTimeout = seconds(env, "SWARM_STOP_CONFIG_TIMEOUT", config.stopConfigTimeout);
        config.idleStopTimeout = seconds(env, "SWARM_IDLE_STOP_TIMEOUT", config.idleStopTimeout);

        config.pollInterval = millis(env, "SWARM_POLL_INTERVAL_MS", config.pollInterval);
        config.pollMaxInterval = millis(env, "SWARM_POLL_MAX_INTERVAL_MS", config.pollMaxInterval);
        String multiplier = env.get("SWARM_POLL_MULTIPLIER");
        if (multiplier != null && !multiplier.isBlank()) {
            try {
                config.pollMultiplier = Double.parseDouble(multiplier.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("SWARM_POLL_MULTIPLIER must be a number, got '" + multiplier + "'", e);
            }
        }

        String explicitDestroy = env.get("SWARM_EXPLICIT_DESTROY");
        if (explicitDestroy != null && !explicitDestroy.isBlank()) {
            config.explicitDestroy = Boolean.parseBoolean(explicitDestroy.trim());
        }

        String token = env.get("FLY_API_TOKEN");
        if (token != null && !token.isBlank()) {
            config.flyApiToken = token.trim();
        }
        String app = env.get("FLY_APP_NAME");
        if (app != null && !app.isBlank()) {
            config.flyAppName = app.trim();
        }
        String image = env.get("FLY_AGENT_IMAGE");
        if (image != null && !image.isBlank()) {
            config.flyAgentImage = image.trim();
        }

        config.validate();
        return config;
    }

    private static Duration seconds(Map<String, String> env, String name, Duration fallback) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a whole number of seconds, got '" + raw + "'", e);
        }
    }

    private static Duration millis(Map<String, String> env, String name, Duration fallback) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Duration.ofMillis(Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a whole number of milliseconds, got '" + raw + "'", e);
        }
    }

    /**
     * Check cross-field constraints.
     *
     * @throws IllegalArgumentException if the lease TTL would not survive a single missed renewal
     */
    public CoordinatorConfig validate() {
        if (heartbeatTtl.compareTo(heartbeatInterval) <= 0) {
            throw new IllegalArgumentException("heartbeatTtl (" + heartbeatTtl
                    + ") must be greater than heartbeatInterval (" + heartbeatInterval + ")");
        }
        if (reaperParallelism <= 0) {
            throw new IllegalArgumentException("reaperParallelism must be positive");
        }
        if (maxTurnTimeout.isNegative() || maxTurnTimeout.isZero()) {
            throw new IllegalArgumentException("maxTurnTimeout must be positive");
        }
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        if (pollMultiplier < 1.0) {
            throw new IllegalArgumentException("pollMultiplier must be >= 1.0, got " + pollMultiplier);
        }
        return this;
    }

    // Getters
    public String registryUrl() {
        return registryUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public String apiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public Duration heartbeatTtl() {
        return heartbeatTtl;
    }

    public Duration heartbeatInterval() {
        return heartbeatInterval;
    }

    public Duration terminalStatusTtl() {
        return terminalStatusTtl;
    }

    public Duration reaperInterval() {
        return reaperInterval;
    }

    public int reaperParallelism() {
        return reaperParallelism;
    }

    public boolean explicitDestroy() {
        return explicitDestroy;
    }

    public Duration maxTurnTimeout() {
        return maxTurnTimeout;
    }

    public Duration mappingGrace() {
        return mappingGrace;
    }

    /** TTL of the session-to-resource mapping: max turn time plus grace. */
    public Duration mappingTtl() {
        return maxTurnTimeout.plus(mappingGrace);
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration pollMaxInterval() {
        return pollMaxInterval;
    }

    public double pollMultiplier() {
        return pollMultiplier;
    }

    public String resourceNamePrefix() {
        return resourceNamePrefix;
    }

    public String flyApiBaseUrl() {
        return flyApiBaseUrl;
    }

    public String flyApiToken() {
        return flyApiToken;
    }

    public String flyAppName() {
        return flyAppName;
    }

    public String flyAgentImage() {
        return flyAgentImage;
    }

    public Duration provisionerRequestTimeout() {
        return provisionerRequestTimeout;
    }

    public Duration stopConfigTimeout() {
        return stopConfigTimeout;
    }

    public Duration idleStopTimeout() {
        return idleStopTimeout;
    }

    public String machineCpuKind() {
        return machineCpuKind;
    }

    public int machineCpus() {
        return machineCpus;
    }

    public int machineMemoryMb() {
        return machineMemoryMb;
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withRegistryUrl(String url) {
        this.registryUrl = url;
        return this;
    }

    public CoordinatorConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public CoordinatorConfig withApiKey(String key) {
        this.apiKey = key;
        return this;
    }

    public CoordinatorConfig withHeartbeatTtl(Duration ttl) {
        this.heartbeatTtl = ttl;
        return this;
    }

    public CoordinatorConfig withHeartbeatInterval(Duration interval) {
        this.heartbeatInterval = interval;
        return this;
    }

    public CoordinatorConfig withTerminalStatusTtl(Duration ttl) {
        this.terminalStatusTtl = ttl;
        return this;
    }

    public CoordinatorConfig withReaperInterval(Duration interval) {
        this.reaperInterval = interval;
        return this;
    }

    public CoordinatorConfig withReaperParallelism(int parallelism) {
        this.reaperParallelism = parallelism;
        return this;
    }

    public CoordinatorConfig withExplicitDestroy(boolean explicitDestroy) {
        this.explicitDestroy = explicitDestroy;
        return this;
    }

    public CoordinatorConfig withMaxTurnTimeout(Duration timeout) {
        this.maxTurnTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withMappingGrace(Duration grace) {
        this.mappingGrace = grace;
        return this;
    }

    public CoordinatorConfig withPollInterval(Duration interval, Duration maxInterval) {
        this.pollInterval = interval;
        this.pollMaxInterval = maxInterval;
        return this;
    }

    public CoordinatorConfig withPollMultiplier(double multiplier) {
        this.pollMultiplier = multiplier;
        return this;
    }

    public CoordinatorConfig withResourceNamePrefix(String prefix) {
        this.resourceNamePrefix = prefix;
        return this;
    }

    public CoordinatorConfig withFlyApiBaseUrl(String baseUrl) {
        this.flyApiBaseUrl = baseUrl;
        return this;
    }

    public CoordinatorConfig withFlyApiToken(String token) {
        this.flyApiToken = token;
        return this;
    }

    public CoordinatorConfig withFlyAppName(String appName) {
        this.flyAppName = appName;
        return this;
    }

    public CoordinatorConfig withFlyAgentImage(String image) {
        this.flyAgentImage = image;
        return this;
    }

    public CoordinatorConfig withProvisionerRequestTimeout(Duration timeout) {
        this.provisionerRequestTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withStopConfigTimeout(Duration timeout) {
        this.stopConfigTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withIdleStopTimeout(Duration timeout) {
        this.idleStopTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withMachineGuest(String cpuKind, int cpus, int memoryMb) {
        this.machineCpuKind = cpuKind;
        this.machineCpus = cpus;
        this.machineMemoryMb = memoryMb;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "registryUrl='" + redact(registryUrl) + '\'' +
                ", serverPort=" + serverPort +
                ", heartbeatTtl=" + heartbeatTtl +
                ", heartbeatInterval=" + heartbeatInterval +
                ", reaperInterval=" + reaperInterval +
                ", maxTurnTimeout=" + maxTurnTimeout +
                ", poll=" + pollInterval + "x" + pollMultiplier + "<=" + pollMaxInterval +
                ", flyAppName='" + flyAppName + '\'' +
                ", flyTokenSet=" + (flyApiToken != null) +
                ", apiKeySet=" + hasApiKey() +
                '}';
    }

    /** Strip credentials from a connection URL before logging it. */
    static String redact(String url) {
        if (url == null) {
            return null;
        }
        int scheme = url.indexOf("://");
        int at = url.indexOf('@');
        if (scheme < 0 || at < scheme) {
            return url;
        }
        return url.substring(0, scheme + 3) + "***" + url.substring(at);
    }
}
