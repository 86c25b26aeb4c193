package agentswarm.coordinator.config;

import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.time.Duration;

/**
 * Loads coordinator settings from an INI file.
 * Supports sections [REGISTRY], [SERVER], [TIMING], [PROVISIONER], [MACHINE]; all optional.
 * Durations are whole seconds unless the key ends in {@code _ms}.
 *
 * <pre>
 * [REGISTRY]
 * url = redis://redis.internal:6379
 *
 * [TIMING]
 * heartbeat_ttl = 30
 * heartbeat_interval = 10
 * reaper_interval = 30
 * max_turn_timeout = 600
 * poll_interval_ms = 500
 * poll_multiplier = 2.0
 * poll_max_interval_ms = 4000
 *
 * [PROVISIONER]
 * app_name = agent-swarm-workers
 * image = registry.fly.io/agent-swarm:latest
 * </pre>
 */
public final class IniLoader {

    private static final Logger log = LoggerFactory.getLogger(IniLoader.class);

    private IniLoader() {
    }

    /**
     * Apply every setting present in the file onto {@code config}.
     *
     * @throws IllegalArgumentException if the file cannot be read or holds a malformed value
     */
    public static CoordinatorConfig apply(File file, CoordinatorConfig config) {
        Ini ini;
        try {
            ini = new Ini(file);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read config file " + file + ": " + e.getMessage(), e);
        }

        Profile.Section registry = ini.get("REGISTRY");
        Profile.Section server = ini.get("SERVER");
        Profile.Section timing = ini.get("TIMING");
        Profile.Section provisioner = ini.get("PROVISIONER");
        Profile.Section machine = ini.get("MACHINE");

        // REGISTRY
        String url = opt(registry, "url");
        if (url != null) config.withRegistryUrl(url);
        String pool = opt(registry, "pool_size");
        if (pool != null) config.withDatabasePoolSize(integer(pool, "pool_size"));

        // SERVER
        String host = opt(server, "host");
        if (host != null) config.withServerHost(host);
        String port = opt(server, "port");
        if (port != null) config.withServerPort(integer(port, "port"));
        String apiKey = opt(server, "api_key");
        if (apiKey != null) config.withApiKey(apiKey);

        // TIMING
        Duration v;
        if ((v = seconds(timing, "heartbeat_ttl")) != null) config.withHeartbeatTtl(v);
        if ((v = seconds(timing, "heartbeat_interval")) != null) config.withHeartbeatInterval(v);
        if ((v = seconds(timing, "terminal_status_ttl")) != null) config.withTerminalStatusTtl(v);
        if ((v = seconds(timing, "reaper_interval")) != null) config.withReaperInterval(v);
        if ((v = seconds(timing, "max_turn_timeout")) != null) config.withMaxTurnTimeout(v);
        if ((v = seconds(timing, "mapping_grace")) != null) config.withMappingGrace(v);
        if ((v = seconds(timing, "stop_config_timeout")) != null) config.withStopConfigTimeout(v);
        if ((v = seconds(timing, "idle_stop_timeout")) != null) config.withIdleStopTimeout(v);
        String pollMs = opt(timing, "poll_interval_ms");
        String pollMaxMs = opt(timing, "poll_max_interval_ms");
        if (pollMs != null || pollMaxMs != null) {
            config.withPollInterval(
                    pollMs != null ? Duration.ofMillis(integer(pollMs, "poll_interval_ms")) : config.pollInterval(),
                    pollMaxMs != null ? Duration.ofMillis(integer(pollMaxMs, "poll_max_interval_ms")) : config.pollMaxInterval());
        }
        String pollMultiplier = opt(timing, "poll_multiplier");
        if (pollMultiplier != null) config.withPollMultiplier(decimal(pollMultiplier, "poll_multiplier"));
        String parallelism = opt(timing, "reaper_parallelism");
        if (parallelism != null) config.withReaperParallelism(integer(parallelism, "reaper_parallelism"));

        // PROVISIONER
        String baseUrl = opt(provisioner, "api_base_url");
        if (baseUrl != null) config.withFlyApiBaseUrl(baseUrl);
        String token = opt(provisioner, "api_token");
        if (token != null) config.withFlyApiToken(token);
        String app = opt(provisioner, "app_name");
        if (app != null) config.withFlyAppName(app);
        String image = opt(provisioner, "image");
        if (image != null) config.withFlyAgentImage(image);
        String destroy = opt(provisioner, "explicit_destroy");
        if (destroy != null) config.withExplicitDestroy(Boolean.parseBoolean(destroy));
        String prefix = opt(provisioner, "name_prefix");
        if (prefix != null) config.withResourceNamePrefix(prefix);

        // MACHINE
        if (machine != null) {
            config.withMachineGuest(
                    opt(machine, "cpu_kind", config.machineCpuKind()),
                    integer(opt(machine, "cpus", String.valueOf(config.machineCpus())), "cpus"),
                    integer(opt(machine, "memory_mb", String.valueOf(config.machineMemoryMb())), "memory_mb"));
        }

        log.info("Loaded config file {}", file);
        return config;
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key) {
        if (s == null) {
            return null;
        }
        String v = s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static String opt(Profile.Section s, String key, String def) {
        String v = opt(s, key);
        return v == null ? def : v;
    }

    private static Duration seconds(Profile.Section s, String key) {
        String v = opt(s, key);
        return v == null ? null : Duration.ofSeconds(integer(v, key));
    }

    private static double decimal(String value, String key) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number, got '" + value + "'", e);
        }
    }

    private static int integer(String value, String key) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + value + "'", e);
        }
    }
}
