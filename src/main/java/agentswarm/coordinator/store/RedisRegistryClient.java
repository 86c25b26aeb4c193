package agentswarm.coordinator.store;

import agentswarm.coordinator.registry.RegistryClient;
import agentswarm.coordinator.registry.RegistryUnavailableException;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SetArgs;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Redis implementation of RegistryClient using a single multiplexed Lettuce connection.
 * The connection is thread-safe, so one client serves the reaper's parallel evaluations.
 */
public class RedisRegistryClient implements RegistryClient {

    private static final Logger log = LoggerFactory.getLogger(RedisRegistryClient.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisCommands<String, String> commands;

    public RedisRegistryClient(String redisUrl, Duration commandTimeout) {
        RedisURI uri = RedisURI.create(redisUrl);
        uri.setTimeout(commandTimeout);
        this.client = RedisClient.create(uri);
        try {
            this.connection = client.connect();
        } catch (RedisException e) {
            client.shutdown();
            throw new RegistryUnavailableException("connect", null, e);
        }
        this.commands = connection.sync();
        log.info("Redis registry connected: {}:{}", uri.getHost(), uri.getPort());
    }

    @Override
    public void setWithTtl(String key, String value, Duration ttl) {
        try {
            commands.psetex(key, ttl.toMillis(), value);
        } catch (RedisException e) {
            throw new RegistryUnavailableException("set", key, e);
        }
    }

    @Override
    public boolean setIfAbsentWithTtl(String key, String value, Duration ttl) {
        try {
            String reply = commands.set(key, value, SetArgs.Builder.nx().px(ttl.toMillis()));
            return "OK".equals(reply);
        } catch (RedisException e) {
            throw new RegistryUnavailableException("setIfAbsent", key, e);
        }
    }

    @Override
    public String get(String key) {
        try {
            return commands.get(key);
        } catch (RedisException e) {
            throw new RegistryUnavailableException("get", key, e);
        }
    }

    @Override
    public long delete(String... keys) {
        if (keys == null || keys.length == 0) {
            return 0;
        }
        try {
            Long deleted = commands.del(keys);
            return deleted == null ? 0 : deleted;
        } catch (RedisException e) {
            throw new RegistryUnavailableException("delete", String.join(",", keys), e);
        }
    }

    @Override
    public boolean ping() {
        try {
            return "PONG".equalsIgnoreCase(commands.ping());
        } catch (RedisException e) {
            log.warn("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } finally {
            client.shutdown();
            log.info("Redis registry closed");
        }
    }
}
