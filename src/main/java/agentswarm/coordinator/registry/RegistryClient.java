package agentswarm.coordinator.registry;

import java.time.Duration;

/**
 * Typed accessor over the shared key-value store with per-key TTL.
 * Every operation is atomic at the key level; there are no cross-key transactions.
 * Connectivity failures propagate as {@link RegistryUnavailableException}; callers decide the retry policy.
 */
public interface RegistryClient extends AutoCloseable {

    /**
     * Write a value, replacing any existing one and resetting its TTL.
     */
    void setWithTtl(String key, String value, Duration ttl);

    /**
     * Write a value only when the key holds no live value.
     *
     * @return true if this call wrote the value
     */
    boolean setIfAbsentWithTtl(String key, String value, Duration ttl);

    /**
     * Read a value.
     *
     * @return the value, or null if the key is absent or expired
     */
    String get(String key);

    /**
     * Delete keys. Unknown keys are ignored.
     *
     * @return number of keys that existed
     */
    long delete(String... keys);

    /**
     * Check connectivity without throwing.
     */
    boolean ping();

    @Override
    void close();
}
