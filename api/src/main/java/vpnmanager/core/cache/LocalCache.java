package vpnmanager.core.cache;

import java.util.Optional;

/**
 * Local in-memory cache interface with TTL support.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public interface LocalCache<K, V> {

    /**
     * Gets a value from the cache.
     *
     * @param key the cache key
     * @return Optional containing the value if present and not expired
     */
    Optional<V> get(K key);

    /**
     * Puts a value into the cache. The value is evicted after the configured TTL.
     */
    void put(K key, V value);

    void invalidate(K key);

    void invalidateAll();

    long estimatedSize();
}
