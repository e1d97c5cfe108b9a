package vpnmanager.core.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

/**
 * Caffeine-backed local cache implementation with TTL support and jitter.
 *
 * <p>Each entry's TTL is varied by a jitter factor so that instances started
 * together do not all refetch provider metadata at the same moment.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class CaffeineLocalCache<K, V> implements LocalCache<K, V> {

    private static final double DEFAULT_JITTER_FACTOR = 0.1; // +/-10%

    private final Cache<K, V> cache;
    private final long baseTtlNanos;
    private final double jitterFactor;

    public CaffeineLocalCache(Duration ttl, long maxSize) {
        this(ttl, maxSize, DEFAULT_JITTER_FACTOR);
    }

    /**
     * @param ttl          the base time-to-live for cache entries
     * @param maxSize      the maximum number of entries in the cache
     * @param jitterFactor 0.0 to 0.5; 0 disables jitter
     */
    public CaffeineLocalCache(Duration ttl, long maxSize, double jitterFactor) {
        if (jitterFactor < 0.0 || jitterFactor > 0.5) {
            throw new IllegalArgumentException("Jitter factor must be between 0.0 and 0.5, got: " + jitterFactor);
        }
        this.baseTtlNanos = ttl.toNanos();
        this.jitterFactor = jitterFactor;

        if (jitterFactor == 0.0) {
            this.cache = Caffeine.newBuilder()
                    .expireAfterWrite(ttl)
                    .maximumSize(maxSize)
                    .build();
        } else {
            this.cache = Caffeine.newBuilder()
                    .expireAfter(new JitteredExpiry())
                    .maximumSize(maxSize)
                    .build();
        }
    }

    private class JitteredExpiry implements Expiry<K, V> {
        @Override
        public long expireAfterCreate(K key, V value, long currentTime) {
            return applyJitter();
        }

        @Override
        public long expireAfterUpdate(K key, V value, long currentTime, long currentDuration) {
            return applyJitter();
        }

        @Override
        public long expireAfterRead(K key, V value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    private long applyJitter() {
        final double jitter = (ThreadLocalRandom.current().nextDouble() * 2 - 1) * jitterFactor;
        return Math.max(1L, (long) (baseTtlNanos * (1 + jitter)));
    }

    @Override
    public Optional<V> get(K key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(K key, V value) {
        cache.put(key, value);
    }

    @Override
    public void invalidate(K key) {
        cache.invalidate(key);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public long estimatedSize() {
        return cache.estimatedSize();
    }
}
