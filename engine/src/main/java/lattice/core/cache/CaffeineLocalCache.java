package lattice.core.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

/**
 * Caffeine-backed local cache implementation with TTL support and optional jitter.
 *
 * <p>
 * An entry is served only while its age is below the TTL; after that it is
 * treated as absent and the caller recomputes it.
 *
 * <p>
 * <b>TTL Jitter:</b> In multi-instance deployments each entry's TTL can be varied
 * by a jitter factor so that instances do not all refresh at the same moment.
 * Jitter is off unless requested.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class CaffeineLocalCache<K, V> implements LocalCache<K, V> {

    private final Cache<K, V> cache;
    private final long baseTtlNanos;
    private final double jitterFactor;

    /**
     * Create a new Caffeine-backed cache without jitter.
     *
     * @param ttl     the time-to-live for cache entries
     * @param maxSize the maximum number of entries in the cache
     */
    public CaffeineLocalCache(Duration ttl, long maxSize) {
        this(ttl, maxSize, 0.0, Ticker.systemTicker());
    }

    /**
     * Create a new Caffeine-backed cache with configurable TTL jitter and clock.
     *
     * @param ttl          the base time-to-live for cache entries, must be positive
     * @param maxSize      the maximum number of entries in the cache
     * @param jitterFactor the jitter factor (0.0 to 0.5). A value of 0.1 means ±10% jitter.
     *                     Set to 0 to disable jitter.
     * @param ticker       time source used to age entries
     */
    public CaffeineLocalCache(Duration ttl, long maxSize, double jitterFactor, Ticker ticker) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive, got: " + ttl);
        }
        if (jitterFactor < 0.0 || jitterFactor > 0.5) {
            throw new IllegalArgumentException("Jitter factor must be between 0.0 and 0.5, got: " + jitterFactor);
        }
        this.baseTtlNanos = ttl.toNanos();
        this.jitterFactor = jitterFactor;

        final var builder = Caffeine.newBuilder().maximumSize(maxSize).ticker(ticker);
        if (jitterFactor == 0.0) {
            this.cache = builder.expireAfterWrite(ttl).build();
        } else {
            this.cache = builder.expireAfter(new JitteredExpiry()).build();
        }
    }

    /**
     * Expiry policy that adds random jitter to the TTL to prevent refresh storms.
     */
    private class JitteredExpiry implements Expiry<K, V> {
        @Override
        public long expireAfterCreate(K key, V value, long currentTime) {
            return applyJitter(baseTtlNanos);
        }

        @Override
        public long expireAfterUpdate(K key, V value, long currentTime, long currentDuration) {
            return applyJitter(baseTtlNanos);
        }

        @Override
        public long expireAfterRead(K key, V value, long currentTime, long currentDuration) {
            return currentDuration; // Don't change TTL on read
        }

        private long applyJitter(long baseTtl) {
            // multiply by a random value in [1-jitterFactor, 1+jitterFactor]
            final var jitter = ThreadLocalRandom.current().nextDouble() * 2 * jitterFactor;
            final var jitterMultiplier = 1.0 - jitterFactor + jitter;
            return (long) (baseTtl * jitterMultiplier);
        }
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
    public void invalidateIf(Predicate<? super K> keyPredicate) {
        cache.asMap().keySet().removeIf(keyPredicate);
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
