package lattice.core.cache;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Cache that never holds anything, used when caching is disabled.
 *
 * <p>Every lookup misses, so callers always recompute and never see stale data,
 * while keeping the same code path as the caching configuration.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class NoOpLocalCache<K, V> implements LocalCache<K, V> {

    private static final NoOpLocalCache<?, ?> INSTANCE = new NoOpLocalCache<>();

    private NoOpLocalCache() {}

    @SuppressWarnings("unchecked")
    public static <K, V> NoOpLocalCache<K, V> instance() {
        return (NoOpLocalCache<K, V>) INSTANCE;
    }

    @Override
    public Optional<V> get(K key) {
        return Optional.empty();
    }

    @Override
    public void put(K key, V value) {}

    @Override
    public void invalidate(K key) {}

    @Override
    public void invalidateIf(Predicate<? super K> keyPredicate) {}

    @Override
    public void invalidateAll() {}

    @Override
    public long estimatedSize() {
        return 0;
    }
}
