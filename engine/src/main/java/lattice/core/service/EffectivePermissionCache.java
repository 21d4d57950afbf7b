package lattice.core.service;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.github.benmanes.caffeine.cache.Ticker;
import org.jboss.logging.Logger;

import lattice.core.cache.CaffeineLocalCache;
import lattice.core.cache.LocalCache;
import lattice.core.cache.LocalCacheConfig;
import lattice.core.cache.NoOpLocalCache;
import lattice.core.model.EntityKey;
import lattice.core.util.Identifiers;

/**
 * Time-bounded memoization of effective permission sets, keyed by (workspace, role).
 *
 * <p>A cached set is served until its TTL elapses or it is invalidated. On a miss the
 * resolver is called without holding any cache lock, so two concurrent misses for the
 * same key may both resolve; the last one to finish wins. Failures are never cached.
 *
 * <p>Every invalidation advances an epoch. A miss that overlapped an invalidation
 * still returns its result to its own caller but does not leave it cached, since it
 * may have read the store before the change that caused the invalidation.
 *
 * <p>Invalidation is explicit. A change to a parent role or to a permission alters the
 * effective sets of every descendant role, and this cache does not track those
 * dependencies: callers editing shared ancestors should invalidate the workspace or
 * the whole cache rather than a single role.
 */
@ApplicationScoped
public class EffectivePermissionCache {

    private static final Logger LOG = Logger.getLogger(EffectivePermissionCache.class);
    private static final long DEFAULT_MAX_ENTRIES = 10_000;

    private final EffectivePermissionResolver resolver;
    private final LocalCache<EntityKey, Set<String>> cache;
    private final boolean enabled;
    private final AtomicLong invalidationEpoch = new AtomicLong();

    @Inject
    public EffectivePermissionCache(EffectivePermissionResolver resolver, LocalCacheConfig config) {
        this(resolver, createCache(config));
    }

    public EffectivePermissionCache(EffectivePermissionResolver resolver, LocalCache<EntityKey, Set<String>> cache) {
        this.resolver = resolver;
        this.cache = cache;
        this.enabled = !(cache instanceof NoOpLocalCache);
    }

    /**
     * Cache that always recomputes.
     */
    public static EffectivePermissionCache disabled(EffectivePermissionResolver resolver) {
        return new EffectivePermissionCache(resolver, NoOpLocalCache.instance());
    }

    /**
     * Cache with the given TTL and the system clock.
     */
    public static EffectivePermissionCache withTtl(EffectivePermissionResolver resolver, Duration ttl) {
        return withTtl(resolver, ttl, Ticker.systemTicker());
    }

    /**
     * Cache with the given TTL, aged by the given clock.
     */
    public static EffectivePermissionCache withTtl(EffectivePermissionResolver resolver, Duration ttl, Ticker ticker) {
        if (ttl.isZero()) {
            return disabled(resolver);
        }
        return new EffectivePermissionCache(resolver, new CaffeineLocalCache<>(ttl, DEFAULT_MAX_ENTRIES, 0.0, ticker));
    }

    private static LocalCache<EntityKey, Set<String>> createCache(LocalCacheConfig config) {
        if (!config.enabled() || config.ttl().isZero()) {
            LOG.info("Effective permission caching disabled");
            return NoOpLocalCache.instance();
        }
        LOG.infof(
                "Effective permission caching enabled (ttl=%s, maxEntries=%d, jitter=%.2f)",
                config.ttl(), config.maxEntries(), config.jitterFactor());
        return new CaffeineLocalCache<>(
                config.ttl(), config.maxEntries(), config.jitterFactor(), Ticker.systemTicker());
    }

    /**
     * Get the effective permission IDs of a role, resolving them on a miss.
     *
     * @throws lattice.core.model.InvalidArgumentException if either argument is blank
     * @throws lattice.core.model.EntityNotFoundException  if the role is missing
     */
    public Set<String> get(String workspaceId, String roleId) {
        final var key = EntityKey.of(workspaceId, roleId);

        final var cached = cache.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        final var epoch = invalidationEpoch.get();
        final var resolved = resolver.resolve(workspaceId, roleId);
        cache.put(key, resolved);
        // an invalidation after our put removes the entry itself; one before it is caught here
        if (invalidationEpoch.get() != epoch) {
            cache.invalidate(key);
            return resolved;
        }
        if (enabled) {
            LOG.debugf(
                    "Cached %d effective permissions for role %s in workspace %s", resolved.size(), roleId, workspaceId);
        }
        return resolved;
    }

    public void invalidate(String workspaceId, String roleId) {
        final var key = EntityKey.of(workspaceId, roleId);
        invalidationEpoch.incrementAndGet();
        cache.invalidate(key);
        if (enabled) {
            LOG.debugf("Invalidated cached permissions for role %s in workspace %s", roleId, workspaceId);
        }
    }

    public void invalidateWorkspace(String workspaceId) {
        Identifiers.requireNonBlank(workspaceId, "workspaceId");
        invalidationEpoch.incrementAndGet();
        cache.invalidateIf(key -> key.inWorkspace(workspaceId));
        if (enabled) {
            LOG.debugf("Invalidated cached permissions for workspace %s", workspaceId);
        }
    }

    public void invalidateAll() {
        invalidationEpoch.incrementAndGet();
        cache.invalidateAll();
        if (enabled) {
            LOG.debug("Invalidated all cached permissions");
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }
}
