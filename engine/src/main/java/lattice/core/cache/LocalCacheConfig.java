package lattice.core.cache;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the effective-permission cache.
 *
 * <p>Configuration prefix: {@code lattice.cache}
 *
 * <p>A cached effective-permission set may be stale for up to one TTL when roles or
 * permissions are changed directly on the store. Changes routed through the
 * query service invalidate affected entries immediately.
 *
 * <h2>Configuration Properties</h2>
 * <ul>
 *   <li>{@code lattice.cache.enabled} - Whether effective permissions are cached</li>
 *   <li>{@code lattice.cache.ttl} - TTL of a cached effective-permission set</li>
 *   <li>{@code lattice.cache.max-entries} - Maximum cached (workspace, role) entries</li>
 *   <li>{@code lattice.cache.jitter-factor} - TTL jitter factor (0.0-0.5)</li>
 * </ul>
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code LATTICE_CACHE_ENABLED} - e.g., "false" to always recompute</li>
 *   <li>{@code LATTICE_CACHE_TTL} - e.g., "PT30S" for 30 seconds</li>
 *   <li>{@code LATTICE_CACHE_MAX_ENTRIES} - e.g., "10000"</li>
 *   <li>{@code LATTICE_CACHE_JITTER_FACTOR} - e.g., "0.1" for ±10% jitter</li>
 * </ul>
 */
@ConfigMapping(prefix = "lattice.cache")
public interface LocalCacheConfig {

    /**
     * Whether effective permissions are cached at all.
     *
     * <p>Disable for callers that cannot tolerate any staleness.
     *
     * @return true to cache (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * TTL for a cached effective-permission set.
     *
     * <p>A zero TTL disables caching the same way {@link #enabled()} does.
     *
     * @return TTL duration (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration ttl();

    /**
     * Maximum number of cached (workspace, role) entries.
     *
     * @return maximum entries (default: 10000)
     */
    @WithDefault("10000")
    long maxEntries();

    /**
     * TTL jitter factor for cache entries.
     *
     * <p>Each entry's TTL is varied by ±(jitterFactor * 100)%.
     *
     * @return jitter factor between 0.0 and 0.5 (default: 0.0, no jitter)
     */
    @WithDefault("0.0")
    double jitterFactor();
}
