package lattice.spi;

import lattice.core.port.out.AuthorizationStore;

/**
 * Service Provider Interface for authorization store backends.
 *
 * <p>Implementations supply the storage of roles and permissions. Every
 * implementation must honor the error contract documented on
 * {@link lattice.core.port.out.RoleRepository}; a persistent backend reports its
 * own I/O failures as {@link lattice.core.model.StoreFailureException}.
 *
 * <p>Providers are discovered via ServiceLoader. Configure the preferred
 * provider with lattice.store.provider, or let the loader select the highest
 * priority available provider.
 *
 * <p>To implement a custom provider:
 * <ol>
 *   <li>Implement this interface</li>
 *   <li>Create a META-INF/services/lattice.spi.AuthorizationStoreProvider file</li>
 *   <li>Add the fully qualified class name to the file</li>
 * </ol>
 */
public interface AuthorizationStoreProvider {

    /**
     * Get the provider name.
     *
     * @return short name for configuration (e.g., "memory", "jdbc")
     */
    String name();

    /**
     * Get the provider description.
     *
     * @return human-readable description
     */
    String description();

    /**
     * Get the provider priority.
     *
     * <p>Higher priority providers are preferred when auto-selecting.
     * Memory provider should use 0, persistent providers should use higher values.
     *
     * @return priority value (higher = more preferred)
     */
    int priority();

    /**
     * Check if this provider is available.
     *
     * <p>Used to filter out providers whose dependencies are not available
     * (e.g., a database driver not on classpath).
     *
     * @return true if the provider can be used
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Create the store.
     *
     * <p>Providers that need settings read them from MicroProfile Config under
     * {@code lattice.store.<name>.*}.
     *
     * @return the store instance
     */
    AuthorizationStore createStore();
}
