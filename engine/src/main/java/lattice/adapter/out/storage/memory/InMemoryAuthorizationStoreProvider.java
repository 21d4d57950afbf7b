package lattice.adapter.out.storage.memory;

import lattice.core.port.out.AuthorizationStore;
import lattice.spi.AuthorizationStoreProvider;

/**
 * In-memory storage provider for roles and permissions.
 *
 * <p>Provides non-persistent storage suitable for development, testing,
 * and deployments that seed their roles at startup.
 *
 * <p>Data is NOT persisted across application restarts.
 */
public class InMemoryAuthorizationStoreProvider implements AuthorizationStoreProvider {

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String description() {
        return "In-memory role and permission storage (non-persistent)";
    }

    @Override
    public int priority() {
        return 0; // Lowest priority, used as fallback
    }

    @Override
    public AuthorizationStore createStore() {
        return new InMemoryAuthorizationStore();
    }
}
