package lattice.adapter.out.storage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import lattice.core.port.out.AuthorizationStore;
import lattice.spi.AuthorizationStoreProvider;
import lattice.spi.StorageProviderException;

/**
 * Discovers and loads authorization store providers via ServiceLoader.
 *
 * <p>Provider selection:
 * <ol>
 *   <li>If lattice.store.provider is set, use that provider</li>
 *   <li>Otherwise, select the highest priority available provider</li>
 * </ol>
 *
 * <p>Thread-safety: Uses synchronized methods for lazy provider initialization
 * to ensure thread-safe access from CDI producer methods.
 */
@ApplicationScoped
public class AuthorizationStoreProviderLoader {

    private static final Logger LOG = Logger.getLogger(AuthorizationStoreProviderLoader.class);

    private final Optional<String> configuredStorageProvider;
    private final Iterable<AuthorizationStoreProvider> discoveredProviders;

    private AuthorizationStoreProvider storageProvider;

    @Inject
    public AuthorizationStoreProviderLoader(
            @ConfigProperty(name = "lattice.store.provider") Optional<String> configuredStorageProvider) {
        this(configuredStorageProvider, ServiceLoader.load(AuthorizationStoreProvider.class));
    }

    AuthorizationStoreProviderLoader(
            Optional<String> configuredStorageProvider, Iterable<AuthorizationStoreProvider> discoveredProviders) {
        this.configuredStorageProvider = configuredStorageProvider;
        this.discoveredProviders = discoveredProviders;
    }

    @Produces
    @ApplicationScoped
    public AuthorizationStore authorizationStore() {
        final var provider = getStorageProvider();
        LOG.infof("Creating authorization store from provider: %s (%s)", provider.name(), provider.description());
        return provider.createStore();
    }

    synchronized AuthorizationStoreProvider getStorageProvider() {
        if (storageProvider != null) {
            return storageProvider;
        }

        final List<AuthorizationStoreProvider> providers = new ArrayList<>();
        discoveredProviders.forEach(providers::add);

        if (providers.isEmpty()) {
            throw new StorageProviderException(
                    "No authorization store providers found. Ensure a provider JAR is on the classpath.");
        }

        LOG.infof(
                "Found %d authorization store provider(s): %s",
                providers.size(),
                providers.stream().map(AuthorizationStoreProvider::name).toList());

        storageProvider = selectProvider(providers, configuredStorageProvider.orElse(null));

        return storageProvider;
    }

    private AuthorizationStoreProvider selectProvider(List<AuthorizationStoreProvider> providers, String configured) {
        if (configured != null && !configured.isBlank()) {
            return providers.stream()
                    .filter(p -> p.name().equals(configured))
                    .findFirst()
                    .orElseThrow(() -> new StorageProviderException("Configured authorization store provider not found: "
                            + configured + ". Available: "
                            + providers.stream().map(AuthorizationStoreProvider::name).toList()));
        }

        return providers.stream()
                .filter(AuthorizationStoreProvider::isAvailable)
                .max(Comparator.comparingInt(AuthorizationStoreProvider::priority))
                .orElseThrow(() -> new StorageProviderException("No available authorization store providers"));
    }
}
