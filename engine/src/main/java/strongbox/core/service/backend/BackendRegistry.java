package strongbox.core.service.backend;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.jboss.logging.Logger;

import strongbox.core.model.backend.SecretBackend;
import strongbox.core.port.out.SecretBackendAdapter;
import strongbox.spi.SecretBackendProvider;
import strongbox.spi.StorageProviderException;

/**
 * Registry of secret backend providers, keyed by backend type.
 *
 * <p>Built once at start-up and passed to the components that need live
 * backend adapters. Adapters are opened lazily and cached per backend ID
 * until {@link #evict(String)} is called for it.
 */
public class BackendRegistry {

    private static final Logger LOG = Logger.getLogger(BackendRegistry.class);

    private final Map<String, SecretBackendProvider> providers = new ConcurrentHashMap<>();
    private final Map<String, SecretBackendAdapter> adapters = new ConcurrentHashMap<>();

    public BackendRegistry(List<SecretBackendProvider> providers) {
        providers.forEach(this::register);
    }

    /**
     * Register a provider, replacing any provider of the same type.
     */
    public void register(SecretBackendProvider provider) {
        final var previous = providers.put(provider.type(), provider);
        if (previous != null && previous != provider) {
            LOG.warnf("Secret backend provider for type %s replaced by %s", provider.type(), provider.getClass().getName());
        }
        LOG.debugf("Registered secret backend provider for type %s", provider.type());
    }

    public boolean supports(String backendType) {
        return providers.containsKey(backendType);
    }

    public Set<String> types() {
        return Set.copyOf(providers.keySet());
    }

    /**
     * Live adapter for a backend.
     *
     * @throws StorageProviderException if no provider serves the backend's type
     */
    public SecretBackendAdapter adapterFor(SecretBackend backend) {
        return adapters.computeIfAbsent(backend.id(), id -> {
            final var provider = providers.get(backend.backendType());
            if (provider == null) {
                throw new StorageProviderException("No secret backend provider for type "
                        + backend.backendType() + ". Available: " + types());
            }
            LOG.infof("Opening secret backend %s (%s)", backend.name(), backend.backendType());
            return provider.open(backend);
        });
    }

    /**
     * Drop the cached adapter of a backend, e.g. after its config changed.
     */
    public void evict(String backendId) {
        adapters.remove(backendId);
    }
}
