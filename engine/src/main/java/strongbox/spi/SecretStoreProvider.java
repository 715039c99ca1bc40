package strongbox.spi;

import strongbox.core.port.out.SecretStore;

/**
 * Service Provider Interface for secret store implementations.
 *
 * <p>Providers are discovered via ServiceLoader. Configure the preferred
 * provider with {@code strongbox.secrets.storage.provider}, or let the loader
 * select the highest priority available provider.
 *
 * <p>To plug in a store:
 * <ol>
 *   <li>Implement this interface</li>
 *   <li>List the class in META-INF/services/strongbox.spi.SecretStoreProvider</li>
 * </ol>
 */
public interface SecretStoreProvider {

    /**
     * Short name used in configuration, e.g. "memory".
     */
    String name();

    String description();

    /**
     * Higher values are preferred when auto-selecting. The in-memory provider
     * uses 0.
     */
    int priority();

    /**
     * Whether the provider's dependencies are present.
     */
    default boolean isAvailable() {
        return true;
    }

    SecretStore createStore(StorageAdapterConfig config);
}
