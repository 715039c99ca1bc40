package strongbox.spi;

import strongbox.core.model.backend.SecretBackend;
import strongbox.core.port.out.SecretBackendAdapter;

/**
 * Service Provider Interface for secret content backends (Vault, Kubernetes, ...).
 *
 * <p>One provider serves every backend of its {@link #type()}. Providers are
 * discovered via ServiceLoader from
 * META-INF/services/strongbox.spi.SecretBackendProvider and registered with
 * the backend registry at start-up.
 */
public interface SecretBackendProvider {

    /**
     * Backend type this provider serves, matched against
     * {@link SecretBackend#backendType()}.
     */
    String type();

    /**
     * Open an adapter for a configured backend.
     *
     * @throws StorageProviderException if the backend cannot be reached or is misconfigured
     */
    SecretBackendAdapter open(SecretBackend backend);
}
