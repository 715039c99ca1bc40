package strongbox.adapter.out.storage;

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

import strongbox.core.port.out.SecretStore;
import strongbox.spi.SecretStoreProvider;
import strongbox.spi.StorageAdapterConfig;
import strongbox.spi.StorageProviderException;

/**
 * Discovers and loads secret store providers via ServiceLoader.
 *
 * <p>Provider selection:
 * <ol>
 *   <li>If strongbox.secrets.storage.provider is set, use that provider</li>
 *   <li>Otherwise, select the highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class SecretStoreProviderLoader {

    private static final Logger LOG = Logger.getLogger(SecretStoreProviderLoader.class);

    private final Optional<String> configuredProvider;
    private final StorageAdapterConfig config;

    @Inject
    public SecretStoreProviderLoader(
            @ConfigProperty(name = "strongbox.secrets.storage.provider") Optional<String> configuredProvider,
            StorageAdapterConfig config) {
        this.configuredProvider = configuredProvider;
        this.config = config;
    }

    @Produces
    @ApplicationScoped
    public SecretStore secretStore() {
        final List<SecretStoreProvider> providers = new ArrayList<>();
        ServiceLoader.load(SecretStoreProvider.class).forEach(providers::add);

        final var provider = selectProvider(providers, configuredProvider.orElse(null));
        LOG.infof("Creating secret store from provider: %s (%s)", provider.name(), provider.description());
        return provider.createStore(config);
    }

    static SecretStoreProvider selectProvider(List<SecretStoreProvider> providers, String configured) {
        if (providers.isEmpty()) {
            throw new StorageProviderException(
                    "No secret store providers found. Ensure a provider JAR is on the classpath.");
        }

        LOG.infof(
                "Found %d secret store provider(s): %s",
                providers.size(),
                providers.stream().map(SecretStoreProvider::name).toList());

        if (configured != null && !configured.isBlank()) {
            return providers.stream()
                    .filter(p -> p.name().equals(configured))
                    .findFirst()
                    .orElseThrow(() -> new StorageProviderException("Configured secret store provider not found: "
                            + configured + ". Available: "
                            + providers.stream().map(SecretStoreProvider::name).toList()));
        }

        return providers.stream()
                .filter(SecretStoreProvider::isAvailable)
                .max(Comparator.comparingInt(SecretStoreProvider::priority))
                .orElseThrow(() -> new StorageProviderException("No available secret store providers"));
    }
}
