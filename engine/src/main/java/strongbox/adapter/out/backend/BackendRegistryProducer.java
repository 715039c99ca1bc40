package strongbox.adapter.out.backend;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import strongbox.core.service.backend.BackendRegistry;
import strongbox.spi.SecretBackendProvider;

/**
 * Builds the backend registry from the providers found via ServiceLoader.
 */
@ApplicationScoped
public class BackendRegistryProducer {

    private static final Logger LOG = Logger.getLogger(BackendRegistryProducer.class);

    @Produces
    @Singleton
    public BackendRegistry backendRegistry() {
        final List<SecretBackendProvider> providers = new ArrayList<>();
        ServiceLoader.load(SecretBackendProvider.class).forEach(providers::add);

        LOG.infof(
                "Found %d secret backend provider(s): %s",
                providers.size(),
                providers.stream().map(SecretBackendProvider::type).toList());
        return new BackendRegistry(providers);
    }
}
