package strongbox.adapter.out.topology;

import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import strongbox.core.config.SecretsConfig;
import strongbox.core.port.out.OwnerResolver;

/**
 * Produces the owner resolver for the configured model.
 */
@ApplicationScoped
public class ModelTopologyProducer {

    private static final Logger LOG = Logger.getLogger(ModelTopologyProducer.class);

    private final SecretsConfig config;

    @Inject
    public ModelTopologyProducer(SecretsConfig config) {
        this.config = config;
    }

    @Produces
    @ApplicationScoped
    public OwnerResolver ownerResolver() {
        final var modelUuid = config.modelUuid().orElseGet(() -> {
            final var generated = UUID.randomUUID().toString();
            LOG.warnf("No strongbox.secrets.model-uuid configured, using generated model UUID %s", generated);
            return generated;
        });
        return new InMemoryModelTopology(modelUuid);
    }
}
