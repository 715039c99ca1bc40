package strongbox.core.service.secret;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strongbox.core.config.SecretsConfig;
import strongbox.core.port.in.SecretObsolescence;

/**
 * Periodically deletes obsolete revisions of user secrets with auto-prune enabled.
 */
@ApplicationScoped
public class UserSecretPruneJob {

    private static final Logger LOG = Logger.getLogger(UserSecretPruneJob.class);

    private final SecretObsolescence obsolescence;
    private final SecretsConfig config;

    @Inject
    public UserSecretPruneJob(SecretObsolescence obsolescence, SecretsConfig config) {
        this.obsolescence = obsolescence;
        this.config = config;
    }

    @Scheduled(
            every = "${strongbox.secrets.prune.interval:1h}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> prune() {
        if (!config.prune().enabled()) {
            return Uni.createFrom().voidItem();
        }

        LOG.debug("Pruning obsolete user secret revisions...");

        return obsolescence
                .deleteObsoleteUserSecretRevisions()
                .invoke(deleted -> LOG.debugf("Prune run removed %d revision(s)", deleted.size()))
                .replaceWithVoid()
                .onFailure()
                .invoke(e -> LOG.error("Pruning user secret revisions failed", e));
    }
}
