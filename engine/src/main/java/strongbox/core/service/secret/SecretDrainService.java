package strongbox.core.service.secret;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strongbox.core.model.error.SecretRevisionNotFoundException;
import strongbox.core.model.secret.SecretContent;
import strongbox.core.model.secret.SecretMetadataForDrain;
import strongbox.core.model.secret.SecretUri;
import strongbox.core.model.secret.ValueRef;
import strongbox.core.model.store.Relations;
import strongbox.core.model.store.SecretRecord;
import strongbox.core.port.in.SecretDrain;
import strongbox.core.port.out.SecretStore;
import strongbox.core.port.out.StoreSession;

/**
 * Service supporting migration of revision content between backends.
 *
 * <p>Changing the backend of a revision swaps where its content lives. The
 * revision number, checksum and obsolescence state stay as they are.
 */
@ApplicationScoped
public class SecretDrainService implements SecretDrain {

    private static final Logger LOG = Logger.getLogger(SecretDrainService.class);

    private final SecretStore store;

    @Inject
    public SecretDrainService(SecretStore store) {
        this.store = store;
    }

    @Override
    public Uni<List<SecretMetadataForDrain>> listCharmSecretsToDrain(Set<String> appOwners, Set<String> unitOwners) {
        return store.read(session -> toDrain(session, secret -> SecretRows.ownedByAny(secret, appOwners, unitOwners)));
    }

    @Override
    public Uni<List<SecretMetadataForDrain>> listUserSecretsToDrain() {
        return store.read(session -> toDrain(session, SecretRecord::isUserSecret));
    }

    private static List<SecretMetadataForDrain> toDrain(StoreSession session, Predicate<SecretRecord> filter) {
        return session.relation(Relations.SECRETS).scan(filter).stream()
                .sorted(Comparator.comparing(SecretRecord::id))
                .map(secret -> new SecretMetadataForDrain(
                        SecretUri.of(secret.id()),
                        SecretRows.revisionsOf(session, secret.id()).stream()
                                .map(r -> new SecretMetadataForDrain.RevisionRef(r.revision(), r.valueRef()))
                                .toList()))
                .toList();
    }

    @Override
    public Uni<Void> changeSecretBackend(String revisionId, ValueRef valueRef, Map<String, String> data) {
        final SecretContent content;
        try {
            content = new SecretContent(data, valueRef);
        } catch (IllegalArgumentException e) {
            return Uni.createFrom().failure(e);
        }

        return store.inTransaction(session -> {
                    final var revisions = session.relation(Relations.REVISIONS);
                    final var revision = revisions.get(revisionId)
                            .orElseThrow(() -> SecretRevisionNotFoundException.forRevisionId(revisionId));
                    revisions.put(revision.withContent(content));
                    return null;
                })
                .replaceWithVoid()
                .invoke(() -> LOG.infof(
                        "Revision %s now stored %s",
                        revisionId,
                        content.isInline() ? "inline" : "in backend " + valueRef.backendId()));
    }
}
