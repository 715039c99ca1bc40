package strongbox.core.service.secret;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strongbox.core.model.secret.SecretUri;
import strongbox.core.model.store.Relations;
import strongbox.core.model.store.RevisionRecord;
import strongbox.core.model.store.SecretRecord;
import strongbox.core.model.watch.WatchStatement;
import strongbox.core.port.in.SecretObsolescence;
import strongbox.core.port.out.SecretStore;
import strongbox.core.port.out.StoreSession;

/**
 * Service reporting obsolete revisions and pruning those of auto-pruned user secrets.
 */
@ApplicationScoped
public class SecretObsolescenceService implements SecretObsolescence {

    private static final Logger LOG = Logger.getLogger(SecretObsolescenceService.class);

    private final SecretStore store;

    @Inject
    public SecretObsolescenceService(SecretStore store) {
        this.store = store;
    }

    @Override
    public Uni<List<String>> getObsoleteUserSecretRevisionsReadyToPrune() {
        return store.read(session -> readyToPrune(session).stream()
                .map(r -> SecretUri.of(r.secretId()).revisionKey(r.revision()))
                .toList());
    }

    @Override
    public Uni<List<String>> deleteObsoleteUserSecretRevisions() {
        return store.inTransaction(session -> {
                    final List<String> deleted = new ArrayList<>();
                    for (RevisionRecord revision : readyToPrune(session)) {
                        session.relation(Relations.REVISIONS).delete(revision.revisionId());
                        session.relation(Relations.EXPIRIES).delete(revision.revisionId());
                        deleted.add(revision.revisionId());
                    }
                    return deleted;
                })
                .invoke(deleted -> {
                    if (!deleted.isEmpty()) {
                        LOG.infof("Pruned %d obsolete user secret revision(s)", deleted.size());
                    }
                });
    }

    private static List<RevisionRecord> readyToPrune(StoreSession session) {
        final var secrets = session.relation(Relations.SECRETS);
        return session.relation(Relations.REVISIONS).scan(RevisionRecord::pendingDelete).stream()
                .filter(r -> secrets.get(r.secretId())
                        .map(s -> s.isUserSecret() && s.autoPrune())
                        .orElse(false))
                .sorted(Comparator.comparing(RevisionRecord::secretId)
                        .thenComparingInt(RevisionRecord::revision))
                .toList();
    }

    @Override
    public WatchStatement initialWatchStatementForObsoleteRevision(Set<String> appOwners, Set<String> unitOwners) {
        return new WatchStatement(
                Relations.OBSOLETE_REVISIONS_NAMESPACE, () -> getRevisionIdsForObsolete(appOwners, unitOwners, Set.of()));
    }

    @Override
    public Uni<List<String>> getRevisionIdsForObsolete(
            Set<String> appOwners, Set<String> unitOwners, Set<String> revisionIds) {
        if (appOwners.isEmpty() && unitOwners.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }
        return store.read(session -> {
            final var secrets = session.relation(Relations.SECRETS);
            return session.relation(Relations.REVISIONS)
                    .scan(r -> r.obsolete() && (revisionIds.isEmpty() || revisionIds.contains(r.revisionId())))
                    .stream()
                    .filter(r -> secrets.get(r.secretId())
                            .map((SecretRecord s) -> SecretRows.ownedByAny(s, appOwners, unitOwners))
                            .orElse(false))
                    .map(r -> SecretUri.of(r.secretId()).revisionKey(r.revision()))
                    .sorted()
                    .toList();
        });
    }
}
