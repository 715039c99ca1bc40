package strongbox.core.service.secret;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strongbox.core.model.access.AccessScope;
import strongbox.core.model.access.AccessScopeKind;
import strongbox.core.model.access.Accessor;
import strongbox.core.model.access.GrantedSecret;
import strongbox.core.model.access.SecretGrant;
import strongbox.core.model.access.SecretRole;
import strongbox.core.model.error.InvalidSecretPermissionChangeException;
import strongbox.core.model.error.RelationNotFoundException;
import strongbox.core.model.secret.SecretUri;
import strongbox.core.model.store.GrantRecord;
import strongbox.core.model.store.Relations;
import strongbox.core.model.store.RevisionRecord;
import strongbox.core.model.store.SecretRecord;
import strongbox.core.port.in.SecretAccessManagement;
import strongbox.core.port.out.OwnerResolver;
import strongbox.core.port.out.SecretStore;
import strongbox.core.port.out.StoreSession;

/**
 * Service for secret grants and access resolution.
 *
 * <p>Grants are keyed by secret and subject. The scope of a grant bounds its
 * lifetime and may not change kind once granted.
 */
@ApplicationScoped
public class SecretAccessService implements SecretAccessManagement {

    private static final Logger LOG = Logger.getLogger(SecretAccessService.class);

    private final SecretStore store;
    private final OwnerResolver resolver;

    @Inject
    public SecretAccessService(SecretStore store, OwnerResolver resolver) {
        this.store = store;
        this.resolver = resolver;
    }

    @Override
    public Uni<Void> grantAccess(SecretUri uri, SecretGrant grant) {
        return store.inTransaction(session -> {
                    final var secret = SecretRows.requireSecret(session, uri);
                    requireSubject(grant.subject());
                    requireScope(grant.scope());

                    final var grants = session.relation(Relations.GRANTS);
                    final var key = new GrantRecord.Key(secret.id(), grant.subject());
                    final var existing = grants.get(key);
                    if (existing.isPresent() && existing.get().scope().kind() != grant.scope().kind()) {
                        throw new InvalidSecretPermissionChangeException("cannot change secret permission scope of "
                                + grant.subject().kind() + " " + grant.subject().id() + " on " + uri + " from "
                                + existing.get().scope().kind() + " to " + grant.scope().kind());
                    }
                    grants.put(new GrantRecord(secret.id(), grant.scope(), grant.subject(), grant.role()));
                    return null;
                })
                .replaceWithVoid()
                .invoke(() -> LOG.infof(
                        "Granted %s on %s to %s %s",
                        grant.role(),
                        uri,
                        grant.subject().kind(),
                        grant.subject().id()));
    }

    private void requireSubject(Accessor subject) {
        switch (subject.kind()) {
            case UNIT -> SecretRows.requireUnit(resolver, subject.id());
            case APPLICATION -> SecretRows.requireApplication(resolver, subject.id());
            case MODEL -> {
                // the model always exists
            }
        }
    }

    private void requireScope(AccessScope scope) {
        switch (scope.kind()) {
            case UNIT -> SecretRows.requireUnit(resolver, scope.id());
            case APPLICATION -> SecretRows.requireApplication(resolver, scope.id());
            case RELATION -> {
                if (!resolver.relationExists(scope.id())) {
                    throw new RelationNotFoundException(scope.id());
                }
            }
            case MODEL -> {
                // the model always exists
            }
        }
    }

    @Override
    public Uni<Void> revokeAccess(SecretUri uri, Accessor subject) {
        return store.inTransaction(session -> {
                    final var secret = SecretRows.requireSecret(session, uri);
                    return session.relation(Relations.GRANTS).delete(new GrantRecord.Key(secret.id(), subject));
                })
                .invoke(removed -> {
                    if (removed) {
                        LOG.infof("Revoked access on %s from %s %s", uri, subject.kind(), subject.id());
                    }
                })
                .replaceWithVoid();
    }

    @Override
    public Uni<SecretRole> getSecretAccess(SecretUri uri, Accessor accessor) {
        return store.read(session -> {
            final var secret = SecretRows.requireSecret(session, uri);
            return AccessResolver.resolve(session, resolver, secret.id(), accessor);
        });
    }

    @Override
    public Uni<Optional<String>> getSecretAccessRelationScope(SecretUri uri, Accessor subject) {
        return store.read(session -> {
            final var secret = SecretRows.requireSecret(session, uri);
            return session.relation(Relations.GRANTS)
                    .get(new GrantRecord.Key(secret.id(), subject))
                    .map(GrantRecord::scope)
                    .filter(scope -> scope.kind() == AccessScopeKind.RELATION)
                    .map(AccessScope::id);
        });
    }

    @Override
    public Uni<List<SecretGrant>> getSecretGrants(SecretUri uri, SecretRole role) {
        return store.read(session -> {
            final var secret = SecretRows.requireSecret(session, uri);
            return session.relation(Relations.GRANTS)
                    .scan(g -> g.secretId().equals(secret.id()) && g.role() == role)
                    .stream()
                    .map(SecretAccessService::toGrant)
                    .toList();
        });
    }

    @Override
    public Uni<Map<String, List<SecretGrant>>> allSecretGrants() {
        return store.read(session -> {
            final Map<String, List<SecretGrant>> result = new LinkedHashMap<>();
            for (GrantRecord grant : session.relation(Relations.GRANTS).all()) {
                result.computeIfAbsent(grant.secretId(), id -> new ArrayList<>()).add(toGrant(grant));
            }
            return result;
        });
    }

    @Override
    public Uni<List<GrantedSecret>> listGrantedSecretsForBackend(
            String backendId, Set<Accessor> accessors, SecretRole role) {
        return store.read(session -> {
            final List<GrantedSecret> result = new ArrayList<>();
            for (SecretRecord secret : session.relation(Relations.SECRETS).all()) {
                if (!anyAllowed(session, secret.id(), accessors, role)) {
                    continue;
                }
                for (RevisionRecord revision : SecretRows.revisionsOf(session, secret.id())) {
                    if (revision.valueRef() != null && revision.valueRef().backendId().equals(backendId)) {
                        result.add(new GrantedSecret(
                                SecretUri.of(secret.id()), revision.valueRef().revisionId()));
                    }
                }
            }
            result.sort(Comparator.comparing((GrantedSecret g) -> g.uri().id()).thenComparing(GrantedSecret::revisionId));
            return result;
        });
    }

    private boolean anyAllowed(StoreSession session, String secretId, Set<Accessor> accessors, SecretRole role) {
        for (Accessor accessor : accessors) {
            if (AccessResolver.resolve(session, resolver, secretId, accessor).allows(role)) {
                return true;
            }
        }
        return false;
    }

    private static SecretGrant toGrant(GrantRecord record) {
        return new SecretGrant(record.scope(), record.subject(), record.role());
    }
}
