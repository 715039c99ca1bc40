package strongbox.core.service.secret;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strongbox.core.model.access.AccessScope;
import strongbox.core.model.access.AccessScopeKind;
import strongbox.core.model.access.Accessor;
import strongbox.core.model.access.AccessorKind;
import strongbox.core.model.access.SecretRole;
import strongbox.core.model.error.AutoPruneNotSupportedException;
import strongbox.core.model.error.SecretAccessDeniedException;
import strongbox.core.model.error.SecretNotFoundException;
import strongbox.core.model.secret.Owner;
import strongbox.core.model.secret.RotatePolicy;
import strongbox.core.model.secret.RotationExpiryInfo;
import strongbox.core.model.secret.SecretContent;
import strongbox.core.model.secret.SecretMetadata;
import strongbox.core.model.secret.SecretUri;
import strongbox.core.model.secret.SecretWithRevisions;
import strongbox.core.model.secret.UpsertSecretParams;
import strongbox.core.model.store.ExpiryRecord;
import strongbox.core.model.store.GrantRecord;
import strongbox.core.model.store.Relations;
import strongbox.core.model.store.RevisionRecord;
import strongbox.core.model.store.RotationRecord;
import strongbox.core.model.store.SecretRecord;
import strongbox.core.model.store.SecretReferenceRecord;
import strongbox.core.port.in.SecretManagement;
import strongbox.core.port.out.OwnerResolver;
import strongbox.core.port.out.SecretStore;
import strongbox.core.port.out.StoreSession;

/**
 * Service for the secret and revision lifecycle.
 *
 * <p>Each operation is one unit of work. Content updates allocate the next
 * revision number and re-evaluate the previous latest revision for
 * obsolescence in the same unit.
 */
@ApplicationScoped
public class SecretService implements SecretManagement {

    private static final Logger LOG = Logger.getLogger(SecretService.class);

    private final SecretStore store;
    private final OwnerResolver resolver;

    @Inject
    public SecretService(SecretStore store, OwnerResolver resolver) {
        this.store = store;
        this.resolver = resolver;
    }

    @Override
    public Uni<SecretUri> createSecret(SecretUri uri, Owner owner, int version, UpsertSecretParams params) {
        if (params.revisionId() == null || params.revisionId().isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("revision ID must be provided"));
        }
        if (!params.hasContent()) {
            return Uni.createFrom().failure(new IllegalArgumentException("secret content must be provided"));
        }
        final var secretUri = uri != null ? uri : SecretUri.newUri();
        if (!owner.isModel() && Boolean.TRUE.equals(params.autoPrune())) {
            return Uni.createFrom().failure(new AutoPruneNotSupportedException(secretUri));
        }

        return store.inTransaction(session -> {
                    insertSecret(session, secretUri, owner, version, params);
                    return secretUri;
                })
                .invoke(created -> LOG.infof("Created secret %s owned by %s %s", created, owner.kind(), owner.id()));
    }

    private void insertSecret(
            StoreSession session, SecretUri uri, Owner owner, int version, UpsertSecretParams params) {
        switch (owner.kind()) {
            case APPLICATION -> SecretRows.requireApplication(resolver, owner.id());
            case UNIT -> SecretRows.requireUnit(resolver, owner.id());
            case MODEL -> {
                // user secret, owned by the model itself
            }
        }
        final var secrets = session.relation(Relations.SECRETS);
        if (secrets.get(uri.id()).isPresent()) {
            throw new IllegalArgumentException("secret " + uri + " already exists");
        }
        final var revisions = session.relation(Relations.REVISIONS);
        if (revisions.get(params.revisionId()).isPresent()) {
            throw new IllegalArgumentException("revision ID " + params.revisionId() + " already in use");
        }
        SecretLabels.ensureAvailable(session, resolver, owner.kind(), owner.id(), params.label(), null);

        final var now = Instant.now();
        final var policy = params.rotatePolicy() != null ? params.rotatePolicy() : RotatePolicy.NEVER;
        secrets.put(new SecretRecord(
                uri.id(),
                version,
                owner.kind(),
                owner.id(),
                params.label(),
                params.description(),
                Boolean.TRUE.equals(params.autoPrune()),
                policy,
                now,
                now));

        final var content = params.content();
        revisions.put(new RevisionRecord(
                params.revisionId(),
                uri.id(),
                1,
                content.data(),
                content.valueRef(),
                params.effectiveChecksum(),
                now,
                false,
                false));
        if (params.expireTime() != null) {
            session.relation(Relations.EXPIRIES)
                    .put(new ExpiryRecord(params.revisionId(), uri.id(), params.expireTime()));
        }
        scheduleRotation(session, uri.id(), policy, params.nextRotateTime(), now, false);

        final var subject = new Accessor(accessorKindOf(owner), owner.id());
        session.relation(Relations.GRANTS)
                .put(new GrantRecord(
                        uri.id(), new AccessScope(scopeKindOf(owner), owner.id()), subject, SecretRole.MANAGE));
    }

    @Override
    public Uni<Void> updateSecret(SecretUri uri, UpsertSecretParams params) {
        if (!params.hasContent() && !params.hasMetadata()) {
            return Uni.createFrom()
                    .failure(new IllegalArgumentException("must specify a new value or metadata to update a secret"));
        }
        if (params.hasContent() && (params.revisionId() == null || params.revisionId().isBlank())) {
            return Uni.createFrom().failure(new IllegalArgumentException("revision ID must be provided"));
        }

        return store.inTransaction(session -> {
                    applyUpdate(session, uri, params);
                    return null;
                })
                .replaceWithVoid()
                .invoke(() -> LOG.debugf("Updated secret %s", uri));
    }

    private void applyUpdate(StoreSession session, SecretUri uri, UpsertSecretParams params) {
        var secret = SecretRows.requireSecret(session, uri);
        if (Boolean.TRUE.equals(params.autoPrune()) && !secret.isUserSecret()) {
            throw new AutoPruneNotSupportedException(uri);
        }
        final var now = Instant.now();

        if (params.label() != null && !params.label().equals(secret.label() == null ? "" : secret.label())) {
            SecretLabels.ensureAvailable(
                    session, resolver, secret.ownerKind(), secret.ownerUuid(), params.label(), secret.id());
            secret = secret.withLabel(params.label());
        }
        if (params.description() != null) {
            secret = secret.withDescription(params.description());
        }
        if (params.autoPrune() != null) {
            secret = secret.withAutoPrune(params.autoPrune());
        }
        if (params.rotatePolicy() != null) {
            final var policyChanged = params.rotatePolicy() != secret.rotatePolicy();
            secret = secret.withRotatePolicy(params.rotatePolicy());
            scheduleRotation(session, secret.id(), params.rotatePolicy(), params.nextRotateTime(), now, policyChanged);
        } else if (params.nextRotateTime() != null) {
            session.relation(Relations.ROTATIONS).put(new RotationRecord(secret.id(), params.nextRotateTime()));
        }

        final var latest = SecretRows.latestRevision(session, secret.id());
        var expiryTarget = latest.map(RevisionRecord::revisionId).orElse(null);
        if (params.hasContent()) {
            final var checksum = params.effectiveChecksum();
            final var unchanged =
                    checksum != null && latest.isPresent() && checksum.equals(latest.get().checksum());
            if (unchanged) {
                LOG.debugf("Content of secret %s unchanged, no new revision", uri);
            } else {
                expiryTarget = appendRevision(session, secret, latest.orElse(null), params, now);
            }
        }
        if (params.expireTime() != null && expiryTarget != null) {
            session.relation(Relations.EXPIRIES)
                    .put(new ExpiryRecord(expiryTarget, secret.id(), params.expireTime()));
        }

        session.relation(Relations.SECRETS).put(secret.withUpdateTime(now));
    }

    private String appendRevision(
            StoreSession session, SecretRecord secret, RevisionRecord previous, UpsertSecretParams params, Instant now) {
        final var revisions = session.relation(Relations.REVISIONS);
        if (revisions.get(params.revisionId()).isPresent()) {
            throw new IllegalArgumentException("revision ID " + params.revisionId() + " already in use");
        }
        final var number = previous == null ? 1 : previous.revision() + 1;
        final var content = params.content();
        revisions.put(new RevisionRecord(
                params.revisionId(),
                secret.id(),
                number,
                content.data(),
                content.valueRef(),
                params.effectiveChecksum(),
                now,
                false,
                false));
        if (previous != null) {
            RevisionObsolescence.reevaluate(session, secret.id(), previous.revision());
        }
        LOG.infof("Secret %s has new revision %d", SecretUri.of(secret.id()), number);
        return params.revisionId();
    }

    /**
     * Keep the rotation row in line with the policy. An existing schedule is
     * kept unless the policy changed or an explicit time is given.
     */
    private static void scheduleRotation(
            StoreSession session,
            String secretId,
            RotatePolicy policy,
            Instant explicitNext,
            Instant now,
            boolean policyChanged) {
        final var rotations = session.relation(Relations.ROTATIONS);
        if (!policy.willRotate()) {
            rotations.delete(secretId);
            return;
        }
        if (explicitNext != null) {
            rotations.put(new RotationRecord(secretId, explicitNext));
        } else if (policyChanged || rotations.get(secretId).isEmpty()) {
            policy.nextRotateTime(now).ifPresent(next -> rotations.put(new RotationRecord(secretId, next)));
        }
    }

    @Override
    public Uni<SecretMetadata> getSecret(SecretUri uri) {
        return store.read(session -> SecretRows.toMetadata(session, resolver, SecretRows.requireSecret(session, uri)));
    }

    @Override
    public Uni<SecretWithRevisions> getSecretByUri(SecretUri uri, Integer revision) {
        return store.read(session -> {
            final var secret = SecretRows.requireSecret(session, uri);
            if (revision == null) {
                return SecretRows.withRevisions(session, resolver, secret);
            }
            final var record = SecretRows.requireRevision(session, uri, revision);
            return new SecretWithRevisions(
                    SecretRows.toMetadata(session, resolver, secret),
                    List.of(SecretRows.toRevisionMetadata(session, record)));
        });
    }

    @Override
    public Uni<List<SecretMetadata>> listAllSecrets() {
        return store.read(session -> session.relation(Relations.SECRETS).all().stream()
                .sorted(Comparator.comparing(SecretRecord::createTime).thenComparing(SecretRecord::id))
                .map(secret -> SecretRows.toMetadata(session, resolver, secret))
                .toList());
    }

    @Override
    public Uni<List<SecretWithRevisions>> listCharmSecrets(Set<String> appOwners, Set<String> unitOwners) {
        if (appOwners.isEmpty() && unitOwners.isEmpty()) {
            return Uni.createFrom()
                    .failure(new IllegalArgumentException("must supply at least one app owner or unit owner"));
        }
        return store.read(session -> session
                .relation(Relations.SECRETS)
                .scan(secret -> SecretRows.ownedByAny(secret, appOwners, unitOwners))
                .stream()
                .sorted(Comparator.comparing(SecretRecord::createTime).thenComparing(SecretRecord::id))
                .map(secret -> SecretRows.withRevisions(session, resolver, secret))
                .toList());
    }

    @Override
    public Uni<List<SecretMetadata>> listSecretsByLabels(Set<String> labels, Owner owner) {
        return store.read(session -> session
                .relation(Relations.SECRETS)
                .scan(secret -> secret.label() != null
                        && labels.contains(secret.label())
                        && (owner == null || secret.ownedBy(owner.kind(), owner.id())))
                .stream()
                .sorted(Comparator.comparing(SecretRecord::createTime).thenComparing(SecretRecord::id))
                .map(secret -> SecretRows.toMetadata(session, resolver, secret))
                .toList());
    }

    @Override
    public Uni<List<String>> deleteSecret(SecretUri uri, Collection<Integer> revisions) {
        return store.inTransaction(session -> {
                    final var secret = SecretRows.requireSecret(session, uri);
                    final var existing = SecretRows.revisionsOf(session, secret.id());
                    final Set<Integer> requested = revisions == null ? Set.of() : new HashSet<>(revisions);
                    final var deleteAll = requested.isEmpty()
                            || existing.stream().allMatch(r -> requested.contains(r.revision()));
                    if (deleteAll) {
                        return deleteEntirely(session, secret.id(), existing);
                    }
                    return deleteRevisions(session, secret.id(), existing, requested);
                })
                .invoke(deleted -> LOG.infof("Deleted %d revision(s) of secret %s", deleted.size(), uri));
    }

    private static List<String> deleteRevisions(
            StoreSession session, String secretId, List<RevisionRecord> existing, Set<Integer> requested) {
        final List<String> deleted = new ArrayList<>();
        for (RevisionRecord revision : existing) {
            if (requested.contains(revision.revision())) {
                session.relation(Relations.REVISIONS).delete(revision.revisionId());
                session.relation(Relations.EXPIRIES).delete(revision.revisionId());
                deleted.add(revision.revisionId());
            }
        }
        // The latest revision is never obsolete, even when it was not the latest before.
        SecretRows.latestRevision(session, secretId)
                .filter(latest -> latest.obsolete() || latest.pendingDelete())
                .ifPresent(latest -> session.relation(Relations.REVISIONS).put(latest.withObsolete(false, false)));
        return deleted;
    }

    /**
     * Remove a secret with everything that hangs off it.
     */
    static List<String> deleteEntirely(StoreSession session, String secretId, List<RevisionRecord> revisions) {
        final List<String> deleted = new ArrayList<>();
        for (RevisionRecord revision : revisions) {
            session.relation(Relations.REVISIONS).delete(revision.revisionId());
            session.relation(Relations.EXPIRIES).delete(revision.revisionId());
            deleted.add(revision.revisionId());
        }
        session.relation(Relations.ROTATIONS).delete(secretId);
        session.relation(Relations.CONSUMERS).deleteWhere(c -> c.secretId().equals(secretId));
        session.relation(Relations.REMOTE_CONSUMERS).deleteWhere(c -> c.secretId().equals(secretId));
        session.relation(Relations.GRANTS).deleteWhere(g -> g.secretId().equals(secretId));
        session.relation(Relations.SECRETS).delete(secretId);
        return deleted;
    }

    @Override
    public Uni<SecretContent> getSecretValue(SecretUri uri, int revision) {
        return store.read(session -> {
            SecretRows.requireSecret(session, uri);
            return SecretRows.requireRevision(session, uri, revision).content();
        });
    }

    @Override
    public Uni<SecretContent> getSecretValue(SecretUri uri, int revision, Accessor accessor) {
        return store.read(session -> {
            SecretRows.requireSecret(session, uri);
            final var role = AccessResolver.resolve(session, resolver, uri.id(), accessor);
            if (!role.allows(SecretRole.VIEW)) {
                throw new SecretAccessDeniedException(
                        accessor.kind() + " " + accessor.id() + " cannot read secret " + uri);
            }
            return SecretRows.requireRevision(session, uri, revision).content();
        });
    }

    @Override
    public Uni<Integer> getLatestRevision(SecretUri uri) {
        return store.read(session -> latestRevision(session, uri));
    }

    @Override
    public Uni<Map<SecretUri, Integer>> getLatestRevisions(Collection<SecretUri> uris) {
        return store.read(session -> {
            final Map<SecretUri, Integer> result = new LinkedHashMap<>();
            for (SecretUri uri : uris) {
                result.put(uri, latestRevision(session, uri));
            }
            return result;
        });
    }

    /**
     * Latest revision of a local secret, or the recorded latest revision of a
     * secret owned by another model.
     */
    private int latestRevision(StoreSession session, SecretUri uri) {
        if (!uri.isLocal(resolver.modelUuid())) {
            return session.relation(Relations.REFERENCES)
                    .get(uri.id())
                    .map(SecretReferenceRecord::latestRevision)
                    .orElseThrow(() -> SecretNotFoundException.forUri(uri));
        }
        final var secret = SecretRows.requireSecret(session, uri);
        return SecretRows.latestRevisionNumber(session, secret.id());
    }

    @Override
    public Uni<RotatePolicy> getRotatePolicy(SecretUri uri) {
        return store.read(session -> SecretRows.requireSecret(session, uri).rotatePolicy());
    }

    @Override
    public Uni<RotationExpiryInfo> getRotationExpiryInfo(SecretUri uri) {
        return store.read(session -> {
            final var secret = SecretRows.requireSecret(session, uri);
            final var latest = SecretRows.latestRevision(session, secret.id());
            return new RotationExpiryInfo(
                    secret.rotatePolicy(),
                    latest.flatMap(r -> SecretRows.expireTime(session, r.revisionId())).orElse(null),
                    SecretRows.nextRotateTime(session, secret.id()).orElse(null),
                    latest.map(RevisionRecord::revision).orElse(0));
        });
    }

    @Override
    public Uni<String> getSecretRevisionId(SecretUri uri, int revision) {
        return store.read(session -> {
            SecretRows.requireSecret(session, uri);
            return SecretRows.requireRevision(session, uri, revision).revisionId();
        });
    }

    @Override
    public Uni<SecretUri> getUserSecretUriByLabel(String label) {
        return store.read(session -> session
                .relation(Relations.SECRETS)
                .scan(secret -> secret.isUserSecret() && label.equals(secret.label()))
                .stream()
                .findFirst()
                .map(secret -> SecretUri.of(secret.id()))
                .orElseThrow(() -> new SecretNotFoundException("secret with label \"" + label + "\" not found")));
    }

    @Override
    public Uni<List<String>> getOwnedSecretIds(Set<String> appOwners, Set<String> unitOwners) {
        return store.read(session -> session
                .relation(Relations.SECRETS)
                .scan(secret -> SecretRows.ownedByAny(secret, appOwners, unitOwners))
                .stream()
                .map(SecretRecord::id)
                .sorted()
                .toList());
    }

    private static AccessorKind accessorKindOf(Owner owner) {
        return switch (owner.kind()) {
            case MODEL -> AccessorKind.MODEL;
            case APPLICATION -> AccessorKind.APPLICATION;
            case UNIT -> AccessorKind.UNIT;
        };
    }

    private static AccessScopeKind scopeKindOf(Owner owner) {
        return switch (owner.kind()) {
            case MODEL -> AccessScopeKind.MODEL;
            case APPLICATION -> AccessScopeKind.APPLICATION;
            case UNIT -> AccessScopeKind.UNIT;
        };
    }
}
