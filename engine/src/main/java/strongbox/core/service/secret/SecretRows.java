package strongbox.core.service.secret;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import strongbox.core.model.error.ApplicationNotFoundException;
import strongbox.core.model.error.SecretNotFoundException;
import strongbox.core.model.error.SecretRevisionNotFoundException;
import strongbox.core.model.error.UnitNotFoundException;
import strongbox.core.model.secret.ApplicationRef;
import strongbox.core.model.secret.Owner;
import strongbox.core.model.secret.SecretMetadata;
import strongbox.core.model.secret.SecretRevisionMetadata;
import strongbox.core.model.secret.SecretUri;
import strongbox.core.model.secret.SecretWithRevisions;
import strongbox.core.model.secret.UnitRef;
import strongbox.core.model.store.ExpiryRecord;
import strongbox.core.model.store.Relations;
import strongbox.core.model.store.RevisionRecord;
import strongbox.core.model.store.RotationRecord;
import strongbox.core.model.store.SecretRecord;
import strongbox.core.port.out.OwnerResolver;
import strongbox.core.port.out.StoreSession;

/**
 * Row lookups shared by the secret services. Every method runs inside the
 * caller's session.
 */
final class SecretRows {

    private SecretRows() {}

    static SecretRecord requireSecret(StoreSession session, SecretUri uri) {
        return session.relation(Relations.SECRETS)
                .get(uri.id())
                .orElseThrow(() -> SecretNotFoundException.forUri(uri));
    }

    /**
     * Revisions of a secret in ascending revision order.
     */
    static List<RevisionRecord> revisionsOf(StoreSession session, String secretId) {
        return session.relation(Relations.REVISIONS).scan(r -> r.secretId().equals(secretId)).stream()
                .sorted(Comparator.comparingInt(RevisionRecord::revision))
                .toList();
    }

    static Optional<RevisionRecord> latestRevision(StoreSession session, String secretId) {
        return session.relation(Relations.REVISIONS).scan(r -> r.secretId().equals(secretId)).stream()
                .max(Comparator.comparingInt(RevisionRecord::revision));
    }

    static int latestRevisionNumber(StoreSession session, String secretId) {
        return latestRevision(session, secretId).map(RevisionRecord::revision).orElse(0);
    }

    static Optional<RevisionRecord> revision(StoreSession session, String secretId, int revision) {
        return session.relation(Relations.REVISIONS)
                .scan(r -> r.secretId().equals(secretId) && r.revision() == revision)
                .stream()
                .findFirst();
    }

    static RevisionRecord requireRevision(StoreSession session, SecretUri uri, int revision) {
        return revision(session, uri.id(), revision)
                .orElseThrow(() -> SecretRevisionNotFoundException.forRevision(uri, revision));
    }

    static Optional<Instant> expireTime(StoreSession session, String revisionId) {
        return session.relation(Relations.EXPIRIES).get(revisionId).map(ExpiryRecord::expireTime);
    }

    static Optional<Instant> nextRotateTime(StoreSession session, String secretId) {
        return session.relation(Relations.ROTATIONS).get(secretId).map(RotationRecord::nextRotateTime);
    }

    static UnitRef requireUnit(OwnerResolver resolver, String unitUuid) {
        return resolver.unitByUuid(unitUuid).orElseThrow(() -> new UnitNotFoundException(unitUuid));
    }

    static ApplicationRef requireApplication(OwnerResolver resolver, String applicationUuid) {
        return resolver.applicationByUuid(applicationUuid)
                .orElseThrow(() -> new ApplicationNotFoundException(applicationUuid));
    }

    static boolean ownedByAny(SecretRecord secret, Set<String> appOwners, Set<String> unitOwners) {
        return switch (secret.ownerKind()) {
            case APPLICATION -> appOwners.contains(secret.ownerUuid());
            case UNIT -> unitOwners.contains(secret.ownerUuid());
            case MODEL -> false;
        };
    }

    /**
     * Owner as reported to callers: application or unit name, or the model UUID.
     * Owners that no longer resolve are reported by UUID.
     */
    static Owner reportedOwner(OwnerResolver resolver, SecretRecord secret) {
        final String name =
                switch (secret.ownerKind()) {
                    case MODEL -> secret.ownerUuid();
                    case APPLICATION -> resolver.applicationByUuid(secret.ownerUuid())
                            .map(ApplicationRef::name)
                            .orElse(secret.ownerUuid());
                    case UNIT -> resolver.unitByUuid(secret.ownerUuid())
                            .map(UnitRef::name)
                            .orElse(secret.ownerUuid());
                };
        return new Owner(secret.ownerKind(), name);
    }

    static SecretMetadata toMetadata(StoreSession session, OwnerResolver resolver, SecretRecord secret) {
        final var latest = latestRevision(session, secret.id());
        return new SecretMetadata(
                SecretUri.of(secret.id()),
                secret.version(),
                reportedOwner(resolver, secret),
                secret.description(),
                secret.label(),
                secret.rotatePolicy(),
                secret.autoPrune(),
                latest.map(RevisionRecord::revision).orElse(0),
                latest.map(RevisionRecord::checksum).orElse(null),
                latest.flatMap(r -> expireTime(session, r.revisionId())).orElse(null),
                nextRotateTime(session, secret.id()).orElse(null),
                secret.createTime(),
                secret.updateTime());
    }

    static SecretRevisionMetadata toRevisionMetadata(StoreSession session, RevisionRecord revision) {
        return new SecretRevisionMetadata(
                revision.revision(),
                revision.revisionId(),
                revision.valueRef(),
                revision.createTime(),
                expireTime(session, revision.revisionId()).orElse(null),
                revision.obsolete(),
                revision.pendingDelete());
    }

    static SecretWithRevisions withRevisions(StoreSession session, OwnerResolver resolver, SecretRecord secret) {
        return new SecretWithRevisions(
                toMetadata(session, resolver, secret),
                revisionsOf(session, secret.id()).stream()
                        .map(r -> toRevisionMetadata(session, r))
                        .toList());
    }
}
