package strongbox.core.service.secret;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strongbox.core.config.SecretsConfig;
import strongbox.core.model.backend.BackendRotationInfo;
import strongbox.core.model.error.SecretBackendNotFoundException;
import strongbox.core.model.secret.ExpiryInfo;
import strongbox.core.model.secret.RotationInfo;
import strongbox.core.model.secret.SecretUri;
import strongbox.core.model.store.BackendRotationRecord;
import strongbox.core.model.store.ExpiryRecord;
import strongbox.core.model.store.Relations;
import strongbox.core.model.store.RotationRecord;
import strongbox.core.model.store.SecretRecord;
import strongbox.core.model.watch.WatchStatement;
import strongbox.core.port.in.SecretRotationScheduling;
import strongbox.core.port.out.SecretStore;
import strongbox.core.port.out.StoreSession;

/**
 * Service for rotation and expiry schedules.
 *
 * <p>Storing a rotation time only ever moves the schedule earlier. Change
 * queries narrow to the supplied identifiers; an empty identifier set
 * reports everything the owners hold.
 */
@ApplicationScoped
public class SecretRotationService implements SecretRotationScheduling {

    private static final Logger LOG = Logger.getLogger(SecretRotationService.class);

    private final SecretStore store;
    private final Duration rotateRetryDelay;

    @Inject
    public SecretRotationService(SecretStore store, SecretsConfig config) {
        this(store, config.rotateRetryDelay());
    }

    public SecretRotationService(SecretStore store, Duration rotateRetryDelay) {
        this.store = store;
        this.rotateRetryDelay = rotateRetryDelay;
    }

    @Override
    public Uni<Void> secretRotated(SecretUri uri, Instant nextRotateTime) {
        return store.inTransaction(session -> {
                    final var secret = SecretRows.requireSecret(session, uri);
                    final var rotations = session.relation(Relations.ROTATIONS);
                    final var current = rotations.get(secret.id());
                    if (current.isPresent() && nextRotateTime.isAfter(current.get().nextRotateTime())) {
                        LOG.debugf("Secret %s already rotates at %s, ignoring %s",
                                uri, current.get().nextRotateTime(), nextRotateTime);
                        return null;
                    }
                    rotations.put(new RotationRecord(secret.id(), nextRotateTime));
                    return null;
                })
                .replaceWithVoid();
    }

    @Override
    public Uni<Void> secretRotated(SecretUri uri, int originalRevision, boolean skip) {
        return store.inTransaction(session -> {
                    final var secret = SecretRows.requireSecret(session, uri);
                    final var rotations = session.relation(Relations.ROTATIONS);
                    final var now = Instant.now();
                    final var latest = SecretRows.latestRevisionNumber(session, secret.id());
                    if (!skip && latest == originalRevision) {
                        final var retry = now.plus(rotateRetryDelay);
                        LOG.infof("Secret %s was not rotated, retrying at %s", uri, retry);
                        rotations.put(new RotationRecord(secret.id(), retry));
                        return null;
                    }
                    final var next = secret.rotatePolicy().nextRotateTime(now);
                    if (next.isPresent()) {
                        rotations.put(new RotationRecord(secret.id(), next.get()));
                    } else {
                        rotations.delete(secret.id());
                    }
                    return null;
                })
                .replaceWithVoid();
    }

    @Override
    public WatchStatement initialWatchStatementForSecretsRotationChanges(Set<String> appOwners, Set<String> unitOwners) {
        return new WatchStatement(
                Relations.ROTATIONS.name(),
                () -> getSecretsRotationChanges(appOwners, unitOwners, Set.of())
                        .map(infos -> infos.stream().map(info -> info.uri().id()).toList()));
    }

    @Override
    public Uni<List<RotationInfo>> getSecretsRotationChanges(
            Set<String> appOwners, Set<String> unitOwners, Set<String> secretIds) {
        if (appOwners.isEmpty() && unitOwners.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }
        return store.read(session -> {
            final List<RotationInfo> result = new ArrayList<>();
            for (RotationRecord rotation : session.relation(Relations.ROTATIONS).all()) {
                if (!secretIds.isEmpty() && !secretIds.contains(rotation.secretId())) {
                    continue;
                }
                final var secret = session.relation(Relations.SECRETS).get(rotation.secretId());
                if (secret.isEmpty() || !SecretRows.ownedByAny(secret.get(), appOwners, unitOwners)) {
                    continue;
                }
                result.add(new RotationInfo(
                        SecretUri.of(rotation.secretId()),
                        SecretRows.latestRevisionNumber(session, rotation.secretId()),
                        rotation.nextRotateTime()));
            }
            result.sort(Comparator.comparing(RotationInfo::nextTriggerTime));
            return result;
        });
    }

    @Override
    public WatchStatement initialWatchStatementForSecretsRevisionExpiryChanges(
            Set<String> appOwners, Set<String> unitOwners) {
        return new WatchStatement(
                Relations.EXPIRIES.name(),
                () -> getSecretsRevisionExpiryChanges(appOwners, unitOwners, Set.of())
                        .map(infos -> infos.stream().map(ExpiryInfo::revisionId).toList()));
    }

    @Override
    public Uni<List<ExpiryInfo>> getSecretsRevisionExpiryChanges(
            Set<String> appOwners, Set<String> unitOwners, Set<String> revisionIds) {
        if (appOwners.isEmpty() && unitOwners.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }
        return store.read(session -> {
            final List<ExpiryInfo> result = new ArrayList<>();
            for (ExpiryRecord expiry : session.relation(Relations.EXPIRIES).all()) {
                if (!revisionIds.isEmpty() && !revisionIds.contains(expiry.revisionId())) {
                    continue;
                }
                if (!ownedByAny(session, expiry.secretId(), appOwners, unitOwners)) {
                    continue;
                }
                session.relation(Relations.REVISIONS).get(expiry.revisionId()).ifPresent(revision -> result.add(
                        new ExpiryInfo(
                                SecretUri.of(expiry.secretId()),
                                revision.revision(),
                                revision.revisionId(),
                                expiry.expireTime())));
            }
            result.sort(Comparator.comparing(ExpiryInfo::nextTriggerTime));
            return result;
        });
    }

    private static boolean ownedByAny(
            StoreSession session, String secretId, Set<String> appOwners, Set<String> unitOwners) {
        return session.relation(Relations.SECRETS)
                .get(secretId)
                .map((SecretRecord secret) -> SecretRows.ownedByAny(secret, appOwners, unitOwners))
                .orElse(false);
    }

    @Override
    public Uni<Void> secretBackendRotated(String backendId, Instant nextRotateTime) {
        return store.inTransaction(session -> {
                    if (session.relation(Relations.BACKENDS).get(backendId).isEmpty()) {
                        throw SecretBackendNotFoundException.forId(backendId);
                    }
                    final var rotations = session.relation(Relations.BACKEND_ROTATIONS);
                    final var current = rotations.get(backendId);
                    if (current.isPresent() && nextRotateTime.isAfter(current.get().nextRotateTime())) {
                        return null;
                    }
                    rotations.put(new BackendRotationRecord(backendId, nextRotateTime));
                    return null;
                })
                .replaceWithVoid()
                .invoke(() -> LOG.debugf("Secret backend %s token rotation checked against %s", backendId, nextRotateTime));
    }

    @Override
    public WatchStatement initialWatchStatementForSecretBackendRotationChanges() {
        return new WatchStatement(
                Relations.BACKEND_ROTATIONS.name(),
                () -> getSecretBackendRotateChanges(Set.of())
                        .map(infos -> infos.stream().map(BackendRotationInfo::id).toList()));
    }

    @Override
    public Uni<List<BackendRotationInfo>> getSecretBackendRotateChanges(Set<String> backendIds) {
        return store.read(session -> {
            final var backends = session.relation(Relations.BACKENDS);
            final List<BackendRotationInfo> result = new ArrayList<>();
            for (BackendRotationRecord rotation : session.relation(Relations.BACKEND_ROTATIONS).all()) {
                if (!backendIds.isEmpty() && !backendIds.contains(rotation.backendId())) {
                    continue;
                }
                backends.get(rotation.backendId()).ifPresent(backend -> result.add(
                        new BackendRotationInfo(backend.id(), backend.name(), rotation.nextRotateTime())));
            }
            result.sort(Comparator.comparing(BackendRotationInfo::nextTriggerTime));
            return result;
        });
    }
}
