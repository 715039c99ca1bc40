package strongbox.core.service.secret;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strongbox.core.model.error.SecretConsumerNotFoundException;
import strongbox.core.model.error.SecretNotFoundException;
import strongbox.core.model.secret.ConsumerInfo;
import strongbox.core.model.secret.ConsumerLookup;
import strongbox.core.model.secret.RemoteSecretInfo;
import strongbox.core.model.secret.SecretConsumer;
import strongbox.core.model.secret.SecretUri;
import strongbox.core.model.secret.UnitRef;
import strongbox.core.model.store.ConsumerRecord;
import strongbox.core.model.store.Relations;
import strongbox.core.model.store.RemoteConsumerRecord;
import strongbox.core.model.store.RevisionRecord;
import strongbox.core.model.store.SecretReferenceRecord;
import strongbox.core.model.watch.WatchStatement;
import strongbox.core.port.in.SecretConsumption;
import strongbox.core.port.out.OwnerResolver;
import strongbox.core.port.out.SecretStore;
import strongbox.core.port.out.StoreSession;

/**
 * Service tracking the revision each consumer has acknowledged.
 *
 * <p>Consumers of secrets owned by another model are recorded against the
 * secret reference, which carries the latest revision reported by the owning model.
 */
@ApplicationScoped
public class SecretConsumerService implements SecretConsumption {

    private static final Logger LOG = Logger.getLogger(SecretConsumerService.class);

    private final SecretStore store;
    private final OwnerResolver resolver;

    @Inject
    public SecretConsumerService(SecretStore store, OwnerResolver resolver) {
        this.store = store;
        this.resolver = resolver;
    }

    @Override
    public Uni<Void> saveSecretConsumer(SecretUri uri, String unitUuid, SecretConsumer consumer) {
        return store.inTransaction(session -> {
                    latestRevision(session, uri);
                    SecretRows.requireUnit(resolver, unitUuid);
                    saveConsumer(session, uri, unitUuid, consumer);
                    return null;
                })
                .replaceWithVoid()
                .invoke(() -> LOG.debugf(
                        "Unit %s consumes %s at revision %d", unitUuid, uri, consumer.currentRevision()));
    }

    private void saveConsumer(StoreSession session, SecretUri uri, String unitUuid, SecretConsumer consumer) {
        final var consumers = session.relation(Relations.CONSUMERS);
        final var local = uri.isLocal(resolver.modelUuid());
        final var previous = consumers.get(new ConsumerRecord.Key(uri.id(), unitUuid));
        consumers.put(new ConsumerRecord(
                uri.id(),
                local ? null : uri.sourceModelUuid(),
                unitUuid,
                consumer.label(),
                consumer.currentRevision()));
        if (local
                && previous.isPresent()
                && previous.get().currentRevision() != consumer.currentRevision()) {
            RevisionObsolescence.reevaluate(session, uri.id(), previous.get().currentRevision());
        }
    }

    /**
     * Latest revision of the consumed secret. Fails if a local secret does not
     * exist or a remote secret was never referenced.
     */
    private int latestRevision(StoreSession session, SecretUri uri) {
        if (uri.isLocal(resolver.modelUuid())) {
            final var secret = SecretRows.requireSecret(session, uri);
            return SecretRows.latestRevisionNumber(session, secret.id());
        }
        return session.relation(Relations.REFERENCES)
                .get(uri.id())
                .map(SecretReferenceRecord::latestRevision)
                .orElseThrow(() -> SecretNotFoundException.forUri(uri));
    }

    @Override
    public Uni<ConsumerLookup> getSecretConsumer(SecretUri uri, String unitUuid) {
        return store.read(session -> {
            final var latest = latestRevision(session, uri);
            SecretRows.requireUnit(resolver, unitUuid);
            final var consumer = session.relation(Relations.CONSUMERS)
                    .get(new ConsumerRecord.Key(uri.id(), unitUuid))
                    .orElseThrow(() -> new SecretConsumerNotFoundException(
                            "secret consumer " + unitUuid + " for " + uri + " not found", latest));
            return new ConsumerLookup(new SecretConsumer(consumer.label(), consumer.currentRevision()), latest);
        });
    }

    @Override
    public Uni<SecretUri> getUriByConsumerLabel(String label, String unitUuid) {
        return store.read(session -> {
            SecretRows.requireUnit(resolver, unitUuid);
            return session.relation(Relations.CONSUMERS)
                    .scan(c -> c.unitUuid().equals(unitUuid) && label.equals(c.label()))
                    .stream()
                    .findFirst()
                    .map(c -> new SecretUri(c.secretId(), c.sourceModelUuid()))
                    .orElseThrow(() -> new SecretNotFoundException(
                            "secret with consumer label \"" + label + "\" not found"));
        });
    }

    @Override
    public Uni<Map<String, List<ConsumerInfo>>> allSecretConsumers() {
        return store.read(session -> {
            final Map<String, List<ConsumerInfo>> result = new LinkedHashMap<>();
            for (ConsumerRecord consumer : session.relation(Relations.CONSUMERS).all()) {
                final var unitName = resolver.unitByUuid(consumer.unitUuid())
                        .map(UnitRef::name)
                        .orElse(consumer.unitUuid());
                result.computeIfAbsent(consumer.secretId(), id -> new ArrayList<>())
                        .add(new ConsumerInfo(unitName, consumer.label(), consumer.currentRevision()));
            }
            return result;
        });
    }

    @Override
    public Uni<Void> saveSecretRemoteConsumer(SecretUri uri, String unitName, SecretConsumer consumer) {
        return store.inTransaction(session -> {
                    SecretRows.requireSecret(session, uri);
                    session.relation(Relations.REMOTE_CONSUMERS)
                            .put(new RemoteConsumerRecord(uri.id(), unitName, consumer.currentRevision()));
                    return null;
                })
                .replaceWithVoid()
                .invoke(() -> LOG.debugf(
                        "Remote unit %s consumes %s at revision %d", unitName, uri, consumer.currentRevision()));
    }

    @Override
    public Uni<ConsumerLookup> getSecretRemoteConsumer(SecretUri uri, String unitName) {
        return store.read(session -> {
            final var secret = SecretRows.requireSecret(session, uri);
            final var latest = SecretRows.latestRevisionNumber(session, secret.id());
            final var consumer = session.relation(Relations.REMOTE_CONSUMERS)
                    .get(new RemoteConsumerRecord.Key(secret.id(), unitName))
                    .orElseThrow(() -> new SecretConsumerNotFoundException(
                            "secret consumer " + unitName + " for " + uri + " not found", latest));
            return new ConsumerLookup(new SecretConsumer(null, consumer.currentRevision()), latest);
        });
    }

    @Override
    public Uni<Map<String, List<ConsumerInfo>>> allSecretRemoteConsumers() {
        return store.read(session -> {
            final Map<String, List<ConsumerInfo>> result = new LinkedHashMap<>();
            for (RemoteConsumerRecord consumer : session.relation(Relations.REMOTE_CONSUMERS).all()) {
                result.computeIfAbsent(consumer.secretId(), id -> new ArrayList<>())
                        .add(new ConsumerInfo(consumer.unitName(), null, consumer.currentRevision()));
            }
            return result;
        });
    }

    @Override
    public Uni<Void> updateRemoteSecretRevision(SecretUri uri, int latestRevision) {
        if (uri.isLocal(resolver.modelUuid())) {
            return Uni.createFrom()
                    .failure(new IllegalArgumentException("secret " + uri + " is not owned by another model"));
        }
        return store.inTransaction(session -> {
                    session.relation(Relations.REFERENCES)
                            .put(new SecretReferenceRecord(uri.id(), uri.sourceModelUuid(), latestRevision));
                    return null;
                })
                .replaceWithVoid()
                .invoke(() -> LOG.debugf("Remote secret %s is at revision %d", uri, latestRevision));
    }

    @Override
    public Uni<List<RemoteSecretInfo>> allRemoteSecrets() {
        return store.read(session -> {
            final var references = session.relation(Relations.REFERENCES);
            final List<RemoteSecretInfo> result = new ArrayList<>();
            for (ConsumerRecord consumer : session.relation(Relations.CONSUMERS).scan(c -> c.sourceModelUuid() != null)) {
                final var reference = references.get(consumer.secretId());
                if (reference.isEmpty()) {
                    continue;
                }
                final var unitName = resolver.unitByUuid(consumer.unitUuid())
                        .map(UnitRef::name)
                        .orElse(consumer.unitUuid());
                result.add(new RemoteSecretInfo(
                        new SecretUri(consumer.secretId(), consumer.sourceModelUuid()),
                        unitName,
                        consumer.label(),
                        consumer.currentRevision(),
                        reference.get().latestRevision()));
            }
            return result;
        });
    }

    @Override
    public Uni<Integer> getConsumedRevision(
            SecretUri uri, String unitUuid, boolean refresh, boolean peek, String labelToUpdate) {
        return store.inTransaction(session -> {
            final var latest = latestRevision(session, uri);
            SecretRows.requireUnit(resolver, unitUuid);
            final var existing = session.relation(Relations.CONSUMERS).get(new ConsumerRecord.Key(uri.id(), unitUuid));

            // a first read records the consumer at the latest revision
            final var mustRefresh = refresh || existing.isEmpty();
            var consumer = existing.map(c -> new SecretConsumer(c.label(), c.currentRevision()))
                    .orElse(new SecretConsumer(null, latest));
            final var wanted = mustRefresh || peek ? latest : consumer.currentRevision();

            final var labelChanged = labelToUpdate != null && !Objects.equals(labelToUpdate, consumer.label());
            if (mustRefresh || labelChanged) {
                if (mustRefresh) {
                    consumer = consumer.withCurrentRevision(latest);
                }
                if (labelChanged) {
                    consumer = consumer.withLabel(labelToUpdate);
                }
                saveConsumer(session, uri, unitUuid, consumer);
            }
            return wanted;
        });
    }

    @Override
    public WatchStatement initialWatchStatementForConsumedSecretsChange(String unitUuid) {
        return new WatchStatement(
                Relations.REVISIONS.name(),
                () -> store.read(session -> latestRevisionIdsConsumedBy(session, unitUuid).values().stream()
                        .sorted()
                        .toList()));
    }

    @Override
    public Uni<List<SecretUri>> getConsumedSecretUrisWithChanges(String unitUuid, Set<String> knownRevisionIds) {
        return store.read(session -> latestRevisionIdsConsumedBy(session, unitUuid).entrySet().stream()
                .filter(e -> !knownRevisionIds.contains(e.getValue()))
                .map(e -> SecretUri.of(e.getKey()))
                .toList());
    }

    /**
     * Latest revision ID of every local secret the unit consumes, keyed by secret ID.
     */
    private Map<String, String> latestRevisionIdsConsumedBy(StoreSession session, String unitUuid) {
        final Map<String, String> result = new LinkedHashMap<>();
        for (ConsumerRecord consumer : session.relation(Relations.CONSUMERS)
                .scan(c -> c.unitUuid().equals(unitUuid) && c.sourceModelUuid() == null)) {
            SecretRows.latestRevision(session, consumer.secretId())
                    .map(RevisionRecord::revisionId)
                    .ifPresent(id -> result.put(consumer.secretId(), id));
        }
        return result;
    }

    @Override
    public WatchStatement initialWatchStatementForConsumedRemoteSecretsChange(String unitUuid) {
        return new WatchStatement(
                Relations.REFERENCES.name(),
                () -> store.read(session -> remoteRevisionKeysConsumedBy(session, unitUuid).values().stream()
                        .sorted()
                        .toList()));
    }

    @Override
    public Uni<List<SecretUri>> getConsumedRemoteSecretUrisWithChanges(String unitUuid, Set<String> knownRevisionKeys) {
        return store.read(session -> remoteRevisionKeysConsumedBy(session, unitUuid).entrySet().stream()
                .filter(e -> !knownRevisionKeys.contains(e.getValue()))
                .map(Map.Entry::getKey)
                .toList());
    }

    private Map<SecretUri, String> remoteRevisionKeysConsumedBy(StoreSession session, String unitUuid) {
        final var references = session.relation(Relations.REFERENCES);
        final Map<SecretUri, String> result = new LinkedHashMap<>();
        for (ConsumerRecord consumer : session.relation(Relations.CONSUMERS)
                .scan(c -> c.unitUuid().equals(unitUuid) && c.sourceModelUuid() != null)) {
            references.get(consumer.secretId()).ifPresent(reference -> {
                final var uri = new SecretUri(consumer.secretId(), consumer.sourceModelUuid());
                result.put(uri, uri.revisionKey(reference.latestRevision()));
            });
        }
        return result;
    }
}
