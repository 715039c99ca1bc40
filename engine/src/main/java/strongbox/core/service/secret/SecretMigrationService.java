package strongbox.core.service.secret;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strongbox.core.model.access.AccessScope;
import strongbox.core.model.access.AccessScopeKind;
import strongbox.core.model.access.Accessor;
import strongbox.core.model.access.AccessorKind;
import strongbox.core.model.error.ApplicationNotFoundException;
import strongbox.core.model.error.UnitNotFoundException;
import strongbox.core.model.migration.SecretExport;
import strongbox.core.model.migration.SecretExport.ExportedConsumer;
import strongbox.core.model.migration.SecretExport.ExportedGrant;
import strongbox.core.model.migration.SecretExport.ExportedRemoteSecret;
import strongbox.core.model.secret.ApplicationRef;
import strongbox.core.model.secret.SecretConsumer;
import strongbox.core.model.secret.SecretContent;
import strongbox.core.model.secret.SecretRevisionMetadata;
import strongbox.core.model.secret.SecretUri;
import strongbox.core.model.secret.SecretWithRevisions;
import strongbox.core.model.secret.UnitRef;
import strongbox.core.model.store.ConsumerRecord;
import strongbox.core.model.store.ExpiryRecord;
import strongbox.core.model.store.GrantRecord;
import strongbox.core.model.store.Relations;
import strongbox.core.model.store.RemoteConsumerRecord;
import strongbox.core.model.store.RevisionRecord;
import strongbox.core.model.store.RotationRecord;
import strongbox.core.model.store.SecretRecord;
import strongbox.core.model.store.SecretReferenceRecord;
import strongbox.core.port.in.MigrationStep;
import strongbox.core.port.in.SecretMigration;
import strongbox.core.port.out.OwnerResolver;
import strongbox.core.port.out.SecretStore;
import strongbox.core.port.out.StoreSession;

/**
 * Service exporting the secrets of a model and importing them into another.
 *
 * <p>Exports name owners, consumers and grant parties by application or unit
 * name so they can be resolved in the target model. Relations keep their UUID
 * and model-level parties are re-targeted to the importing model.
 */
@ApplicationScoped
public class SecretMigrationService implements SecretMigration {

    private static final Logger LOG = Logger.getLogger(SecretMigrationService.class);

    private final SecretStore store;
    private final OwnerResolver resolver;

    @Inject
    public SecretMigrationService(SecretStore store, OwnerResolver resolver) {
        this.store = store;
        this.resolver = resolver;
    }

    @Override
    public Uni<SecretExport> exportSecrets() {
        return store.read(this::export)
                .invoke(export -> LOG.infof(
                        "Exported %d secret(s) and %d remote secret(s)",
                        export.secrets().size(),
                        export.remoteSecrets().size()));
    }

    private SecretExport export(StoreSession session) {
        final List<SecretWithRevisions> secrets = new ArrayList<>();
        final Map<String, Map<Integer, SecretContent>> content = new LinkedHashMap<>();
        final Map<String, Instant> rotations = new LinkedHashMap<>();
        for (SecretRecord secret : session.relation(Relations.SECRETS).all()) {
            secrets.add(SecretRows.withRevisions(session, resolver, secret));
            final Map<Integer, SecretContent> byRevision = new LinkedHashMap<>();
            for (RevisionRecord revision : SecretRows.revisionsOf(session, secret.id())) {
                byRevision.put(revision.revision(), revision.content());
            }
            content.put(secret.id(), byRevision);
            SecretRows.nextRotateTime(session, secret.id()).ifPresent(next -> rotations.put(secret.id(), next));
        }

        final Map<String, List<ExportedConsumer>> consumers = new LinkedHashMap<>();
        final List<ExportedRemoteSecret> remoteSecrets = new ArrayList<>();
        final var references = session.relation(Relations.REFERENCES);
        for (ConsumerRecord consumer : session.relation(Relations.CONSUMERS).all()) {
            final var unitName = unitName(consumer.unitUuid());
            final var state = new SecretConsumer(consumer.label(), consumer.currentRevision());
            if (consumer.sourceModelUuid() == null) {
                consumers.computeIfAbsent(consumer.secretId(), id -> new ArrayList<>())
                        .add(new ExportedConsumer(unitName, state));
                continue;
            }
            final var latest = references.get(consumer.secretId())
                    .map(SecretReferenceRecord::latestRevision)
                    .orElse(consumer.currentRevision());
            remoteSecrets.add(new ExportedRemoteSecret(
                    new SecretUri(consumer.secretId(), consumer.sourceModelUuid()), unitName, state, latest));
        }

        final Map<String, List<ExportedConsumer>> remoteConsumers = new LinkedHashMap<>();
        for (RemoteConsumerRecord consumer : session.relation(Relations.REMOTE_CONSUMERS).all()) {
            remoteConsumers.computeIfAbsent(consumer.secretId(), id -> new ArrayList<>())
                    .add(new ExportedConsumer(consumer.unitName(), new SecretConsumer(null, consumer.currentRevision())));
        }

        final Map<String, List<ExportedGrant>> access = new LinkedHashMap<>();
        for (GrantRecord grant : session.relation(Relations.GRANTS).all()) {
            access.computeIfAbsent(grant.secretId(), id -> new ArrayList<>())
                    .add(new ExportedGrant(
                            grant.scope().kind(),
                            scopeName(grant.scope()),
                            grant.subject().kind(),
                            subjectName(grant.subject()),
                            grant.role()));
        }

        return new SecretExport(secrets, content, rotations, consumers, remoteConsumers, access, remoteSecrets);
    }

    private String unitName(String unitUuid) {
        return resolver.unitByUuid(unitUuid).map(UnitRef::name).orElse(unitUuid);
    }

    private String applicationName(String applicationUuid) {
        return resolver.applicationByUuid(applicationUuid).map(ApplicationRef::name).orElse(applicationUuid);
    }

    private String scopeName(AccessScope scope) {
        return switch (scope.kind()) {
            case UNIT -> unitName(scope.id());
            case APPLICATION -> applicationName(scope.id());
            case RELATION, MODEL -> scope.id();
        };
    }

    private String subjectName(Accessor subject) {
        return switch (subject.kind()) {
            case UNIT -> unitName(subject.id());
            case APPLICATION -> applicationName(subject.id());
            case MODEL -> subject.id();
        };
    }

    @Override
    public Uni<Void> importSecrets(SecretExport export, List<MigrationStep> extraSteps) {
        return store.inTransaction(session -> {
                    importInto(session, export);
                    for (MigrationStep step : extraSteps) {
                        step.apply(session);
                    }
                    return null;
                })
                .replaceWithVoid()
                .invoke(() -> LOG.infof("Imported %d secret(s)", export.secrets().size()))
                .onFailure()
                .invoke(e -> LOG.error("Secret import failed, nothing was stored", e));
    }

    private void importInto(StoreSession session, SecretExport export) {
        final var secrets = session.relation(Relations.SECRETS);
        final Map<String, String> unitUuids = new HashMap<>();
        for (SecretWithRevisions exported : export.secrets()) {
            final var metadata = exported.metadata();
            final var id = metadata.uri().id();
            if (secrets.get(id).isPresent()) {
                throw new IllegalArgumentException("secret " + metadata.uri() + " already exists");
            }
            final String ownerUuid =
                    switch (metadata.owner().kind()) {
                        case MODEL -> resolver.modelUuid();
                        case APPLICATION -> applicationUuid(metadata.owner().id());
                        case UNIT -> unitUuid(unitUuids, metadata.owner().id());
                    };
            secrets.put(new SecretRecord(
                    id,
                    metadata.version(),
                    metadata.owner().kind(),
                    ownerUuid,
                    metadata.label(),
                    metadata.description(),
                    metadata.autoPrune(),
                    metadata.rotatePolicy(),
                    metadata.createTime(),
                    metadata.updateTime()));

            final var contentByRevision = export.content().getOrDefault(id, Map.of());
            for (SecretRevisionMetadata revision : exported.revisions()) {
                final var content = contentOf(metadata.uri(), revision, contentByRevision);
                final var checksum = revision.revision() == metadata.latestRevision()
                                && metadata.latestRevisionChecksum() != null
                        ? metadata.latestRevisionChecksum()
                        : content.checksum();
                session.relation(Relations.REVISIONS)
                        .put(new RevisionRecord(
                                revision.revisionId(),
                                id,
                                revision.revision(),
                                content.data(),
                                content.valueRef(),
                                checksum,
                                revision.createTime(),
                                revision.obsolete(),
                                revision.pendingDelete()));
                if (revision.expireTime() != null) {
                    session.relation(Relations.EXPIRIES)
                            .put(new ExpiryRecord(revision.revisionId(), id, revision.expireTime()));
                }
            }

            final var next = export.nextRotateTimes().get(id);
            if (next != null) {
                session.relation(Relations.ROTATIONS).put(new RotationRecord(id, next));
            }
            for (ExportedConsumer consumer : export.consumers().getOrDefault(id, List.of())) {
                session.relation(Relations.CONSUMERS)
                        .put(new ConsumerRecord(
                                id,
                                null,
                                unitUuid(unitUuids, consumer.unitName()),
                                consumer.consumer().label(),
                                consumer.consumer().currentRevision()));
            }
            for (ExportedConsumer consumer : export.remoteConsumers().getOrDefault(id, List.of())) {
                session.relation(Relations.REMOTE_CONSUMERS)
                        .put(new RemoteConsumerRecord(
                                id, consumer.unitName(), consumer.consumer().currentRevision()));
            }
            for (ExportedGrant grant : export.access().getOrDefault(id, List.of())) {
                session.relation(Relations.GRANTS)
                        .put(new GrantRecord(
                                id,
                                new AccessScope(grant.scopeKind(), scopeUuid(unitUuids, grant)),
                                new Accessor(grant.subjectKind(), subjectUuid(unitUuids, grant)),
                                grant.role()));
            }
        }

        for (ExportedRemoteSecret remote : export.remoteSecrets()) {
            final var uri = remote.uri();
            session.relation(Relations.CONSUMERS)
                    .put(new ConsumerRecord(
                            uri.id(),
                            uri.sourceModelUuid(),
                            unitUuid(unitUuids, remote.unitName()),
                            remote.consumer().label(),
                            remote.consumer().currentRevision()));
            session.relation(Relations.REFERENCES)
                    .put(new SecretReferenceRecord(uri.id(), uri.sourceModelUuid(), remote.latestRevision()));
        }
    }

    private static SecretContent contentOf(
            SecretUri uri, SecretRevisionMetadata revision, Map<Integer, SecretContent> contentByRevision) {
        final var content = contentByRevision.get(revision.revision());
        if (content != null) {
            return content;
        }
        if (revision.valueRef() != null) {
            return SecretContent.reference(revision.valueRef());
        }
        throw new IllegalArgumentException("no content exported for " + uri.revisionKey(revision.revision()));
    }

    private String applicationUuid(String name) {
        return resolver.applicationByName(name)
                .map(ApplicationRef::uuid)
                .orElseThrow(() -> new ApplicationNotFoundException(name));
    }

    private String unitUuid(Map<String, String> cache, String name) {
        return cache.computeIfAbsent(name, n -> resolver.unitByName(n)
                .map(UnitRef::uuid)
                .orElseThrow(() -> new UnitNotFoundException(n)));
    }

    private String scopeUuid(Map<String, String> unitUuids, ExportedGrant grant) {
        final AccessScopeKind kind = grant.scopeKind();
        return switch (kind) {
            case UNIT -> unitUuid(unitUuids, grant.scopeName());
            case APPLICATION -> applicationUuid(grant.scopeName());
            case RELATION -> grant.scopeName();
            case MODEL -> resolver.modelUuid();
        };
    }

    private String subjectUuid(Map<String, String> unitUuids, ExportedGrant grant) {
        final AccessorKind kind = grant.subjectKind();
        return switch (kind) {
            case UNIT -> unitUuid(unitUuids, grant.subjectName());
            case APPLICATION -> applicationUuid(grant.subjectName());
            case MODEL -> resolver.modelUuid();
        };
    }
}
