package strongbox.core.service.secret;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import strongbox.adapter.out.storage.memory.InMemorySecretStore;
import strongbox.adapter.out.topology.InMemoryModelTopology;
import strongbox.core.model.access.AccessScope;
import strongbox.core.model.access.Accessor;
import strongbox.core.model.access.SecretGrant;
import strongbox.core.model.access.SecretRole;
import strongbox.core.model.error.ApplicationNotFoundException;
import strongbox.core.model.migration.SecretExport;
import strongbox.core.model.secret.ConsumerInfo;
import strongbox.core.model.secret.Owner;
import strongbox.core.model.secret.OwnerKind;
import strongbox.core.model.secret.RemoteSecretInfo;
import strongbox.core.model.secret.RotatePolicy;
import strongbox.core.model.secret.SecretConsumer;
import strongbox.core.model.secret.SecretUri;
import strongbox.core.model.secret.UpsertSecretParams;
import strongbox.core.model.secret.ValueRef;
import strongbox.core.model.store.Relations;
import strongbox.core.model.store.SecretRecord;

@DisplayName("SecretMigrationService")
class SecretMigrationServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private final Instant nextRotation = Instant.now().plus(6, ChronoUnit.HOURS);
    private final SecretUri remote = SecretUri.newUri().withSourceModel(UUID.randomUUID().toString());

    private SecretMigrationService source;
    private SecretUri appSecret;
    private SecretUri userSecret;

    private InMemorySecretStore targetStore;
    private InMemoryModelTopology target;
    private SecretMigrationService migration;
    private SecretService targetSecrets;

    @BeforeEach
    void setUp() {
        final var store = new InMemorySecretStore();
        final var topology = new InMemoryModelTopology();
        final var mysql = topology.addApplication("mysql");
        topology.addApplication("wordpress");
        final var wordpress0 = topology.addUnit("wordpress/0");
        final var secrets = new SecretService(store, topology);
        final var access = new SecretAccessService(store, topology);
        final var consumers = new SecretConsumerService(store, topology);
        source = new SecretMigrationService(store, topology);

        appSecret = secrets.createSecret(null, Owner.application(mysql.uuid()), 1, UpsertSecretParams.builder()
                        .revisionId("a1")
                        .data(Map.of("password", "one"))
                        .label("db")
                        .rotatePolicy(RotatePolicy.DAILY)
                        .nextRotateTime(nextRotation)
                        .build())
                .await()
                .atMost(TIMEOUT);
        secrets.updateSecret(appSecret, UpsertSecretParams.builder()
                        .revisionId("a2")
                        .valueRef(new ValueRef("vault-1", "vault-a2"))
                        .build())
                .await()
                .atMost(TIMEOUT);
        userSecret = secrets.createSecret(null, Owner.model(topology.modelUuid()), 1, UpsertSecretParams.builder()
                        .revisionId("u1")
                        .data(Map.of("token", "abc"))
                        .autoPrune(true)
                        .build())
                .await()
                .atMost(TIMEOUT);

        consumers.saveSecretConsumer(appSecret, wordpress0.uuid(), new SecretConsumer("mysql-pw", 1))
                .await()
                .atMost(TIMEOUT);
        consumers.saveSecretRemoteConsumer(appSecret, "remote/0", new SecretConsumer(null, 2))
                .await()
                .atMost(TIMEOUT);
        consumers.updateRemoteSecretRevision(remote, 4).await().atMost(TIMEOUT);
        consumers.saveSecretConsumer(remote, wordpress0.uuid(), new SecretConsumer("ext", 3))
                .await()
                .atMost(TIMEOUT);
        access.grantAccess(appSecret, new SecretGrant(
                        AccessScope.application(mysql.uuid()), Accessor.application(topology.applicationByName("wordpress")
                                .orElseThrow()
                                .uuid()), SecretRole.VIEW))
                .await()
                .atMost(TIMEOUT);
        access.grantAccess(userSecret, new SecretGrant(
                        AccessScope.model(topology.modelUuid()), Accessor.model(topology.modelUuid()), SecretRole.VIEW))
                .await()
                .atMost(TIMEOUT);

        targetStore = new InMemorySecretStore();
        target = new InMemoryModelTopology();
        target.addApplication("mysql");
        target.addApplication("wordpress");
        target.addUnit("wordpress/0");
        migration = new SecretMigrationService(targetStore, target);
        targetSecrets = new SecretService(targetStore, target);
    }

    private SecretExport export() {
        return source.exportSecrets().await().atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("exportSecrets()")
    class ExportTests {

        @Test
        @DisplayName("should report parties by name")
        void shouldReportPartiesByName() {
            final var export = export();

            assertEquals(2, export.secrets().size());
            assertEquals(
                    List.of(new SecretExport.ExportedConsumer("wordpress/0", new SecretConsumer("mysql-pw", 1))),
                    export.consumers().get(appSecret.id()));
            assertEquals(
                    List.of(new SecretExport.ExportedRemoteSecret(
                            remote, "wordpress/0", new SecretConsumer("ext", 3), 4)),
                    export.remoteSecrets());
            assertTrue(export.access().get(appSecret.id()).stream()
                    .anyMatch(g -> g.subjectName().equals("wordpress") && g.role() == SecretRole.VIEW));
            assertEquals(nextRotation, export.nextRotateTimes().get(appSecret.id()));
        }
    }

    @Nested
    @DisplayName("importSecrets()")
    class ImportTests {

        @Test
        @DisplayName("should recreate secrets against the target model")
        void shouldImportIntoTargetModel() {
            migration.importSecrets(export(), List.of()).await().atMost(TIMEOUT);

            final var app = targetSecrets.getSecretByUri(appSecret, null).await().atMost(TIMEOUT);
            assertEquals(new Owner(OwnerKind.APPLICATION, "mysql"), app.metadata().owner());
            assertEquals("db", app.metadata().label());
            assertEquals(2, app.metadata().latestRevision());
            assertEquals(nextRotation, app.metadata().nextRotateTime());
            assertEquals(List.of(1, 2), app.revisions().stream().map(r -> r.revision()).toList());
            assertEquals(Map.of("password", "one"), targetSecrets.getSecretValue(appSecret, 1).await().atMost(TIMEOUT).data());
            assertEquals(
                    new ValueRef("vault-1", "vault-a2"),
                    targetSecrets.getSecretValue(appSecret, 2).await().atMost(TIMEOUT).valueRef());

            final var user = targetSecrets.getSecret(userSecret).await().atMost(TIMEOUT);
            assertEquals(new Owner(OwnerKind.MODEL, target.modelUuid()), user.owner());
            assertTrue(user.autoPrune());
        }

        @Test
        @DisplayName("should resolve consumers and grants in the target model")
        void shouldResolvePartiesInTargetModel() {
            migration.importSecrets(export(), List.of()).await().atMost(TIMEOUT);
            final var consumers = new SecretConsumerService(targetStore, target);
            final var access = new SecretAccessService(targetStore, target);
            final var wordpress = target.applicationByName("wordpress").orElseThrow();
            final var wordpress0 = target.unitByName("wordpress/0").orElseThrow();

            assertEquals(
                    List.of(new ConsumerInfo("wordpress/0", "mysql-pw", 1)),
                    consumers.allSecretConsumers().await().atMost(TIMEOUT).get(appSecret.id()));
            assertEquals(
                    List.of(new ConsumerInfo("remote/0", null, 2)),
                    consumers.allSecretRemoteConsumers().await().atMost(TIMEOUT).get(appSecret.id()));
            assertEquals(
                    List.of(new RemoteSecretInfo(remote, "wordpress/0", "ext", 3, 4)),
                    consumers.allRemoteSecrets().await().atMost(TIMEOUT));
            assertEquals(
                    SecretRole.VIEW,
                    access.getSecretAccess(appSecret, Accessor.unit(wordpress0.uuid())).await().atMost(TIMEOUT));
            assertEquals(
                    SecretRole.VIEW,
                    access.getSecretAccess(userSecret, Accessor.application(wordpress.uuid()))
                            .await()
                            .atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should run extra steps in the same unit of work")
        void shouldRunExtraSteps() {
            migration.importSecrets(export(), List.of(session -> session.relation(Relations.SECRETS)
                            .get(userSecret.id())
                            .map((SecretRecord s) -> s.withDescription("imported"))
                            .ifPresent(s -> session.relation(Relations.SECRETS).put(s))))
                    .await()
                    .atMost(TIMEOUT);

            assertEquals("imported", targetSecrets.getSecret(userSecret).await().atMost(TIMEOUT).description());
        }

        @Test
        @DisplayName("should store nothing when an extra step fails")
        void shouldRollBackOnFailingStep() {
            assertThrows(
                    IllegalStateException.class,
                    () -> migration.importSecrets(export(), List.of(session -> {
                                throw new IllegalStateException("step failed");
                            }))
                            .await()
                            .atMost(TIMEOUT));

            assertEquals(0, targetStore.size(Relations.SECRETS));
            assertEquals(0, targetStore.size(Relations.REVISIONS));
        }

        @Test
        @DisplayName("should refuse to overwrite an existing secret")
        void shouldRefuseExistingSecret() {
            final var export = export();
            migration.importSecrets(export, List.of()).await().atMost(TIMEOUT);

            assertThrows(
                    IllegalArgumentException.class,
                    () -> migration.importSecrets(export, List.of()).await().atMost(TIMEOUT));
            assertEquals(2, targetStore.size(Relations.SECRETS));
        }

        @Test
        @DisplayName("should fail when an owner is missing from the target model")
        void shouldFailForMissingOwner() {
            final var sparse = new InMemoryModelTopology();
            sparse.addApplication("wordpress");
            sparse.addUnit("wordpress/0");
            final var sparseStore = new InMemorySecretStore();

            assertThrows(
                    ApplicationNotFoundException.class,
                    () -> new SecretMigrationService(sparseStore, sparse)
                            .importSecrets(export(), List.of())
                            .await()
                            .atMost(TIMEOUT));
            assertEquals(0, sparseStore.size(Relations.SECRETS));
        }
    }
}
