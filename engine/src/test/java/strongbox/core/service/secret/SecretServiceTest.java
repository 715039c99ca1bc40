package strongbox.core.service.secret;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import strongbox.adapter.out.storage.memory.InMemorySecretStore;
import strongbox.adapter.out.topology.InMemoryModelTopology;
import strongbox.core.model.access.Accessor;
import strongbox.core.model.access.SecretRole;
import strongbox.core.model.error.ApplicationNotFoundException;
import strongbox.core.model.error.AutoPruneNotSupportedException;
import strongbox.core.model.error.SecretAccessDeniedException;
import strongbox.core.model.error.SecretLabelAlreadyExistsException;
import strongbox.core.model.error.SecretNotFoundException;
import strongbox.core.model.error.SecretRevisionNotFoundException;
import strongbox.core.model.error.UnitNotFoundException;
import strongbox.core.model.secret.ApplicationRef;
import strongbox.core.model.secret.Owner;
import strongbox.core.model.secret.OwnerKind;
import strongbox.core.model.secret.RotatePolicy;
import strongbox.core.model.secret.SecretUri;
import strongbox.core.model.secret.UnitRef;
import strongbox.core.model.secret.UpsertSecretParams;
import strongbox.core.model.secret.ValueRef;
import strongbox.core.model.store.Relations;

@DisplayName("SecretService")
class SecretServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private InMemorySecretStore store;
    private InMemoryModelTopology topology;
    private SecretService service;
    private SecretAccessService access;
    private ApplicationRef mysql;
    private UnitRef mysql0;
    private UnitRef mysql1;

    @BeforeEach
    void setUp() {
        store = new InMemorySecretStore();
        topology = new InMemoryModelTopology();
        service = new SecretService(store, topology);
        access = new SecretAccessService(store, topology);
        mysql = topology.addApplication("mysql");
        mysql0 = topology.addUnit("mysql/0");
        mysql1 = topology.addUnit("mysql/1");
    }

    private static UpsertSecretParams.Builder content(Map<String, String> data) {
        return UpsertSecretParams.builder().revisionId(UUID.randomUUID().toString()).data(data);
    }

    private SecretUri createUserSecret(UpsertSecretParams params) {
        return service.createSecret(null, Owner.model(topology.modelUuid()), 1, params)
                .await()
                .atMost(TIMEOUT);
    }

    private SecretUri createAppSecret(ApplicationRef app, UpsertSecretParams params) {
        return service.createSecret(null, Owner.application(app.uuid()), 1, params)
                .await()
                .atMost(TIMEOUT);
    }

    private SecretUri createUnitSecret(UnitRef unit, UpsertSecretParams params) {
        return service.createSecret(null, Owner.unit(unit.uuid()), 1, params)
                .await()
                .atMost(TIMEOUT);
    }

    private void update(SecretUri uri, UpsertSecretParams params) {
        service.updateSecret(uri, params).await().atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("createSecret()")
    class CreateSecretTests {

        @Test
        @DisplayName("should create a user secret with its first revision")
        void shouldCreateUserSecret() {
            final var uri = createUserSecret(
                    content(Map.of("foo", "bar")).label("my label").description("db").build());

            final var metadata = service.getSecret(uri).await().atMost(TIMEOUT);

            assertEquals(1, metadata.latestRevision());
            assertEquals("my label", metadata.label());
            assertEquals("db", metadata.description());
            assertEquals(new Owner(OwnerKind.MODEL, topology.modelUuid()), metadata.owner());
            assertEquals(RotatePolicy.NEVER, metadata.rotatePolicy());
            assertNotNull(metadata.latestRevisionChecksum());
            assertNull(metadata.nextRotateTime());
        }

        @Test
        @DisplayName("should report application owners by name")
        void shouldReportOwnerByName() {
            final var uri = createUnitSecret(mysql0, content(Map.of("a", "b")).build());

            final var metadata = service.getSecret(uri).await().atMost(TIMEOUT);

            assertEquals(new Owner(OwnerKind.UNIT, "mysql/0"), metadata.owner());
        }

        @Test
        @DisplayName("should grant the owner manage access")
        void shouldGrantOwnerManage() {
            final var uri = createAppSecret(mysql, content(Map.of("a", "b")).build());

            final var role = access.getSecretAccess(uri, Accessor.application(mysql.uuid()))
                    .await()
                    .atMost(TIMEOUT);

            assertEquals(SecretRole.MANAGE, role);
        }

        @Test
        @DisplayName("should use the supplied URI")
        void shouldUseSuppliedUri() {
            final var uri = SecretUri.newUri();

            final var created = service.createSecret(uri, Owner.model(topology.modelUuid()), 1, content(Map.of("a", "b"))
                            .build())
                    .await()
                    .atMost(TIMEOUT);

            assertEquals(uri, created);
        }

        @Test
        @DisplayName("should require a revision ID")
        void shouldRequireRevisionId() {
            final var exception = assertThrows(
                    IllegalArgumentException.class,
                    () -> createUserSecret(UpsertSecretParams.builder().data(Map.of("a", "b")).build()));

            assertEquals("revision ID must be provided", exception.getMessage());
        }

        @Test
        @DisplayName("should reject auto-prune on charm secrets")
        void shouldRejectAutoPruneOnCharmSecret() {
            assertThrows(
                    AutoPruneNotSupportedException.class,
                    () -> createAppSecret(mysql, content(Map.of("a", "b")).autoPrune(true).build()));
        }

        @Test
        @DisplayName("should fail for a missing owner")
        void shouldFailForMissingOwner() {
            assertThrows(
                    ApplicationNotFoundException.class,
                    () -> service.createSecret(null, Owner.application("nope"), 1, content(Map.of("a", "b")).build())
                            .await()
                            .atMost(TIMEOUT));
            assertThrows(
                    UnitNotFoundException.class,
                    () -> service.createSecret(null, Owner.unit("nope"), 1, content(Map.of("a", "b")).build())
                            .await()
                            .atMost(TIMEOUT));
            assertEquals(0, store.size(Relations.SECRETS));
        }

        @Test
        @DisplayName("should schedule rotation for a rotating policy")
        void shouldScheduleRotation() {
            final var before = Instant.now();
            final var uri = createAppSecret(
                    mysql, content(Map.of("a", "b")).rotatePolicy(RotatePolicy.DAILY).build());

            final var next = service.getSecret(uri).await().atMost(TIMEOUT).nextRotateTime();

            assertNotNull(next);
            assertFalse(next.isBefore(before.plus(1, ChronoUnit.DAYS)));
        }

        @Test
        @DisplayName("should record an expire time on the first revision")
        void shouldRecordExpireTime() {
            final var expire = Instant.now().plus(2, ChronoUnit.HOURS);
            final var uri = createUserSecret(content(Map.of("a", "b")).expireTime(expire).build());

            assertEquals(expire, service.getSecret(uri).await().atMost(TIMEOUT).latestExpireTime());
        }
    }

    @Nested
    @DisplayName("labels")
    class LabelTests {

        @Test
        @DisplayName("should reject duplicate user secret labels")
        void shouldRejectDuplicateUserLabels() {
            createUserSecret(content(Map.of("a", "b")).label("shared").build());

            assertThrows(
                    SecretLabelAlreadyExistsException.class,
                    () -> createUserSecret(content(Map.of("c", "d")).label("shared").build()));
        }

        @Test
        @DisplayName("should reject a unit label used by its application")
        void shouldRejectUnitLabelUsedByApplication() {
            createAppSecret(mysql, content(Map.of("a", "b")).label("L").build());

            assertThrows(
                    SecretLabelAlreadyExistsException.class,
                    () -> createUnitSecret(mysql0, content(Map.of("c", "d")).label("L").build()));
        }

        @Test
        @DisplayName("should reject an application label used by one of its units")
        void shouldRejectApplicationLabelUsedByUnit() {
            createUnitSecret(mysql0, content(Map.of("a", "b")).label("L").build());

            assertThrows(
                    SecretLabelAlreadyExistsException.class,
                    () -> createAppSecret(mysql, content(Map.of("c", "d")).label("L").build()));
        }

        @Test
        @DisplayName("should allow the same label on different applications and units")
        void shouldAllowLabelAcrossScopes() {
            final var wordpress = topology.addApplication("wordpress");
            createAppSecret(mysql, content(Map.of("a", "b")).label("L").build());
            createAppSecret(wordpress, content(Map.of("a", "b")).label("L").build());
            createUserSecret(content(Map.of("a", "b")).label("L").build());
            createUnitSecret(mysql0, content(Map.of("a", "b")).label("M").build());
            createUnitSecret(mysql1, content(Map.of("a", "b")).label("M").build());

            assertEquals(5, service.listAllSecrets().await().atMost(TIMEOUT).size());
        }

        @Test
        @DisplayName("should let a secret keep its own label on update")
        void shouldKeepOwnLabel() {
            final var uri = createAppSecret(mysql, content(Map.of("a", "b")).label("L").build());

            update(uri, UpsertSecretParams.builder().label("L").description("same label").build());

            assertEquals("same label", service.getSecret(uri).await().atMost(TIMEOUT).description());
        }

        @Test
        @DisplayName("should reject relabelling onto a taken label")
        void shouldRejectRelabelOntoTakenLabel() {
            createUserSecret(content(Map.of("a", "b")).label("taken").build());
            final var uri = createUserSecret(content(Map.of("c", "d")).label("free").build());

            assertThrows(
                    SecretLabelAlreadyExistsException.class,
                    () -> update(uri, UpsertSecretParams.builder().label("taken").build()));
            assertEquals("free", service.getSecret(uri).await().atMost(TIMEOUT).label());
        }
    }

    @Nested
    @DisplayName("updateSecret()")
    class UpdateSecretTests {

        @Test
        @DisplayName("should require content or metadata before looking up the secret")
        void shouldRequireContentOrMetadata() {
            final var exception = assertThrows(
                    IllegalArgumentException.class,
                    () -> update(SecretUri.newUri(), UpsertSecretParams.builder().build()));

            assertEquals("must specify a new value or metadata to update a secret", exception.getMessage());
        }

        @Test
        @DisplayName("should fail for an unknown secret")
        void shouldFailForUnknownSecret() {
            assertThrows(
                    SecretNotFoundException.class,
                    () -> update(SecretUri.newUri(), UpsertSecretParams.builder().description("x").build()));
        }

        @Test
        @DisplayName("should require a revision ID with new content")
        void shouldRequireRevisionIdWithContent() {
            final var uri = createUserSecret(content(Map.of("a", "b")).build());

            final var exception = assertThrows(
                    IllegalArgumentException.class,
                    () -> update(uri, UpsertSecretParams.builder().data(Map.of("a", "c")).build()));

            assertEquals("revision ID must be provided", exception.getMessage());
        }

        @Test
        @DisplayName("should number revisions without gaps")
        void shouldNumberRevisionsWithoutGaps() {
            final var uri = createUserSecret(content(Map.of("v", "1")).build());
            for (int i = 2; i <= 5; i++) {
                update(uri, content(Map.of("v", String.valueOf(i))).build());
            }

            final var revisions = service.getSecretByUri(uri, null).await().atMost(TIMEOUT).revisions();

            assertEquals(List.of(1, 2, 3, 4, 5), revisions.stream().map(r -> r.revision()).toList());
            assertEquals(5, service.getLatestRevision(uri).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should not create a revision for unchanged content")
        void shouldSkipUnchangedContent() {
            final var uri = createUserSecret(content(Map.of("foo", "bar")).build());

            update(uri, content(Map.of("foo", "bar")).build());

            assertEquals(1, service.getLatestRevision(uri).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should mark the previous revision obsolete when nobody consumes it")
        void shouldMarkPreviousRevisionObsolete() {
            final var uri = createUserSecret(content(Map.of("foo", "bar")).label("my label").build());

            update(uri, content(Map.of("foo", "bar2")).build());

            final var first = service.getSecretByUri(uri, 1).await().atMost(TIMEOUT).revisions().get(0);
            assertTrue(first.obsolete());
            assertTrue(first.pendingDelete());
            assertEquals(Map.of("foo", "bar2"), service.getSecretValue(uri, 2).await().atMost(TIMEOUT).data());
            assertEquals(uri, service.getUserSecretUriByLabel("my label").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should create a revision when values differ only in where a newline splits them")
        void shouldTellApartContentThatFlattensAlike() {
            final Map<String, String> split = new LinkedHashMap<>();
            split.put("cfg", "x=1");
            split.put("y", "2");
            final var uri = createUserSecret(content(split).revisionId("r1").build());

            update(uri, content(Map.of("cfg", "x=1\ny=2")).revisionId("r2").build());

            assertEquals(2, service.getLatestRevision(uri).await().atMost(TIMEOUT));
            assertEquals(Map.of("cfg", "x=1\ny=2"), service.getSecretValue(uri, 2).await().atMost(TIMEOUT).data());
        }

        @Test
        @DisplayName("should remove the rotation schedule for policy never")
        void shouldRemoveRotationForNever() {
            final var uri = createAppSecret(
                    mysql, content(Map.of("a", "b")).rotatePolicy(RotatePolicy.HOURLY).build());

            update(uri, UpsertSecretParams.builder().rotatePolicy(RotatePolicy.NEVER).build());

            final var metadata = service.getSecret(uri).await().atMost(TIMEOUT);
            assertEquals(RotatePolicy.NEVER, metadata.rotatePolicy());
            assertNull(metadata.nextRotateTime());
        }

        @Test
        @DisplayName("should apply an expire time without content to the latest revision")
        void shouldApplyExpireTimeToLatestRevision() {
            final var uri = createUserSecret(content(Map.of("a", "b")).build());
            update(uri, content(Map.of("a", "c")).build());
            final var expire = Instant.now().plus(1, ChronoUnit.DAYS);

            update(uri, UpsertSecretParams.builder().expireTime(expire).build());

            final var revision = service.getSecretByUri(uri, 2).await().atMost(TIMEOUT).revisions().get(0);
            assertEquals(expire, revision.expireTime());
        }

        @Test
        @DisplayName("should reject auto-prune on charm secrets")
        void shouldRejectAutoPrune() {
            final var uri = createAppSecret(mysql, content(Map.of("a", "b")).build());

            assertThrows(
                    AutoPruneNotSupportedException.class,
                    () -> update(uri, UpsertSecretParams.builder().autoPrune(true).build()));
        }
    }

    @Nested
    @DisplayName("reads")
    class ReadTests {

        @Test
        @DisplayName("should return revision content")
        void shouldReturnRevisionContent() {
            final var uri = createUserSecret(content(Map.of("foo", "bar")).build());

            assertEquals(
                    Map.of("foo", "bar"),
                    service.getSecretValue(uri, 1).await().atMost(TIMEOUT).data());
        }

        @Test
        @DisplayName("should return a value reference")
        void shouldReturnValueReference() {
            final var ref = new ValueRef("backend-1", "rev-1");
            final var uri = createUserSecret(UpsertSecretParams.builder()
                    .revisionId(UUID.randomUUID().toString())
                    .valueRef(ref)
                    .build());

            assertEquals(ref, service.getSecretValue(uri, 1).await().atMost(TIMEOUT).valueRef());
        }

        @Test
        @DisplayName("should fail for a missing revision")
        void shouldFailForMissingRevision() {
            final var uri = createUserSecret(content(Map.of("foo", "bar")).build());

            final var exception = assertThrows(
                    SecretRevisionNotFoundException.class,
                    () -> service.getSecretValue(uri, 7).await().atMost(TIMEOUT));
            assertEquals("secret revision not found: " + uri + "/7", exception.getMessage());
            assertThrows(
                    SecretRevisionNotFoundException.class,
                    () -> service.getSecretByUri(uri, 7).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should require view access for accessor reads")
        void shouldRequireViewAccess() {
            final var uri = createAppSecret(mysql, content(Map.of("a", "b")).build());
            final var wordpress = topology.addApplication("wordpress");

            assertEquals(
                    Map.of("a", "b"),
                    service.getSecretValue(uri, 1, Accessor.unit(mysql0.uuid())).await().atMost(TIMEOUT).data());
            assertThrows(
                    SecretAccessDeniedException.class,
                    () -> service.getSecretValue(uri, 1, Accessor.application(wordpress.uuid()))
                            .await()
                            .atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should list charm secrets by owner")
        void shouldListCharmSecrets() {
            final var appSecret = createAppSecret(mysql, content(Map.of("a", "b")).build());
            final var unitSecret = createUnitSecret(mysql1, content(Map.of("a", "b")).build());
            createUserSecret(content(Map.of("a", "b")).build());

            final var listed = service.listCharmSecrets(Set.of(mysql.uuid()), Set.of(mysql1.uuid()))
                    .await()
                    .atMost(TIMEOUT);

            assertEquals(
                    Set.of(appSecret, unitSecret),
                    Set.copyOf(listed.stream().map(s -> s.metadata().uri()).toList()));
            assertThrows(
                    IllegalArgumentException.class,
                    () -> service.listCharmSecrets(Set.of(), Set.of()).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should list secrets by label and owner")
        void shouldListByLabels() {
            final var first = createAppSecret(mysql, content(Map.of("a", "b")).label("one").build());
            createUserSecret(content(Map.of("a", "b")).label("one").build());

            final var all = service.listSecretsByLabels(Set.of("one"), null).await().atMost(TIMEOUT);
            final var owned = service.listSecretsByLabels(Set.of("one"), Owner.application(mysql.uuid()))
                    .await()
                    .atMost(TIMEOUT);

            assertEquals(2, all.size());
            assertEquals(List.of(first), owned.stream().map(m -> m.uri()).toList());
        }

        @Test
        @DisplayName("should find user secrets by label")
        void shouldFindUserSecretByLabel() {
            final var uri = createUserSecret(content(Map.of("a", "b")).label("db-password").build());

            assertEquals(uri, service.getUserSecretUriByLabel("db-password").await().atMost(TIMEOUT));
            assertThrows(
                    SecretNotFoundException.class,
                    () -> service.getUserSecretUriByLabel("missing").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should fail latest revisions when any secret is missing")
        void shouldFailLatestRevisionsForMissingSecret() {
            final var uri = createUserSecret(content(Map.of("a", "b")).build());

            assertEquals(Map.of(uri, 1), service.getLatestRevisions(List.of(uri)).await().atMost(TIMEOUT));
            assertThrows(
                    SecretNotFoundException.class,
                    () -> service.getLatestRevisions(List.of(uri, SecretUri.newUri()))
                            .await()
                            .atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should report rotation and expiry info")
        void shouldReportRotationExpiryInfo() {
            final var next = Instant.now().plus(3, ChronoUnit.HOURS);
            final var uri = createAppSecret(mysql, content(Map.of("a", "b"))
                    .rotatePolicy(RotatePolicy.WEEKLY)
                    .nextRotateTime(next)
                    .build());

            final var info = service.getRotationExpiryInfo(uri).await().atMost(TIMEOUT);

            assertEquals(RotatePolicy.WEEKLY, info.rotatePolicy());
            assertEquals(next, info.nextRotateTime());
            assertEquals(1, info.latestRevision());
            assertNull(info.latestExpireTime());
            assertEquals(RotatePolicy.WEEKLY, service.getRotatePolicy(uri).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should return the caller supplied revision ID")
        void shouldReturnRevisionId() {
            final var uri = createUserSecret(content(Map.of("a", "b")).revisionId("rev-one").build());

            assertEquals("rev-one", service.getSecretRevisionId(uri, 1).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should list secret IDs owned by applications and units")
        void shouldListOwnedSecretIds() {
            final var appSecret = createAppSecret(mysql, content(Map.of("a", "b")).build());
            createUnitSecret(mysql0, content(Map.of("a", "b")).build());

            final var ids = service.getOwnedSecretIds(Set.of(mysql.uuid()), Set.of())
                    .await()
                    .atMost(TIMEOUT);

            assertEquals(List.of(appSecret.id()), ids);
        }
    }

    @Nested
    @DisplayName("deleteSecret()")
    class DeleteSecretTests {

        @Test
        @DisplayName("should delete the secret with everything attached")
        void shouldDeleteEverything() {
            final var uri = createAppSecret(mysql, content(Map.of("a", "b"))
                    .revisionId("r1")
                    .rotatePolicy(RotatePolicy.DAILY)
                    .build());
            update(uri, content(Map.of("a", "c")).revisionId("r2").build());

            final var deleted = service.deleteSecret(uri, null).await().atMost(TIMEOUT);

            assertEquals(List.of("r1", "r2"), deleted);
            assertEquals(0, store.size(Relations.SECRETS));
            assertEquals(0, store.size(Relations.REVISIONS));
            assertEquals(0, store.size(Relations.GRANTS));
            assertEquals(0, store.size(Relations.ROTATIONS));
            assertThrows(SecretNotFoundException.class, () -> service.getSecret(uri).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should delete only the named revisions")
        void shouldDeleteNamedRevisions() {
            final var uri = createUserSecret(content(Map.of("a", "b")).revisionId("r1").build());
            update(uri, content(Map.of("a", "c")).revisionId("r2").build());

            final var deleted = service.deleteSecret(uri, List.of(1)).await().atMost(TIMEOUT);

            assertEquals(List.of("r1"), deleted);
            final var remaining = service.getSecretByUri(uri, null).await().atMost(TIMEOUT);
            assertEquals(List.of(2), remaining.revisions().stream().map(r -> r.revision()).toList());
        }

        @Test
        @DisplayName("should clear obsolete flags on the revision that becomes latest")
        void shouldClearObsoleteFlagsOnNewLatest() {
            final var uri = createUserSecret(content(Map.of("a", "b")).revisionId("r1").build());
            update(uri, content(Map.of("a", "c")).revisionId("r2").autoPrune(true).build());
            assertTrue(service.getSecretByUri(uri, 1).await().atMost(TIMEOUT).revisions().get(0).pendingDelete());

            service.deleteSecret(uri, List.of(2)).await().atMost(TIMEOUT);

            final var latest = service.getSecretByUri(uri, 1).await().atMost(TIMEOUT).revisions().get(0);
            assertFalse(latest.obsolete());
            assertFalse(latest.pendingDelete());
            assertEquals(1, service.getLatestRevision(uri).await().atMost(TIMEOUT));
            final var pruned = new SecretObsolescenceService(store)
                    .deleteObsoleteUserSecretRevisions()
                    .await()
                    .atMost(TIMEOUT);
            assertTrue(pruned.isEmpty());
            assertEquals(1, service.getLatestRevision(uri).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should delete the secret when its only revision is named")
        void shouldDeleteSecretWithOnlyRevision() {
            final var uri = createUserSecret(content(Map.of("a", "b")).build());

            service.deleteSecret(uri, List.of(1)).await().atMost(TIMEOUT);

            assertThrows(SecretNotFoundException.class, () -> service.getSecret(uri).await().atMost(TIMEOUT));
        }
    }
}
