package strongbox.core.port.in;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.smallrye.mutiny.Uni;

import strongbox.core.model.access.Accessor;
import strongbox.core.model.secret.Owner;
import strongbox.core.model.secret.RotatePolicy;
import strongbox.core.model.secret.RotationExpiryInfo;
import strongbox.core.model.secret.SecretContent;
import strongbox.core.model.secret.SecretMetadata;
import strongbox.core.model.secret.SecretUri;
import strongbox.core.model.secret.SecretWithRevisions;
import strongbox.core.model.secret.UpsertSecretParams;

/**
 * Port for creating, updating, reading and deleting secrets and their revisions.
 *
 * <p>Every mutating call runs as a single unit of work against the secret store.
 * Domain failures are delivered as failed Unis carrying a
 * {@link strongbox.core.model.error.SecretDomainException}.
 */
public interface SecretManagement {

    /**
     * Create a secret together with its first revision.
     *
     * <p>A {@link strongbox.core.model.secret.OwnerKind#MODEL} owner creates a
     * user secret. The owner is granted manage access on the new secret.
     *
     * @param uri     URI to use, or null to generate one
     * @param owner   owner, identified by UUID
     * @param version secret schema version
     * @param params  revision ID and content are required
     * @return Uni with the URI of the new secret
     * @throws IllegalArgumentException if no revision ID is supplied
     */
    Uni<SecretUri> createSecret(SecretUri uri, Owner owner, int version, UpsertSecretParams params);

    /**
     * Update content and/or metadata of a secret.
     *
     * <p>New content with the checksum of the latest revision does not create a revision.
     *
     * @return Uni completing when the update is stored
     * @throws IllegalArgumentException if neither content nor metadata is supplied
     */
    Uni<Void> updateSecret(SecretUri uri, UpsertSecretParams params);

    Uni<SecretMetadata> getSecret(SecretUri uri);

    /**
     * Get a secret with its revisions.
     *
     * @param revision a single revision to return, or null for all kept revisions
     */
    Uni<SecretWithRevisions> getSecretByUri(SecretUri uri, Integer revision);

    Uni<List<SecretMetadata>> listAllSecrets();

    /**
     * List secrets owned by any of the given applications or units.
     *
     * @throws IllegalArgumentException if both owner sets are empty
     */
    Uni<List<SecretWithRevisions>> listCharmSecrets(Set<String> appOwners, Set<String> unitOwners);

    /**
     * List secrets carrying one of the labels.
     *
     * @param owner restricts the result to secrets of this owner, may be null
     */
    Uni<List<SecretMetadata>> listSecretsByLabels(Set<String> labels, Owner owner);

    /**
     * Delete a secret or some of its revisions.
     *
     * <p>Without revisions, or when every remaining revision is named, the secret
     * is removed together with its consumers, grants and schedules.
     *
     * @param revisions revision numbers to delete, or null for all
     * @return Uni with the IDs of the deleted revisions
     */
    Uni<List<String>> deleteSecret(SecretUri uri, Collection<Integer> revisions);

    Uni<SecretContent> getSecretValue(SecretUri uri, int revision);

    /**
     * Read revision content on behalf of an accessor holding at least view access.
     */
    Uni<SecretContent> getSecretValue(SecretUri uri, int revision, Accessor accessor);

    Uni<Integer> getLatestRevision(SecretUri uri);

    /**
     * @return Uni with the latest revision of every URI
     */
    Uni<Map<SecretUri, Integer>> getLatestRevisions(Collection<SecretUri> uris);

    Uni<RotatePolicy> getRotatePolicy(SecretUri uri);

    Uni<RotationExpiryInfo> getRotationExpiryInfo(SecretUri uri);

    /**
     * @return Uni with the caller-supplied ID of the revision
     */
    Uni<String> getSecretRevisionId(SecretUri uri, int revision);

    Uni<SecretUri> getUserSecretUriByLabel(String label);

    /**
     * @return Uni with the IDs of secrets owned by any of the given applications or units
     */
    Uni<List<String>> getOwnedSecretIds(Set<String> appOwners, Set<String> unitOwners);
}
