package strongbox.core.port.in;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;

import strongbox.core.model.access.Accessor;
import strongbox.core.model.access.GrantedSecret;
import strongbox.core.model.access.SecretGrant;
import strongbox.core.model.access.SecretRole;
import strongbox.core.model.secret.SecretUri;

/**
 * Port for granting, revoking and resolving access to secrets.
 */
public interface SecretAccessManagement {

    /**
     * Grant a role to a subject.
     *
     * <p>A subject holds at most one grant per secret. Granting again under a scope
     * of the same kind replaces scope and role; a different scope kind is rejected.
     */
    Uni<Void> grantAccess(SecretUri uri, SecretGrant grant);

    Uni<Void> revokeAccess(SecretUri uri, Accessor subject);

    /**
     * Resolve the highest role the accessor holds, directly or through its
     * application or the model.
     *
     * @return Uni with the role, {@link SecretRole#NONE} when there is no grant
     */
    Uni<SecretRole> getSecretAccess(SecretUri uri, Accessor accessor);

    /**
     * @return Uni with the relation UUID when the subject's grant is relation scoped
     */
    Uni<Optional<String>> getSecretAccessRelationScope(SecretUri uri, Accessor subject);

    /**
     * @return Uni with the grants holding exactly {@code role}
     */
    Uni<List<SecretGrant>> getSecretGrants(SecretUri uri, SecretRole role);

    /**
     * @return Uni with every grant keyed by secret ID
     */
    Uni<Map<String, List<SecretGrant>>> allSecretGrants();

    /**
     * List backend revision IDs of secrets any accessor holds at least {@code role} on.
     */
    Uni<List<GrantedSecret>> listGrantedSecretsForBackend(String backendId, Set<Accessor> accessors, SecretRole role);
}
