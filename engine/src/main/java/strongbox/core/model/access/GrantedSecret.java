package strongbox.core.model.access;

import strongbox.core.model.secret.SecretUri;

/**
 * A backend-held revision of a secret some accessor has been granted.
 *
 * @param uri        the secret
 * @param revisionId backend-local revision identifier
 */
public record GrantedSecret(SecretUri uri, String revisionId) {}
