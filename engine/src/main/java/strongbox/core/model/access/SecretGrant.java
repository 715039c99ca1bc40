package strongbox.core.model.access;

import java.util.Objects;

/**
 * A capability record: the subject holds the role on a secret for as long as
 * the scope exists.
 *
 * @param scope   bounding scope
 * @param subject grantee
 * @param role    VIEW or MANAGE
 */
public record SecretGrant(AccessScope scope, Accessor subject, SecretRole role) {

    public SecretGrant {
        Objects.requireNonNull(scope, "scope cannot be null");
        Objects.requireNonNull(subject, "subject cannot be null");
        if (role == null || role == SecretRole.NONE) {
            throw new IllegalArgumentException("grant role must be view or manage");
        }
    }
}
