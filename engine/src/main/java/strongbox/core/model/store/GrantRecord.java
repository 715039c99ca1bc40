package strongbox.core.model.store;

import strongbox.core.model.access.AccessScope;
import strongbox.core.model.access.Accessor;
import strongbox.core.model.access.SecretRole;

/**
 * Stored grant. At most one row exists per secret and subject.
 */
public record GrantRecord(String secretId, AccessScope scope, Accessor subject, SecretRole role) {

    public Key key() {
        return new Key(secretId, subject);
    }

    public record Key(String secretId, Accessor subject) {}
}
