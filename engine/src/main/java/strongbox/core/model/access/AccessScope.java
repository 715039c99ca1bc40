package strongbox.core.model.access;

import java.util.Objects;

/**
 * The entity whose lifetime bounds a grant.
 *
 * @param kind scope kind
 * @param id   UUID of the scoping unit, application, relation or model
 */
public record AccessScope(AccessScopeKind kind, String id) {

    public AccessScope {
        Objects.requireNonNull(kind, "scope kind cannot be null");
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("scope ID cannot be null or blank");
        }
    }

    public static AccessScope unit(String unitUuid) {
        return new AccessScope(AccessScopeKind.UNIT, unitUuid);
    }

    public static AccessScope application(String applicationUuid) {
        return new AccessScope(AccessScopeKind.APPLICATION, applicationUuid);
    }

    public static AccessScope relation(String relationUuid) {
        return new AccessScope(AccessScopeKind.RELATION, relationUuid);
    }

    public static AccessScope model(String modelUuid) {
        return new AccessScope(AccessScopeKind.MODEL, modelUuid);
    }
}
