package strongbox.core.service.secret;

import java.util.ArrayList;
import java.util.List;

import strongbox.core.model.access.Accessor;
import strongbox.core.model.access.SecretRole;
import strongbox.core.model.store.GrantRecord;
import strongbox.core.model.store.Relations;
import strongbox.core.port.out.OwnerResolver;
import strongbox.core.port.out.StoreSession;

/**
 * Resolves the effective role of an accessor on a secret.
 *
 * <p>A unit is matched by its own grants, its application's grants and the
 * model's grants; an application by its own and the model's. The highest
 * role wins.
 */
final class AccessResolver {

    private AccessResolver() {}

    static SecretRole resolve(StoreSession session, OwnerResolver resolver, String secretId, Accessor accessor) {
        final var grants = session.relation(Relations.GRANTS);
        var role = SecretRole.NONE;
        for (Accessor candidate : candidates(resolver, accessor)) {
            role = role.max(grants.get(new GrantRecord.Key(secretId, candidate))
                    .map(GrantRecord::role)
                    .orElse(SecretRole.NONE));
        }
        return role;
    }

    private static List<Accessor> candidates(OwnerResolver resolver, Accessor accessor) {
        final List<Accessor> candidates = new ArrayList<>();
        candidates.add(accessor);
        switch (accessor.kind()) {
            case UNIT -> {
                resolver.unitByUuid(accessor.id())
                        .ifPresent(unit -> candidates.add(Accessor.application(unit.applicationUuid())));
                candidates.add(Accessor.model(resolver.modelUuid()));
            }
            case APPLICATION -> candidates.add(Accessor.model(resolver.modelUuid()));
            case MODEL -> {
                // a model accessor only matches its own grants
            }
        }
        return candidates;
    }
}
