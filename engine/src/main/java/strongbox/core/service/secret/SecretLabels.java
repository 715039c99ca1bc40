package strongbox.core.service.secret;

import java.util.HashSet;
import java.util.Set;

import strongbox.core.model.error.SecretLabelAlreadyExistsException;
import strongbox.core.model.secret.OwnerKind;
import strongbox.core.model.secret.UnitRef;
import strongbox.core.model.store.Relations;
import strongbox.core.model.store.SecretRecord;
import strongbox.core.port.out.OwnerResolver;
import strongbox.core.port.out.StoreSession;

/**
 * Label uniqueness across owner scopes.
 *
 * <p>User secret labels are unique in the model. An application shares its
 * label space with its units: an application label clashes with labels of the
 * application and of every one of its units, and a unit label clashes with
 * labels of the unit and of its application. Units of one application do not
 * clash with each other.
 */
final class SecretLabels {

    private SecretLabels() {}

    /**
     * @param excludeSecretId secret whose own label is ignored, may be null
     * @throws SecretLabelAlreadyExistsException if the label is taken in the owner's scope
     */
    static void ensureAvailable(
            StoreSession session,
            OwnerResolver resolver,
            OwnerKind ownerKind,
            String ownerUuid,
            String label,
            String excludeSecretId) {
        if (label == null || label.isEmpty()) {
            return;
        }
        final var clash = session.relation(Relations.SECRETS).exists(secret -> label.equals(secret.label())
                && !secret.id().equals(excludeSecretId)
                && sharesLabelScope(resolver, ownerKind, ownerUuid, secret));
        if (clash) {
            throw new SecretLabelAlreadyExistsException(label);
        }
    }

    private static boolean sharesLabelScope(
            OwnerResolver resolver, OwnerKind ownerKind, String ownerUuid, SecretRecord other) {
        return switch (ownerKind) {
            case MODEL -> other.isUserSecret();
            case APPLICATION -> other.ownedBy(OwnerKind.APPLICATION, ownerUuid)
                    || (other.ownerKind() == OwnerKind.UNIT
                            && unitUuidsOf(resolver, ownerUuid).contains(other.ownerUuid()));
            case UNIT -> other.ownedBy(OwnerKind.UNIT, ownerUuid)
                    || resolver.unitByUuid(ownerUuid)
                            .map(unit -> other.ownedBy(OwnerKind.APPLICATION, unit.applicationUuid()))
                            .orElse(false);
        };
    }

    private static Set<String> unitUuidsOf(OwnerResolver resolver, String applicationUuid) {
        final Set<String> uuids = new HashSet<>();
        for (UnitRef unit : resolver.unitsOf(applicationUuid)) {
            uuids.add(unit.uuid());
        }
        return uuids;
    }
}
