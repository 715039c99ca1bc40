package strongbox.core.model.secret;

import java.util.Objects;

/**
 * Owner of a secret.
 *
 * <p>When passed into the engine the id is the owner's UUID. When reported
 * back in {@link SecretMetadata} it is the owner's name: the application
 * name, the unit name, or the model UUID.
 *
 * @param kind the owner kind
 * @param id   UUID or name, depending on direction
 */
public record Owner(OwnerKind kind, String id) {

    public Owner {
        Objects.requireNonNull(kind, "kind cannot be null");
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("owner ID cannot be null or blank");
        }
    }

    public static Owner model(String modelUuid) {
        return new Owner(OwnerKind.MODEL, modelUuid);
    }

    public static Owner application(String applicationUuid) {
        return new Owner(OwnerKind.APPLICATION, applicationUuid);
    }

    public static Owner unit(String unitUuid) {
        return new Owner(OwnerKind.UNIT, unitUuid);
    }

    /**
     * Whether the owner is the model, i.e. the secret is a user secret.
     */
    public boolean isModel() {
        return kind == OwnerKind.MODEL;
    }
}
