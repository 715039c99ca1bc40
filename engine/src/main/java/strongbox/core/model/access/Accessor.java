package strongbox.core.model.access;

import java.util.Objects;

/**
 * The subject of a grant, or the party asking for access.
 *
 * @param kind accessor kind
 * @param id   UUID of the unit, application or model
 */
public record Accessor(AccessorKind kind, String id) {

    public Accessor {
        Objects.requireNonNull(kind, "accessor kind cannot be null");
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("accessor ID cannot be null or blank");
        }
    }

    public static Accessor unit(String unitUuid) {
        return new Accessor(AccessorKind.UNIT, unitUuid);
    }

    public static Accessor application(String applicationUuid) {
        return new Accessor(AccessorKind.APPLICATION, applicationUuid);
    }

    public static Accessor model(String modelUuid) {
        return new Accessor(AccessorKind.MODEL, modelUuid);
    }
}
