package strongbox.core.model.secret;

/**
 * A resolved unit of the model.
 *
 * @param uuid            unit UUID
 * @param name            unit name, e.g. {@code mysql/0}
 * @param applicationUuid UUID of the unit's application
 */
public record UnitRef(String uuid, String name, String applicationUuid) {}
