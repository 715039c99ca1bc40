package strongbox.core.model.secret;

/**
 * A resolved application of the model.
 */
public record ApplicationRef(String uuid, String name) {}
