package strongbox.core.model.secret;

/**
 * A secret owned by another model and consumed by a local unit.
 *
 * @param uri             secret URI, qualified with its source model
 * @param unitName        consuming unit
 * @param label           consumer label, may be null
 * @param currentRevision revision the unit has acknowledged
 * @param latestRevision  latest revision known for the secret
 */
public record RemoteSecretInfo(SecretUri uri, String unitName, String label, int currentRevision, int latestRevision) {}
