package strongbox.core.model.secret;

import java.time.Instant;

/**
 * @param uri             the secret
 * @param latestRevision  its latest revision
 * @param nextTriggerTime when the rotate hook should next fire
 */
public record RotationInfo(SecretUri uri, int latestRevision, Instant nextTriggerTime) {}
