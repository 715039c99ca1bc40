package strongbox.core.model.secret;

import java.time.Instant;

/**
 * @param uri             the secret
 * @param revision        the expiring revision
 * @param revisionId      correlation ID of the expiring revision
 * @param nextTriggerTime when the revision expires
 */
public record ExpiryInfo(SecretUri uri, int revision, String revisionId, Instant nextTriggerTime) {}
