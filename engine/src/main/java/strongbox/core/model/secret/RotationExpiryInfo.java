package strongbox.core.model.secret;

import java.time.Instant;

/**
 * Scheduling attributes of one secret.
 */
public record RotationExpiryInfo(
        RotatePolicy rotatePolicy, Instant latestExpireTime, Instant nextRotateTime, int latestRevision) {}
