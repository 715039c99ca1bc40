package strongbox.core.model.store;

import java.time.Instant;

/**
 * Rotation schedule of one secret.
 */
public record RotationRecord(String secretId, Instant nextRotateTime) {}
