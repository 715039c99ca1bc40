package strongbox.core.model.store;

import java.time.Instant;

/**
 * Expiry schedule of one revision.
 */
public record ExpiryRecord(String revisionId, String secretId, Instant expireTime) {}
