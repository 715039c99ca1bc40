package strongbox.core.model.secret;

/**
 * Result of reading a consumer record.
 *
 * @param consumer       the consumer record
 * @param latestRevision latest revision of the consumed secret
 */
public record ConsumerLookup(SecretConsumer consumer, int latestRevision) {}
