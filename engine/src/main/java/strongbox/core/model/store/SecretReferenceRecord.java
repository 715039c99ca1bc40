package strongbox.core.model.store;

/**
 * Local view of a secret owned by another model: only its latest revision
 * number is tracked here.
 */
public record SecretReferenceRecord(String secretId, String sourceModelUuid, int latestRevision) {}
