package strongbox.core.model.store;

/**
 * Local unit consuming a secret. The secret may be owned by another model,
 * in which case {@code sourceModelUuid} is set.
 */
public record ConsumerRecord(
        String secretId, String sourceModelUuid, String unitUuid, String label, int currentRevision) {

    public Key key() {
        return new Key(secretId, unitUuid);
    }

    public record Key(String secretId, String unitUuid) {}
}
