package strongbox.core.model.store;

/**
 * Unit of another model consuming a local secret, keyed by unit name.
 */
public record RemoteConsumerRecord(String secretId, String unitName, int currentRevision) {

    public Key key() {
        return new Key(secretId, unitName);
    }

    public record Key(String secretId, String unitName) {}
}
