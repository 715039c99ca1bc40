package strongbox.core.model.secret;

/**
 * Consumer-side tracking of a secret.
 *
 * @param label           the consumer's private alias for the secret, may be null
 * @param currentRevision revision the consumer has acknowledged
 */
public record SecretConsumer(String label, int currentRevision) {

    public SecretConsumer {
        if (currentRevision < 0) {
            throw new IllegalArgumentException("current revision cannot be negative");
        }
    }

    public SecretConsumer withCurrentRevision(int revision) {
        return new SecretConsumer(label, revision);
    }

    public SecretConsumer withLabel(String newLabel) {
        return new SecretConsumer(newLabel, currentRevision);
    }
}
