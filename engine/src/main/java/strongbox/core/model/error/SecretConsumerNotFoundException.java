package strongbox.core.model.error;

/**
 * Thrown when a unit reads a secret it has never consumed.
 *
 * <p>The latest revision of the secret is carried along so that a first-time
 * consumer can bootstrap without a second query.
 */
public class SecretConsumerNotFoundException extends SecretDomainException {

    private final int latestRevision;

    public SecretConsumerNotFoundException(String message, int latestRevision) {
        super(message);
        this.latestRevision = latestRevision;
    }

    /** Returns the latest revision of the secret at the time of the lookup. */
    public int latestRevision() {
        return latestRevision;
    }
}
