package strongbox.core.model.error;

/**
 * Thrown when a secret exists but the requested revision does not.
 */
public class SecretRevisionNotFoundException extends SecretDomainException {

    public SecretRevisionNotFoundException(String message) {
        super(message);
    }

    public static SecretRevisionNotFoundException forRevision(Object uri, int revision) {
        return new SecretRevisionNotFoundException("secret revision not found: " + uri + "/" + revision);
    }

    public static SecretRevisionNotFoundException forRevisionId(String revisionId) {
        return new SecretRevisionNotFoundException("secret revision not found: " + revisionId);
    }
}
