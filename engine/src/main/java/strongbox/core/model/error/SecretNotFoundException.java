package strongbox.core.model.error;

/**
 * Thrown when a secret URI has no matching secret.
 */
public class SecretNotFoundException extends SecretDomainException {

    public SecretNotFoundException(String message) {
        super(message);
    }

    public static SecretNotFoundException forUri(Object uri) {
        return new SecretNotFoundException("secret not found: " + uri);
    }
}
