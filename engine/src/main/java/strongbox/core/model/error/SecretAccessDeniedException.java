package strongbox.core.model.error;

/**
 * Thrown when an accessor reads secret content without at least view access.
 */
public class SecretAccessDeniedException extends SecretDomainException {

    public SecretAccessDeniedException(String message) {
        super(message);
    }
}
