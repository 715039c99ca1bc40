package strongbox.core.model.error;

/**
 * Thrown when a grant would move a subject to a different scope kind while
 * its existing grant is still active.
 */
public class InvalidSecretPermissionChangeException extends SecretDomainException {

    public InvalidSecretPermissionChangeException(String message) {
        super(message);
    }
}
