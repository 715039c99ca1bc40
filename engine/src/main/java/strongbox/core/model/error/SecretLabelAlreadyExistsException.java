package strongbox.core.model.error;

/**
 * Thrown when a label collides within the owner's label scope.
 */
public class SecretLabelAlreadyExistsException extends SecretDomainException {

    public SecretLabelAlreadyExistsException(String label) {
        super("secret label already exists: \"" + label + "\"");
    }
}
