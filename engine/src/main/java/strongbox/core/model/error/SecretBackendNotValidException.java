package strongbox.core.model.error;

public class SecretBackendNotValidException extends SecretDomainException {

    public SecretBackendNotValidException(String reason) {
        super("secret backend not valid: " + reason);
    }
}
