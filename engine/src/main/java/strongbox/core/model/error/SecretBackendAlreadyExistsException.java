package strongbox.core.model.error;

public class SecretBackendAlreadyExistsException extends SecretDomainException {

    public SecretBackendAlreadyExistsException(String name) {
        super("secret backend already exists: name \"" + name + "\"");
    }
}
