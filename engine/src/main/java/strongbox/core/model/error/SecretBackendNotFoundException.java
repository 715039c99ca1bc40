package strongbox.core.model.error;

public class SecretBackendNotFoundException extends SecretDomainException {

    public SecretBackendNotFoundException(String message) {
        super(message);
    }

    public static SecretBackendNotFoundException forId(String backendId) {
        return new SecretBackendNotFoundException("secret backend not found: \"" + backendId + "\"");
    }

    public static SecretBackendNotFoundException forName(String name) {
        return new SecretBackendNotFoundException("secret backend not found: name \"" + name + "\"");
    }
}
