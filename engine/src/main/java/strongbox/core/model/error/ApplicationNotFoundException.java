package strongbox.core.model.error;

public class ApplicationNotFoundException extends SecretDomainException {

    public ApplicationNotFoundException(String application) {
        super("application not found: " + application);
    }
}
