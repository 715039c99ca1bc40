package strongbox.core.model.error;

/**
 * Thrown when deleting a backend that revisions still point at.
 */
public class SecretBackendInUseException extends SecretDomainException {

    public SecretBackendInUseException(String backendId, long revisionCount) {
        super("secret backend \"" + backendId + "\" is still in use by " + revisionCount + " revision(s)");
    }
}
