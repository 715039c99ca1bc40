package strongbox.core.model.error;

/**
 * Thrown when auto-prune is requested for a secret not owned by the model.
 */
public class AutoPruneNotSupportedException extends SecretDomainException {

    public AutoPruneNotSupportedException(Object uri) {
        super("auto prune is not supported for charm secret " + uri);
    }
}
