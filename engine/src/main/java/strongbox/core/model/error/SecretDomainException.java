package strongbox.core.model.error;

/**
 * Base type for the typed errors raised by the secret engine.
 *
 * <p>Callers distinguish conditions by type, never by message. Messages are
 * stable but intended for humans.
 */
public abstract class SecretDomainException extends RuntimeException {

    protected SecretDomainException(String message) {
        super(message);
    }

    protected SecretDomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
