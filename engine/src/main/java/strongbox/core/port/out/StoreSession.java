package strongbox.core.port.out;

import strongbox.core.model.store.Relation;
import strongbox.core.model.store.TransactionMode;

/**
 * An open unit of work against a {@link SecretStore}.
 *
 * <p>Every store operation of a multi-step algorithm goes through the same
 * session, so the algorithm commits or rolls back as a whole. Sessions are not
 * thread-safe and must be finished by the thread that began them.
 */
public interface StoreSession {

    TransactionMode mode();

    /**
     * Access a relation within this unit of work.
     */
    <K, R> RelationView<K, R> relation(Relation<K, R> relation);

    /**
     * Publish the changes made in this session.
     *
     * @throws IllegalStateException if the session is no longer active
     */
    void commit();

    /**
     * Discard the changes made in this session. Calling it on a finished
     * session has no effect.
     */
    void rollback();

    boolean isActive();
}
