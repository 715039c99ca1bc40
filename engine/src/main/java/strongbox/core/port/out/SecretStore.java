package strongbox.core.port.out;

import java.util.function.Function;

import io.smallrye.mutiny.Uni;

import strongbox.core.model.store.TransactionMode;

/**
 * Transactional row store holding the secret relations of one model.
 *
 * <p>Implementations must give serializable isolation to
 * {@link TransactionMode#READ_WRITE} sessions. The engine never retries a
 * failed unit of work; conflict handling belongs to the caller.
 */
public interface SecretStore {

    /**
     * Begin a unit of work.
     *
     * @param mode read-only or read-write
     * @return an active session; the caller must commit or roll it back
     */
    StoreSession begin(TransactionMode mode);

    /**
     * Run {@code work} in a read-write unit of work.
     *
     * <p>The session commits when {@code work} returns and rolls back if it
     * throws; the exception is delivered as the failure of the returned Uni.
     *
     * @param work the unit of work
     * @return Uni with the result of {@code work}
     */
    default <T> Uni<T> inTransaction(Function<StoreSession, T> work) {
        return run(TransactionMode.READ_WRITE, work);
    }

    /**
     * Run {@code work} against the last committed state.
     */
    default <T> Uni<T> read(Function<StoreSession, T> work) {
        return run(TransactionMode.READ_ONLY, work);
    }

    private <T> Uni<T> run(TransactionMode mode, Function<StoreSession, T> work) {
        return Uni.createFrom().item(() -> {
            final var session = begin(mode);
            final T result;
            try {
                result = work.apply(session);
            } catch (RuntimeException | Error e) {
                session.rollback();
                throw e;
            }
            session.commit();
            return result;
        });
    }
}
