package strongbox.core.port.out;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Keyed rows of one relation as seen from a {@link StoreSession}.
 *
 * <p>Write methods throw {@link IllegalStateException} in a read-only session.
 *
 * @param <K> key type
 * @param <R> row type
 */
public interface RelationView<K, R> {

    Optional<R> get(K key);

    /**
     * Insert or replace the row under its own key.
     */
    void put(R row);

    /**
     * @return true if a row was removed
     */
    boolean delete(K key);

    /**
     * Rows matching {@code filter}, in insertion order.
     */
    List<R> scan(Predicate<? super R> filter);

    default List<R> all() {
        return scan(row -> true);
    }

    default boolean exists(Predicate<? super R> filter) {
        return !scan(filter).isEmpty();
    }

    /**
     * Remove every row matching {@code filter}.
     *
     * @return the removed rows
     */
    List<R> deleteWhere(Predicate<? super R> filter);
}
