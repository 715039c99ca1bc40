package strongbox.core.model.store;

import java.util.Objects;
import java.util.function.Function;

/**
 * Typed descriptor of a named relation in the transactional store.
 *
 * @param <K> key type
 * @param <R> row type
 */
public final class Relation<K, R> {

    private final String name;
    private final Class<R> rowType;
    private final Function<R, K> keyOf;

    private Relation(String name, Class<R> rowType, Function<R, K> keyOf) {
        this.name = Objects.requireNonNull(name);
        this.rowType = Objects.requireNonNull(rowType);
        this.keyOf = Objects.requireNonNull(keyOf);
    }

    public static <K, R> Relation<K, R> of(String name, Class<R> rowType, Function<R, K> keyOf) {
        return new Relation<>(name, rowType, keyOf);
    }

    public String name() {
        return name;
    }

    public Class<R> rowType() {
        return rowType;
    }

    public K keyOf(R row) {
        return keyOf.apply(row);
    }

    @Override
    public String toString() {
        return name;
    }
}
