package strongbox.core.model.watch;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;

/**
 * Bootstrap for an external change watcher.
 *
 * <p>The watcher subscribes to changes of {@code namespace} and calls
 * {@link #initialQuery()} once to obtain the identifiers it should treat as
 * already seen. Later polls go through the matching diff query, passing the
 * identifiers held so far.
 *
 * @param namespace    name of the relation whose changes drive the feed
 * @param initialQuery computes the baseline identifier set
 */
public record WatchStatement(String namespace, Supplier<Uni<List<String>>> initialQuery) {

    public WatchStatement {
        Objects.requireNonNull(namespace, "namespace cannot be null");
        Objects.requireNonNull(initialQuery, "initialQuery cannot be null");
    }

    /**
     * Run the initial query.
     */
    public Uni<List<String>> baseline() {
        return initialQuery.get();
    }
}
