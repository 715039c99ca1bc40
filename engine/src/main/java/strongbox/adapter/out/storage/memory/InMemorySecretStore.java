package strongbox.adapter.out.storage.memory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

import org.jboss.logging.Logger;

import strongbox.core.model.store.Relation;
import strongbox.core.model.store.TransactionMode;
import strongbox.core.port.out.RelationView;
import strongbox.core.port.out.SecretStore;
import strongbox.core.port.out.StoreSession;

/**
 * In-memory implementation of SecretStore.
 *
 * <p>Data is NOT persisted across restarts. This implementation is suitable for:
 * <ul>
 *   <li>Development and testing</li>
 *   <li>Embedding the engine where persistence is handled externally</li>
 * </ul>
 *
 * <p>Isolation: the committed state is an immutable snapshot swapped atomically
 * on commit. Read-write sessions are serialized by a lock held from
 * {@link #begin} until commit or rollback, and mutate private copies of the
 * relations they touch. Read-only sessions never block and see the snapshot
 * current when they began.
 */
public class InMemorySecretStore implements SecretStore {

    private static final Logger LOG = Logger.getLogger(InMemorySecretStore.class);

    static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(30);

    private final ReentrantLock writeLock = new ReentrantLock();
    private final Duration lockTimeout;
    private volatile Map<String, Map<Object, Object>> committed = Map.of();

    public InMemorySecretStore() {
        this(DEFAULT_LOCK_TIMEOUT);
    }

    /**
     * @param lockTimeout how long a read-write session waits for the one before it
     */
    public InMemorySecretStore(Duration lockTimeout) {
        if (lockTimeout.isNegative() || lockTimeout.isZero()) {
            throw new IllegalArgumentException("lock timeout must be positive: " + lockTimeout);
        }
        this.lockTimeout = lockTimeout;
    }

    public Duration lockTimeout() {
        return lockTimeout;
    }

    @Override
    public StoreSession begin(TransactionMode mode) {
        if (mode == TransactionMode.READ_WRITE) {
            acquireWriteLock();
        }
        return new Session(mode, committed);
    }

    private void acquireWriteLock() {
        try {
            if (!writeLock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new IllegalStateException("timed out after " + lockTimeout + " waiting for a read-write session");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted waiting for a read-write session", e);
        }
    }

    /**
     * Number of rows currently committed in a relation.
     */
    public int size(Relation<?, ?> relation) {
        return committed.getOrDefault(relation.name(), Map.of()).size();
    }

    private final class Session implements StoreSession {

        private final TransactionMode mode;
        private final Map<String, Map<Object, Object>> snapshot;
        private final Map<String, LinkedHashMap<Object, Object>> working = new HashMap<>();
        private boolean active = true;

        private Session(TransactionMode mode, Map<String, Map<Object, Object>> snapshot) {
            this.mode = mode;
            this.snapshot = snapshot;
        }

        @Override
        public TransactionMode mode() {
            return mode;
        }

        @Override
        public <K, R> RelationView<K, R> relation(Relation<K, R> relation) {
            requireActive();
            return new View<>(relation);
        }

        @Override
        public void commit() {
            requireActive();
            try {
                if (mode == TransactionMode.READ_WRITE && !working.isEmpty()) {
                    final Map<String, Map<Object, Object>> next = new HashMap<>(snapshot);
                    working.forEach((name, rows) -> next.put(name, Collections.unmodifiableMap(rows)));
                    committed = Map.copyOf(next);
                    LOG.debugf("Committed changes to relations %s", working.keySet());
                }
            } finally {
                finish();
            }
        }

        @Override
        public void rollback() {
            if (!active) {
                return;
            }
            if (!working.isEmpty()) {
                LOG.debugf("Rolled back changes to relations %s", working.keySet());
            }
            finish();
        }

        @Override
        public boolean isActive() {
            return active;
        }

        private void finish() {
            active = false;
            if (mode == TransactionMode.READ_WRITE && writeLock.isHeldByCurrentThread()) {
                writeLock.unlock();
            }
        }

        private void requireActive() {
            if (!active) {
                throw new IllegalStateException("store session is no longer active");
            }
        }

        private Map<Object, Object> readable(String name) {
            final Map<Object, Object> rows = working.get(name);
            if (rows != null) {
                return rows;
            }
            return snapshot.getOrDefault(name, Map.of());
        }

        private LinkedHashMap<Object, Object> writable(String name) {
            requireActive();
            if (mode != TransactionMode.READ_WRITE) {
                throw new IllegalStateException("cannot write to " + name + " in a read-only session");
            }
            return working.computeIfAbsent(name, n -> new LinkedHashMap<>(snapshot.getOrDefault(n, Map.of())));
        }

        private final class View<K, R> implements RelationView<K, R> {

            private final Relation<K, R> relation;

            private View(Relation<K, R> relation) {
                this.relation = relation;
            }

            @Override
            public Optional<R> get(K key) {
                requireActive();
                return Optional.ofNullable(relation.rowType().cast(readable(relation.name()).get(key)));
            }

            @Override
            public void put(R row) {
                writable(relation.name()).put(relation.keyOf(row), row);
            }

            @Override
            public boolean delete(K key) {
                return writable(relation.name()).remove(key) != null;
            }

            @Override
            public List<R> scan(Predicate<? super R> filter) {
                requireActive();
                final List<R> result = new ArrayList<>();
                for (Object value : readable(relation.name()).values()) {
                    final R row = relation.rowType().cast(value);
                    if (filter.test(row)) {
                        result.add(row);
                    }
                }
                return result;
            }

            @Override
            public List<R> deleteWhere(Predicate<? super R> filter) {
                final var rows = writable(relation.name());
                final List<R> removed = new ArrayList<>();
                final Iterator<Object> it = rows.values().iterator();
                while (it.hasNext()) {
                    final R row = relation.rowType().cast(it.next());
                    if (filter.test(row)) {
                        removed.add(row);
                        it.remove();
                    }
                }
                return removed;
            }
        }
    }
}
