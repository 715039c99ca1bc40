package strongbox.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import strongbox.core.model.store.TransactionMode;
import strongbox.core.port.out.SecretStore;
import strongbox.core.port.out.SecretStoreContractTest;

/**
 * Contract test implementation for InMemorySecretStore.
 */
class InMemorySecretStoreContractTest extends SecretStoreContractTest {

    @Override
    protected SecretStore createStore() {
        return new InMemorySecretStore();
    }

    @Test
    @DisplayName("read-write session should give up after the lock timeout")
    void readWriteSessionShouldTimeOut() throws Exception {
        final var store = new InMemorySecretStore(Duration.ofMillis(50));
        final var held = new CountDownLatch(1);
        final var release = new CountDownLatch(1);
        final var executor = Executors.newSingleThreadExecutor();
        try {
            final var holder = executor.submit(() -> {
                final var session = store.begin(TransactionMode.READ_WRITE);
                held.countDown();
                release.await(5, TimeUnit.SECONDS);
                session.rollback();
                return null;
            });
            assertTrue(held.await(5, TimeUnit.SECONDS));

            final var exception =
                    assertThrows(IllegalStateException.class, () -> store.begin(TransactionMode.READ_WRITE));
            assertEquals("timed out after PT0.05S waiting for a read-write session", exception.getMessage());

            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
            store.begin(TransactionMode.READ_WRITE).rollback();
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("should reject a non-positive lock timeout")
    void shouldRejectNonPositiveLockTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new InMemorySecretStore(Duration.ZERO));
    }
}
