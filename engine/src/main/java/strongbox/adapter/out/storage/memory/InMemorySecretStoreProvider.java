package strongbox.adapter.out.storage.memory;

import strongbox.core.port.out.SecretStore;
import strongbox.spi.SecretStoreProvider;
import strongbox.spi.StorageAdapterConfig;

/**
 * Built-in in-memory secret store provider.
 *
 * <p>Lowest priority, so any persistent provider on the classpath wins
 * unless this one is selected explicitly.
 */
public class InMemorySecretStoreProvider implements SecretStoreProvider {

    static final String LOCK_TIMEOUT_KEY = "strongbox.secrets.storage.memory.lock-timeout";

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String description() {
        return "In-memory secret store (non-persistent, single instance)";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public SecretStore createStore(StorageAdapterConfig config) {
        return config.getDuration(LOCK_TIMEOUT_KEY)
                .map(InMemorySecretStore::new)
                .orElseGet(InMemorySecretStore::new);
    }
}
