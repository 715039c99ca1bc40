package strongbox.spi;

import java.time.Duration;
import java.util.Optional;

/**
 * Read access to application properties for providers.
 *
 * <p>Keeps providers independent of the configuration framework. Keys are full
 * property names, e.g. {@code strongbox.secrets.storage.memory.lock-timeout}.
 */
public interface StorageAdapterConfig {

    Optional<String> get(String key);

    /**
     * Duration in ISO-8601 form, e.g. {@code PT15M}.
     */
    default Optional<Duration> getDuration(String key) {
        return get(key).map(Duration::parse);
    }
}
