package strongbox.core.model.backend;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Descriptor of a storage backend for secret content.
 *
 * @param id                  backend ID
 * @param name                unique backend name
 * @param backendType         adapter type, e.g. {@code vault}
 * @param tokenRotateInterval how often the backend access token is rotated, may be null
 * @param config              backend-specific configuration
 */
public record SecretBackend(
        String id, String name, String backendType, Duration tokenRotateInterval, Map<String, ConfigValue> config) {

    public SecretBackend {
        config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }
}
