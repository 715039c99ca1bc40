package strongbox.core.model.backend;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Arguments for creating or updating a backend. On update, null fields and an
 * empty config keep the stored values.
 */
public record UpsertSecretBackendParams(
        String id,
        String name,
        String backendType,
        Duration tokenRotateInterval,
        Instant nextRotateTime,
        Map<String, ConfigValue> config) {

    public static UpsertSecretBackendParams create(String id, String name, String backendType) {
        return new UpsertSecretBackendParams(id, name, backendType, null, null, null);
    }

    public UpsertSecretBackendParams withRotation(Duration interval, Instant next) {
        return new UpsertSecretBackendParams(id, name, backendType, interval, next, config);
    }

    public UpsertSecretBackendParams withConfig(Map<String, ConfigValue> newConfig) {
        return new UpsertSecretBackendParams(id, name, backendType, tokenRotateInterval, nextRotateTime, newConfig);
    }
}
