package strongbox.core.model.store;

import java.time.Duration;

/**
 * Stored backend row. Configuration is held in its serialized JSON form.
 */
public record BackendRecord(
        String id, String name, String backendType, Duration tokenRotateInterval, String configJson) {}
