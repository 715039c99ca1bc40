package strongbox.core.model.backend;

import java.time.Instant;

/**
 * @param id              backend ID
 * @param name            backend name
 * @param nextTriggerTime when the backend token should next be rotated
 */
public record BackendRotationInfo(String id, String name, Instant nextTriggerTime) {}
