package strongbox.core.model.store;

import java.time.Instant;

public record BackendRotationRecord(String backendId, Instant nextRotateTime) {}
