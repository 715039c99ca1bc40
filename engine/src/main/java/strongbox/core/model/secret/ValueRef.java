package strongbox.core.model.secret;

/**
 * Pointer to secret content held by an external backend.
 *
 * @param backendId  ID of the backend holding the content
 * @param revisionId backend-local identifier of the stored content
 */
public record ValueRef(String backendId, String revisionId) {

    public ValueRef {
        if (backendId == null || backendId.isBlank()) {
            throw new IllegalArgumentException("value reference backend ID cannot be null or blank");
        }
        if (revisionId == null || revisionId.isBlank()) {
            throw new IllegalArgumentException("value reference revision ID cannot be null or blank");
        }
    }

    @Override
    public String toString() {
        return backendId + ":" + revisionId;
    }
}
