package strongbox.core.model.secret;

/**
 * Consumer record as reported in bulk listings.
 *
 * @param unitName        name of the consuming unit
 * @param label           consumer label, may be null
 * @param currentRevision acknowledged revision
 */
public record ConsumerInfo(String unitName, String label, int currentRevision) {}
