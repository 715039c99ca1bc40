package strongbox.core.model.secret;

import java.util.List;

/**
 * A secret and where each of its revisions currently stores its content.
 */
public record SecretMetadataForDrain(SecretUri uri, List<RevisionRef> revisions) {

    public SecretMetadataForDrain {
        revisions = List.copyOf(revisions);
    }

    /**
     * @param revision revision number
     * @param valueRef backend reference, or null when content is stored inline
     */
    public record RevisionRef(int revision, ValueRef valueRef) {}
}
