package strongbox.core.model.secret;

import java.util.List;

/**
 * A secret together with the metadata of its kept revisions, oldest first.
 */
public record SecretWithRevisions(SecretMetadata metadata, List<SecretRevisionMetadata> revisions) {

    public SecretWithRevisions {
        revisions = revisions == null ? List.of() : List.copyOf(revisions);
    }
}
