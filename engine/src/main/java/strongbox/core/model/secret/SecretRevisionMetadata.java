package strongbox.core.model.secret;

import java.time.Instant;

/**
 * @param revision      revision number, starting at 1
 * @param revisionId    caller-supplied correlation ID of the revision
 * @param valueRef      backend reference when content is held externally, else null
 * @param createTime    when the revision was created
 * @param expireTime    when the revision expires, may be null
 * @param obsolete      whether the revision is neither latest nor in use
 * @param pendingDelete whether the revision may be physically removed
 */
public record SecretRevisionMetadata(
        int revision,
        String revisionId,
        ValueRef valueRef,
        Instant createTime,
        Instant expireTime,
        boolean obsolete,
        boolean pendingDelete) {}
