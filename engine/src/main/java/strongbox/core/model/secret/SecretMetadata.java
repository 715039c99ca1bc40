package strongbox.core.model.secret;

import java.time.Instant;

/**
 * Secret-level attributes as reported to callers.
 *
 * @param uri                    the secret URI
 * @param version                schema version, currently always 1
 * @param owner                  owner, reported by name
 * @param description            free-form description, may be null
 * @param label                  owner label, may be null
 * @param rotatePolicy           rotation policy
 * @param autoPrune              whether obsolete revisions are pruned automatically
 * @param latestRevision         number of the latest revision
 * @param latestRevisionChecksum checksum of the latest revision's content
 * @param latestExpireTime       expiry of the latest revision, may be null
 * @param nextRotateTime         next scheduled rotation, may be null
 * @param createTime             when the secret was created
 * @param updateTime             when the secret was last changed
 */
public record SecretMetadata(
        SecretUri uri,
        int version,
        Owner owner,
        String description,
        String label,
        RotatePolicy rotatePolicy,
        boolean autoPrune,
        int latestRevision,
        String latestRevisionChecksum,
        Instant latestExpireTime,
        Instant nextRotateTime,
        Instant createTime,
        Instant updateTime) {}
