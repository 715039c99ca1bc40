package strongbox.core.model.store;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import strongbox.core.model.secret.SecretContent;
import strongbox.core.model.secret.ValueRef;

/**
 * Stored revision row, keyed by the caller-supplied revision ID.
 */
public record RevisionRecord(
        String revisionId,
        String secretId,
        int revision,
        Map<String, String> data,
        ValueRef valueRef,
        String checksum,
        Instant createTime,
        boolean obsolete,
        boolean pendingDelete) {

    public RevisionRecord {
        if (data != null) {
            data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        }
    }

    public SecretContent content() {
        return new SecretContent(data, valueRef);
    }

    public RevisionRecord withContent(SecretContent content) {
        return new RevisionRecord(
                revisionId,
                secretId,
                revision,
                content.data(),
                content.valueRef(),
                checksum,
                createTime,
                obsolete,
                pendingDelete);
    }

    public RevisionRecord withObsolete(boolean newObsolete, boolean newPendingDelete) {
        return new RevisionRecord(
                revisionId, secretId, revision, data, valueRef, checksum, createTime, newObsolete,
                newPendingDelete);
    }
}
