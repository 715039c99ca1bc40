package strongbox.core.model.secret;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Arguments for creating or updating a secret.
 *
 * <p>Every field is optional. On create, content is required together with a
 * revision ID. On update, null fields leave the stored value unchanged.
 *
 * @param revisionId     caller-supplied correlation ID for the new revision
 * @param description    new description
 * @param label          new owner label
 * @param data           new inline content
 * @param valueRef       new backend-held content
 * @param checksum       checksum of the new content; computed from inline data when absent
 * @param rotatePolicy   new rotation policy
 * @param nextRotateTime explicit next rotation time
 * @param expireTime     expiry of the new (or latest) revision
 * @param autoPrune      auto-prune flag, user secrets only
 */
public record UpsertSecretParams(
        String revisionId,
        String description,
        String label,
        Map<String, String> data,
        ValueRef valueRef,
        String checksum,
        RotatePolicy rotatePolicy,
        Instant nextRotateTime,
        Instant expireTime,
        Boolean autoPrune) {

    public UpsertSecretParams {
        if (data != null) {
            data = data.isEmpty() ? null : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        }
    }

    public boolean hasContent() {
        return data != null || valueRef != null;
    }

    /**
     * Whether any secret-level attribute is being changed.
     */
    public boolean hasMetadata() {
        return description != null
                || label != null
                || rotatePolicy != null
                || nextRotateTime != null
                || expireTime != null
                || autoPrune != null;
    }

    /**
     * The new content.
     *
     * @throws IllegalArgumentException unless exactly one of data and valueRef is set
     */
    public SecretContent content() {
        return new SecretContent(data, valueRef);
    }

    /**
     * The checksum the caller supplied, or one computed from inline data.
     */
    public String effectiveChecksum() {
        if (checksum != null && !checksum.isBlank()) {
            return checksum;
        }
        return data != null ? SecretContent.checksumOf(data) : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String revisionId;
        private String description;
        private String label;
        private Map<String, String> data;
        private ValueRef valueRef;
        private String checksum;
        private RotatePolicy rotatePolicy;
        private Instant nextRotateTime;
        private Instant expireTime;
        private Boolean autoPrune;

        private Builder() {}

        public Builder revisionId(String revisionId) {
            this.revisionId = revisionId;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder data(Map<String, String> data) {
            this.data = data;
            return this;
        }

        public Builder valueRef(ValueRef valueRef) {
            this.valueRef = valueRef;
            return this;
        }

        public Builder checksum(String checksum) {
            this.checksum = checksum;
            return this;
        }

        public Builder rotatePolicy(RotatePolicy rotatePolicy) {
            this.rotatePolicy = rotatePolicy;
            return this;
        }

        public Builder nextRotateTime(Instant nextRotateTime) {
            this.nextRotateTime = nextRotateTime;
            return this;
        }

        public Builder expireTime(Instant expireTime) {
            this.expireTime = expireTime;
            return this;
        }

        public Builder autoPrune(Boolean autoPrune) {
            this.autoPrune = autoPrune;
            return this;
        }

        public UpsertSecretParams build() {
            return new UpsertSecretParams(
                    revisionId,
                    description,
                    label,
                    data,
                    valueRef,
                    checksum,
                    rotatePolicy,
                    nextRotateTime,
                    expireTime,
                    autoPrune);
        }
    }
}
