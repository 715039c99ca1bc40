package strongbox.core.model.store;

import java.time.Instant;

import strongbox.core.model.secret.OwnerKind;
import strongbox.core.model.secret.RotatePolicy;

/**
 * Stored secret row. The owner is held by UUID.
 */
public record SecretRecord(
        String id,
        int version,
        OwnerKind ownerKind,
        String ownerUuid,
        String label,
        String description,
        boolean autoPrune,
        RotatePolicy rotatePolicy,
        Instant createTime,
        Instant updateTime) {

    public SecretRecord {
        if (label != null && label.isEmpty()) {
            label = null;
        }
        if (rotatePolicy == null) {
            rotatePolicy = RotatePolicy.NEVER;
        }
    }

    public boolean isUserSecret() {
        return ownerKind == OwnerKind.MODEL;
    }

    public boolean ownedBy(OwnerKind kind, String uuid) {
        return ownerKind == kind && ownerUuid.equals(uuid);
    }

    public SecretRecord withLabel(String newLabel) {
        return new SecretRecord(
                id, version, ownerKind, ownerUuid, newLabel, description, autoPrune, rotatePolicy, createTime,
                updateTime);
    }

    public SecretRecord withDescription(String newDescription) {
        return new SecretRecord(
                id, version, ownerKind, ownerUuid, label, newDescription, autoPrune, rotatePolicy, createTime,
                updateTime);
    }

    public SecretRecord withAutoPrune(boolean newAutoPrune) {
        return new SecretRecord(
                id, version, ownerKind, ownerUuid, label, description, newAutoPrune, rotatePolicy, createTime,
                updateTime);
    }

    public SecretRecord withRotatePolicy(RotatePolicy newPolicy) {
        return new SecretRecord(
                id, version, ownerKind, ownerUuid, label, description, autoPrune, newPolicy, createTime,
                updateTime);
    }

    public SecretRecord withUpdateTime(Instant newUpdateTime) {
        return new SecretRecord(
                id, version, ownerKind, ownerUuid, label, description, autoPrune, rotatePolicy, createTime,
                newUpdateTime);
    }
}
