package strongbox.core.model.migration;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import strongbox.core.model.access.AccessScopeKind;
import strongbox.core.model.access.AccessorKind;
import strongbox.core.model.access.SecretRole;
import strongbox.core.model.secret.SecretConsumer;
import strongbox.core.model.secret.SecretContent;
import strongbox.core.model.secret.SecretUri;
import strongbox.core.model.secret.SecretWithRevisions;

/**
 * Flat snapshot of every secret of a model, used for model migration.
 *
 * <p>Owners are reported by name, consumers by unit name, so the snapshot can
 * be applied to a model whose entities carry different UUIDs.
 *
 * @param secrets         every local secret with its revision metadata
 * @param content         revision content, by secret ID then revision number
 * @param nextRotateTimes scheduled rotations, by secret ID
 * @param consumers       local consumers, by secret ID
 * @param remoteConsumers consumers in other models, by secret ID
 * @param access          grants, by secret ID
 * @param remoteSecrets   secrets of other models consumed locally
 */
public record SecretExport(
        List<SecretWithRevisions> secrets,
        Map<String, Map<Integer, SecretContent>> content,
        Map<String, Instant> nextRotateTimes,
        Map<String, List<ExportedConsumer>> consumers,
        Map<String, List<ExportedConsumer>> remoteConsumers,
        Map<String, List<ExportedGrant>> access,
        List<ExportedRemoteSecret> remoteSecrets) {

    public SecretExport {
        secrets = secrets == null ? List.of() : List.copyOf(secrets);
        content = content == null ? Map.of() : Map.copyOf(content);
        nextRotateTimes = nextRotateTimes == null ? Map.of() : Map.copyOf(nextRotateTimes);
        consumers = consumers == null ? Map.of() : Map.copyOf(consumers);
        remoteConsumers = remoteConsumers == null ? Map.of() : Map.copyOf(remoteConsumers);
        access = access == null ? Map.of() : Map.copyOf(access);
        remoteSecrets = remoteSecrets == null ? List.of() : List.copyOf(remoteSecrets);
    }

    /**
     * @param unitName consuming unit
     * @param consumer consumer state
     */
    public record ExportedConsumer(String unitName, SecretConsumer consumer) {}

    /**
     * A grant with scope and subject reported by name. Relations keep their
     * UUID; the model is re-targeted to the importing model.
     */
    public record ExportedGrant(
            AccessScopeKind scopeKind,
            String scopeName,
            AccessorKind subjectKind,
            String subjectName,
            SecretRole role) {}

    /**
     * @param uri            remote secret URI, qualified with its source model
     * @param unitName       local consuming unit
     * @param consumer       consumer state
     * @param latestRevision latest revision known for the secret
     */
    public record ExportedRemoteSecret(SecretUri uri, String unitName, SecretConsumer consumer, int latestRevision) {}
}
