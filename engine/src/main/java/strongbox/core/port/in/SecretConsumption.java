package strongbox.core.port.in;

import java.util.List;
import java.util.Map;
import java.util.Set;

import io.smallrye.mutiny.Uni;

import strongbox.core.model.secret.ConsumerInfo;
import strongbox.core.model.secret.ConsumerLookup;
import strongbox.core.model.secret.RemoteSecretInfo;
import strongbox.core.model.secret.SecretConsumer;
import strongbox.core.model.secret.SecretUri;
import strongbox.core.model.watch.WatchStatement;

/**
 * Port for tracking which revision each consuming unit has acknowledged.
 *
 * <p>Local units are identified by UUID. Units of other models are only known
 * by name and are tracked as remote consumers.
 */
public interface SecretConsumption {

    /**
     * Record the consumer state of a unit.
     *
     * <p>When the acknowledged revision moves, the previously acknowledged
     * revision is re-evaluated for obsolescence.
     */
    Uni<Void> saveSecretConsumer(SecretUri uri, String unitUuid, SecretConsumer consumer);

    /**
     * @return Uni with the consumer and the latest revision; fails with
     *         {@link strongbox.core.model.error.SecretConsumerNotFoundException},
     *         which still carries the latest revision, when the unit never consumed the secret
     */
    Uni<ConsumerLookup> getSecretConsumer(SecretUri uri, String unitUuid);

    Uni<SecretUri> getUriByConsumerLabel(String label, String unitUuid);

    /**
     * @return Uni with consumers keyed by secret ID
     */
    Uni<Map<String, List<ConsumerInfo>>> allSecretConsumers();

    Uni<Void> saveSecretRemoteConsumer(SecretUri uri, String unitName, SecretConsumer consumer);

    Uni<ConsumerLookup> getSecretRemoteConsumer(SecretUri uri, String unitName);

    /**
     * @return Uni with remote consumers keyed by secret ID
     */
    Uni<Map<String, List<ConsumerInfo>>> allSecretRemoteConsumers();

    /**
     * Record the latest revision of a secret owned by another model.
     */
    Uni<Void> updateRemoteSecretRevision(SecretUri uri, int latestRevision);

    /**
     * @return Uni with every consumed secret of another model
     */
    Uni<List<RemoteSecretInfo>> allRemoteSecrets();

    /**
     * Resolve the revision a unit should read.
     *
     * @param refresh       move the consumer to the latest revision
     * @param peek          report the latest revision without recording it
     * @param labelToUpdate consumer label to record, may be null
     * @return Uni with the revision number
     */
    Uni<Integer> getConsumedRevision(
            SecretUri uri, String unitUuid, boolean refresh, boolean peek, String labelToUpdate);

    WatchStatement initialWatchStatementForConsumedSecretsChange(String unitUuid);

    /**
     * @param knownRevisionIds latest revision IDs observed so far
     * @return Uni with consumed secrets whose latest revision ID is not known
     */
    Uni<List<SecretUri>> getConsumedSecretUrisWithChanges(String unitUuid, Set<String> knownRevisionIds);

    WatchStatement initialWatchStatementForConsumedRemoteSecretsChange(String unitUuid);

    /**
     * @param knownRevisionKeys revision keys ({@code <id>/<latest>}) observed so far
     */
    Uni<List<SecretUri>> getConsumedRemoteSecretUrisWithChanges(String unitUuid, Set<String> knownRevisionKeys);
}
