package strongbox.core.port.in;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import io.smallrye.mutiny.Uni;

import strongbox.core.model.backend.BackendRotationInfo;
import strongbox.core.model.secret.ExpiryInfo;
import strongbox.core.model.secret.RotationInfo;
import strongbox.core.model.secret.SecretUri;
import strongbox.core.model.watch.WatchStatement;

/**
 * Port for the rotation and expiry schedules of secrets and backends.
 */
public interface SecretRotationScheduling {

    /**
     * Store the next rotation time. A time later than the stored one is ignored.
     */
    Uni<Void> secretRotated(SecretUri uri, Instant nextRotateTime);

    /**
     * Reschedule a secret after its rotation fired.
     *
     * @param originalRevision latest revision when the rotation fired
     * @param skip             schedule by policy even if no new revision was written
     */
    Uni<Void> secretRotated(SecretUri uri, int originalRevision, boolean skip);

    WatchStatement initialWatchStatementForSecretsRotationChanges(Set<String> appOwners, Set<String> unitOwners);

    /**
     * @param secretIds IDs to report, all owned secrets when empty
     */
    Uni<List<RotationInfo>> getSecretsRotationChanges(
            Set<String> appOwners, Set<String> unitOwners, Set<String> secretIds);

    WatchStatement initialWatchStatementForSecretsRevisionExpiryChanges(
            Set<String> appOwners, Set<String> unitOwners);

    /**
     * @param revisionIds revision IDs to report, all owned revisions when empty
     */
    Uni<List<ExpiryInfo>> getSecretsRevisionExpiryChanges(
            Set<String> appOwners, Set<String> unitOwners, Set<String> revisionIds);

    /**
     * Store the next token rotation time of a backend. A later time is ignored.
     */
    Uni<Void> secretBackendRotated(String backendId, Instant nextRotateTime);

    WatchStatement initialWatchStatementForSecretBackendRotationChanges();

    /**
     * @param backendIds IDs to report, all scheduled backends when empty
     */
    Uni<List<BackendRotationInfo>> getSecretBackendRotateChanges(Set<String> backendIds);
}
