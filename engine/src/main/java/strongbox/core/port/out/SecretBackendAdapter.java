package strongbox.core.port.out;

import java.util.Map;

import io.smallrye.mutiny.Uni;

import strongbox.core.model.secret.SecretUri;

/**
 * Live connection to a backend that stores secret content externally.
 *
 * <p>The engine itself only stores value references; adapters are resolved
 * through the backend registry by the processes that move content.
 */
public interface SecretBackendAdapter {

    /**
     * ID of the backend this adapter talks to.
     */
    String backendId();

    /**
     * Store content for a revision.
     *
     * @return backend-local revision identifier
     */
    Uni<String> saveContent(SecretUri uri, int revision, Map<String, String> data);

    /**
     * Read content previously stored under {@code revisionId}.
     */
    Uni<Map<String, String>> getContent(String revisionId);

    Uni<Void> deleteContent(String revisionId);
}
