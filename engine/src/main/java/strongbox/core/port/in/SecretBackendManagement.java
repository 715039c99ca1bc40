package strongbox.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import strongbox.core.model.backend.SecretBackend;
import strongbox.core.model.backend.UpsertSecretBackendParams;
import strongbox.core.port.out.SecretBackendAdapter;

/**
 * Port for managing the backends that store secret content.
 */
public interface SecretBackendManagement {

    /**
     * Create a backend, or update it when the ID exists.
     *
     * @return Uni with the backend ID
     */
    Uni<String> upsertSecretBackend(UpsertSecretBackendParams params);

    Uni<SecretBackend> getSecretBackend(String id);

    Uni<SecretBackend> getSecretBackendByName(String name);

    Uni<List<SecretBackend>> listSecretBackends();

    /**
     * @param force delete even while revisions still reference the backend
     */
    Uni<Void> deleteSecretBackend(String id, boolean force);

    /**
     * Resolve a live adapter for a stored backend.
     */
    Uni<SecretBackendAdapter> adapterFor(String backendId);
}
