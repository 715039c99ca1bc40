package strongbox.core.service.backend;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strongbox.core.model.backend.ConfigValue;
import strongbox.core.model.backend.ConfigValueCodec;
import strongbox.core.model.backend.SecretBackend;
import strongbox.core.model.backend.UpsertSecretBackendParams;
import strongbox.core.model.error.SecretBackendAlreadyExistsException;
import strongbox.core.model.error.SecretBackendInUseException;
import strongbox.core.model.error.SecretBackendNotFoundException;
import strongbox.core.model.error.SecretBackendNotValidException;
import strongbox.core.model.store.BackendRecord;
import strongbox.core.model.store.BackendRotationRecord;
import strongbox.core.model.store.Relations;
import strongbox.core.port.in.SecretBackendManagement;
import strongbox.core.port.out.SecretBackendAdapter;
import strongbox.core.port.out.SecretStore;
import strongbox.core.port.out.StoreSession;

/**
 * Service for the backends storing secret content.
 *
 * <p>Backend config is kept as JSON. Numbers come back as floating point
 * values after a round trip.
 */
@ApplicationScoped
public class SecretBackendService implements SecretBackendManagement {

    private static final Logger LOG = Logger.getLogger(SecretBackendService.class);

    private final SecretStore store;
    private final BackendRegistry registry;
    private final ConfigValueCodec codec;

    @Inject
    public SecretBackendService(SecretStore store, BackendRegistry registry, ObjectMapper objectMapper) {
        this.store = store;
        this.registry = registry;
        this.codec = new ConfigValueCodec(objectMapper);
    }

    @Override
    public Uni<String> upsertSecretBackend(UpsertSecretBackendParams params) {
        try {
            validate(params);
        } catch (SecretBackendNotValidException e) {
            return Uni.createFrom().failure(e);
        }

        return store.inTransaction(session -> upsert(session, params))
                .invoke(created -> {
                    registry.evict(params.id());
                    LOG.infof("%s secret backend %s", created ? "Created" : "Updated", params.id());
                })
                .replaceWith(params.id());
    }

    private static void validate(UpsertSecretBackendParams params) {
        if (params.id() == null || params.id().isBlank()) {
            throw new SecretBackendNotValidException("ID is missing");
        }
        if (params.config() == null) {
            return;
        }
        for (Map.Entry<String, ConfigValue> entry : params.config().entrySet()) {
            if (entry.getKey() == null || entry.getKey().isEmpty()) {
                throw new SecretBackendNotValidException("empty config key for \"" + params.id() + "\"");
            }
            if (entry.getValue() == null || entry.getValue().isEmpty()) {
                throw new SecretBackendNotValidException("empty config value for \"" + params.id() + "\"");
            }
        }
    }

    /**
     * @return true if the backend was created
     */
    private boolean upsert(StoreSession session, UpsertSecretBackendParams params) {
        final var backends = session.relation(Relations.BACKENDS);
        final var existing = backends.get(params.id());
        if (existing.isEmpty()) {
            if (params.name() == null || params.name().isBlank()) {
                throw new SecretBackendNotValidException("name is missing");
            }
            if (params.backendType() == null || params.backendType().isBlank()) {
                throw new SecretBackendNotValidException("type is missing");
            }
        }
        final var current = existing.orElse(null);
        final var name = params.name() != null && !params.name().isBlank() ? params.name() : current.name();
        if (backends.exists(b -> b.name().equals(name) && !b.id().equals(params.id()))) {
            throw new SecretBackendAlreadyExistsException(name);
        }

        final var config = params.config() != null && !params.config().isEmpty()
                ? codec.encode(params.config())
                : current != null ? current.configJson() : codec.encode(Map.of());
        backends.put(new BackendRecord(
                params.id(),
                name,
                params.backendType() != null && !params.backendType().isBlank()
                        ? params.backendType()
                        : current.backendType(),
                params.tokenRotateInterval() != null
                        ? params.tokenRotateInterval()
                        : current != null ? current.tokenRotateInterval() : null,
                config));
        if (params.nextRotateTime() != null) {
            session.relation(Relations.BACKEND_ROTATIONS)
                    .put(new BackendRotationRecord(params.id(), params.nextRotateTime()));
        }
        return current == null;
    }

    @Override
    public Uni<SecretBackend> getSecretBackend(String id) {
        return store.read(session -> session.relation(Relations.BACKENDS)
                .get(id)
                .map(this::toBackend)
                .orElseThrow(() -> SecretBackendNotFoundException.forId(id)));
    }

    @Override
    public Uni<SecretBackend> getSecretBackendByName(String name) {
        return store.read(session -> session.relation(Relations.BACKENDS)
                .scan(b -> b.name().equals(name))
                .stream()
                .findFirst()
                .map(this::toBackend)
                .orElseThrow(() -> SecretBackendNotFoundException.forName(name)));
    }

    @Override
    public Uni<List<SecretBackend>> listSecretBackends() {
        return store.read(session -> session.relation(Relations.BACKENDS).all().stream()
                .sorted(Comparator.comparing(BackendRecord::name))
                .map(this::toBackend)
                .toList());
    }

    @Override
    public Uni<Void> deleteSecretBackend(String id, boolean force) {
        return store.inTransaction(session -> {
                    final var backends = session.relation(Relations.BACKENDS);
                    if (backends.get(id).isEmpty()) {
                        throw SecretBackendNotFoundException.forId(id);
                    }
                    final var inUse = session.relation(Relations.REVISIONS)
                            .scan(r -> r.valueRef() != null && r.valueRef().backendId().equals(id))
                            .size();
                    if (inUse > 0 && !force) {
                        throw new SecretBackendInUseException(id, inUse);
                    }
                    backends.delete(id);
                    session.relation(Relations.BACKEND_ROTATIONS).delete(id);
                    return null;
                })
                .replaceWithVoid()
                .invoke(() -> {
                    registry.evict(id);
                    LOG.infof("Deleted secret backend %s", id);
                });
    }

    @Override
    public Uni<SecretBackendAdapter> adapterFor(String backendId) {
        return getSecretBackend(backendId).map(registry::adapterFor);
    }

    private SecretBackend toBackend(BackendRecord record) {
        final Map<String, ConfigValue> config = new LinkedHashMap<>(codec.decode(record.configJson()));
        return new SecretBackend(
                record.id(), record.name(), record.backendType(), record.tokenRotateInterval(), config);
    }
}
