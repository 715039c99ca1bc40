package strongbox.adapter.out.backend;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import strongbox.core.model.backend.SecretBackend;
import strongbox.core.model.secret.SecretUri;
import strongbox.core.port.out.SecretBackendAdapter;
import strongbox.spi.SecretBackendProvider;

/**
 * Backend provider of type {@code memory}, holding content in process memory.
 *
 * <p>Each configured backend gets its own content map, kept for the lifetime
 * of the provider, so reopening a backend sees earlier writes.
 */
public class InMemorySecretBackendProvider implements SecretBackendProvider {

    public static final String TYPE = "memory";

    private final Map<String, Map<String, Map<String, String>>> contentByBackend = new ConcurrentHashMap<>();

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public SecretBackendAdapter open(SecretBackend backend) {
        return new Adapter(backend.id(), contentByBackend.computeIfAbsent(backend.id(), id -> new ConcurrentHashMap<>()));
    }

    private static final class Adapter implements SecretBackendAdapter {

        private final String backendId;
        private final Map<String, Map<String, String>> content;

        private Adapter(String backendId, Map<String, Map<String, String>> content) {
            this.backendId = backendId;
            this.content = content;
        }

        @Override
        public String backendId() {
            return backendId;
        }

        @Override
        public Uni<String> saveContent(SecretUri uri, int revision, Map<String, String> data) {
            return Uni.createFrom().item(() -> {
                final var revisionId = uri.id() + "-" + revision + "-" + UUID.randomUUID();
                content.put(revisionId, Map.copyOf(data));
                return revisionId;
            });
        }

        @Override
        public Uni<Map<String, String>> getContent(String revisionId) {
            return Uni.createFrom().item(() -> {
                final var data = content.get(revisionId);
                if (data == null) {
                    throw new IllegalArgumentException(
                            "no content for revision " + revisionId + " in backend " + backendId);
                }
                return data;
            });
        }

        @Override
        public Uni<Void> deleteContent(String revisionId) {
            return Uni.createFrom().item(() -> {
                content.remove(revisionId);
                return null;
            });
        }
    }
}
