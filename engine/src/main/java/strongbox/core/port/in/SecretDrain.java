package strongbox.core.port.in;

import java.util.List;
import java.util.Map;
import java.util.Set;

import io.smallrye.mutiny.Uni;

import strongbox.core.model.secret.SecretMetadataForDrain;
import strongbox.core.model.secret.ValueRef;

/**
 * Port for moving revision content between backends.
 */
public interface SecretDrain {

    Uni<List<SecretMetadataForDrain>> listCharmSecretsToDrain(Set<String> appOwners, Set<String> unitOwners);

    Uni<List<SecretMetadataForDrain>> listUserSecretsToDrain();

    /**
     * Point a revision at new content, keeping its number and checksum.
     *
     * <p>Exactly one of {@code valueRef} and {@code data} must be set.
     */
    Uni<Void> changeSecretBackend(String revisionId, ValueRef valueRef, Map<String, String> data);
}
