package strongbox.core.port.in;

import strongbox.core.port.out.StoreSession;

/**
 * Extra work applied in the same unit of work as a secret import.
 */
@FunctionalInterface
public interface MigrationStep {

    void apply(StoreSession session);
}
