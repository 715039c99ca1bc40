package strongbox.core.port.out;

import java.util.List;
import java.util.Optional;

import strongbox.core.model.secret.ApplicationRef;
import strongbox.core.model.secret.UnitRef;

/**
 * Resolves the applications, units and relations of the model.
 *
 * <p>Lookups are synchronous and cheap so they can run inside a unit of work.
 */
public interface OwnerResolver {

    /**
     * UUID of the model whose secrets this engine manages.
     */
    String modelUuid();

    Optional<ApplicationRef> applicationByUuid(String applicationUuid);

    Optional<ApplicationRef> applicationByName(String name);

    Optional<UnitRef> unitByUuid(String unitUuid);

    Optional<UnitRef> unitByName(String name);

    /**
     * Units of an application, in no particular order.
     */
    List<UnitRef> unitsOf(String applicationUuid);

    boolean relationExists(String relationUuid);
}
