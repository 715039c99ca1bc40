package strongbox.adapter.out.topology;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.jboss.logging.Logger;

import strongbox.core.model.error.ApplicationNotFoundException;
import strongbox.core.model.secret.ApplicationRef;
import strongbox.core.model.secret.UnitRef;
import strongbox.core.port.out.OwnerResolver;

/**
 * In-memory registry of the applications, units and relations of a model.
 *
 * <p>Stands in for the model's application domain when the engine runs
 * standalone or under test. Entities are registered by name and receive
 * random UUIDs.
 *
 * <p>Thread-safety: Uses ConcurrentHashMap for safe concurrent access.
 */
public class InMemoryModelTopology implements OwnerResolver {

    private static final Logger LOG = Logger.getLogger(InMemoryModelTopology.class);

    private final String modelUuid;
    private final Map<String, ApplicationRef> applications = new ConcurrentHashMap<>();
    private final Map<String, UnitRef> units = new ConcurrentHashMap<>();
    private final Set<String> relations = ConcurrentHashMap.newKeySet();

    public InMemoryModelTopology(String modelUuid) {
        this.modelUuid = modelUuid;
    }

    public InMemoryModelTopology() {
        this(UUID.randomUUID().toString());
    }

    /**
     * Register an application.
     *
     * @param name application name, e.g. {@code mysql}
     * @return the registered application
     */
    public ApplicationRef addApplication(String name) {
        final var existing = applicationByName(name);
        if (existing.isPresent()) {
            return existing.get();
        }
        final var app = new ApplicationRef(UUID.randomUUID().toString(), name);
        applications.put(app.uuid(), app);
        LOG.debugf("Registered application %s (%s)", name, app.uuid());
        return app;
    }

    /**
     * Register a unit of an already registered application.
     *
     * @param name unit name in {@code <application>/<number>} form
     * @return the registered unit
     * @throws ApplicationNotFoundException if the application is unknown
     */
    public UnitRef addUnit(String name) {
        final var slash = name.indexOf('/');
        if (slash <= 0) {
            throw new IllegalArgumentException("unit name \"" + name + "\" not valid");
        }
        final var appName = name.substring(0, slash);
        final var app = applicationByName(appName).orElseThrow(() -> new ApplicationNotFoundException(appName));
        final var existing = unitByName(name);
        if (existing.isPresent()) {
            return existing.get();
        }
        final var unit = new UnitRef(UUID.randomUUID().toString(), name, app.uuid());
        units.put(unit.uuid(), unit);
        LOG.debugf("Registered unit %s (%s)", name, unit.uuid());
        return unit;
    }

    /**
     * Register a relation.
     *
     * @return the relation UUID
     */
    public String addRelation() {
        final var uuid = UUID.randomUUID().toString();
        relations.add(uuid);
        return uuid;
    }

    public void removeUnit(String unitUuid) {
        units.remove(unitUuid);
    }

    @Override
    public String modelUuid() {
        return modelUuid;
    }

    @Override
    public Optional<ApplicationRef> applicationByUuid(String applicationUuid) {
        return Optional.ofNullable(applications.get(applicationUuid));
    }

    @Override
    public Optional<ApplicationRef> applicationByName(String name) {
        return applications.values().stream().filter(a -> a.name().equals(name)).findFirst();
    }

    @Override
    public Optional<UnitRef> unitByUuid(String unitUuid) {
        return Optional.ofNullable(units.get(unitUuid));
    }

    @Override
    public Optional<UnitRef> unitByName(String name) {
        return units.values().stream().filter(u -> u.name().equals(name)).findFirst();
    }

    @Override
    public List<UnitRef> unitsOf(String applicationUuid) {
        return units.values().stream()
                .filter(u -> u.applicationUuid().equals(applicationUuid))
                .toList();
    }

    @Override
    public boolean relationExists(String relationUuid) {
        return relations.contains(relationUuid);
    }
}
