package strongbox.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import strongbox.core.model.migration.SecretExport;

/**
 * Port for moving the secrets of a model to another model.
 */
public interface SecretMigration {

    Uni<SecretExport> exportSecrets();

    /**
     * Import an export and run the extra steps in one unit of work.
     *
     * <p>Nothing is stored if any part fails.
     */
    Uni<Void> importSecrets(SecretExport export, List<MigrationStep> extraSteps);
}
