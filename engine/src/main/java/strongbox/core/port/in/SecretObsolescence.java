package strongbox.core.port.in;

import java.util.List;
import java.util.Set;

import io.smallrye.mutiny.Uni;

import strongbox.core.model.watch.WatchStatement;

/**
 * Port for obsolete revisions and pruning of user secrets.
 */
public interface SecretObsolescence {

    /**
     * @return Uni with revision keys of obsolete revisions of auto-pruned user secrets
     */
    Uni<List<String>> getObsoleteUserSecretRevisionsReadyToPrune();

    /**
     * Delete every revision reported ready to prune.
     *
     * @return Uni with the IDs of the deleted revisions
     */
    Uni<List<String>> deleteObsoleteUserSecretRevisions();

    WatchStatement initialWatchStatementForObsoleteRevision(Set<String> appOwners, Set<String> unitOwners);

    /**
     * @param revisionIds revision IDs to report, all owned revisions when empty
     * @return Uni with revision keys of the obsolete ones
     */
    Uni<List<String>> getRevisionIdsForObsolete(Set<String> appOwners, Set<String> unitOwners, Set<String> revisionIds);
}
