package strongbox.core.service.secret;

import org.jboss.logging.Logger;

import strongbox.core.model.store.Relations;
import strongbox.core.port.out.StoreSession;

/**
 * Marks a revision obsolete once it is neither the latest revision of its
 * secret nor acknowledged by any local consumer.
 *
 * <p>Obsolete revisions are also flagged pending delete; whether they are
 * pruned depends on the secret's auto-prune setting at prune time. Grants play
 * no part in retention.
 */
final class RevisionObsolescence {

    private static final Logger LOG = Logger.getLogger(RevisionObsolescence.class);

    private RevisionObsolescence() {}

    /**
     * Re-evaluate one revision in the caller's session.
     *
     * @return true if the revision became obsolete
     */
    static boolean reevaluate(StoreSession session, String secretId, int revision) {
        final var candidate = SecretRows.revision(session, secretId, revision);
        if (candidate.isEmpty() || candidate.get().obsolete()) {
            return false;
        }
        if (revision >= SecretRows.latestRevisionNumber(session, secretId)) {
            return false;
        }
        final var acknowledged = session.relation(Relations.CONSUMERS)
                .exists(c -> c.secretId().equals(secretId) && c.currentRevision() == revision);
        if (acknowledged) {
            return false;
        }
        session.relation(Relations.REVISIONS).put(candidate.get().withObsolete(true, true));
        LOG.debugf("Revision %d of secret %s is obsolete", revision, secretId);
        return true;
    }
}
