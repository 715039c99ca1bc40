package strongbox.core.model.store;

/**
 * The relations of the secret store.
 *
 * <p>Relation names double as change-feed namespaces.
 */
public final class Relations {

    public static final Relation<String, SecretRecord> SECRETS =
            Relation.of("secret_metadata", SecretRecord.class, SecretRecord::id);

    public static final Relation<String, RevisionRecord> REVISIONS =
            Relation.of("secret_revision", RevisionRecord.class, RevisionRecord::revisionId);

    public static final Relation<String, ExpiryRecord> EXPIRIES =
            Relation.of("secret_revision_expire", ExpiryRecord.class, ExpiryRecord::revisionId);

    public static final Relation<String, RotationRecord> ROTATIONS =
            Relation.of("secret_rotation", RotationRecord.class, RotationRecord::secretId);

    public static final Relation<ConsumerRecord.Key, ConsumerRecord> CONSUMERS =
            Relation.of("secret_unit_consumer", ConsumerRecord.class, ConsumerRecord::key);

    public static final Relation<RemoteConsumerRecord.Key, RemoteConsumerRecord> REMOTE_CONSUMERS =
            Relation.of("secret_remote_unit_consumer", RemoteConsumerRecord.class, RemoteConsumerRecord::key);

    public static final Relation<String, SecretReferenceRecord> REFERENCES =
            Relation.of("secret_reference", SecretReferenceRecord.class, SecretReferenceRecord::secretId);

    public static final Relation<GrantRecord.Key, GrantRecord> GRANTS =
            Relation.of("secret_permission", GrantRecord.class, GrantRecord::key);

    public static final Relation<String, BackendRecord> BACKENDS =
            Relation.of("secret_backend", BackendRecord.class, BackendRecord::id);

    public static final Relation<String, BackendRotationRecord> BACKEND_ROTATIONS =
            Relation.of("secret_backend_rotation", BackendRotationRecord.class, BackendRotationRecord::backendId);

    /** Namespace of the obsolete-revision change feed; obsolescence lives on revision rows. */
    public static final String OBSOLETE_REVISIONS_NAMESPACE = "secret_revision_obsolete";

    private Relations() {}
}
