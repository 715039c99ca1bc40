package strongbox.core.model.store;

public enum TransactionMode {
    /** Reads the last committed state; writes are rejected. */
    READ_ONLY,

    /** Serializable read-write unit of work. */
    READ_WRITE
}
