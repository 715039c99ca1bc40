package strongbox.core.model.secret;

/**
 * Kind of entity that owns a secret.
 */
public enum OwnerKind {
    /** Secret created by an end user; the model owns it. */
    MODEL,

    /** Charm secret shared by every unit of an application. */
    APPLICATION,

    /** Charm secret private to one unit. */
    UNIT
}
