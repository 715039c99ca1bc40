package strongbox.core.model.access;

public enum AccessScopeKind {
    UNIT,
    APPLICATION,
    RELATION,
    MODEL
}
