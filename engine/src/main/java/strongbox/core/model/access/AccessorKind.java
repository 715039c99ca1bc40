package strongbox.core.model.access;

public enum AccessorKind {
    UNIT,
    APPLICATION,
    MODEL
}
