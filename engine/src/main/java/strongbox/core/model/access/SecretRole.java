package strongbox.core.model.access;

/**
 * Capability a grant confers on its subject.
 *
 * <p>{@link #NONE} is the answer to an access query when no grant applies;
 * it is never stored.
 */
public enum SecretRole {
    NONE(""),
    VIEW("view"),
    MANAGE("manage");

    private final String value;

    SecretRole(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static SecretRole parse(String value) {
        if (value == null || value.isEmpty()) {
            return NONE;
        }
        for (SecretRole role : values()) {
            if (role.value.equals(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("secret role \"" + value + "\" not valid");
    }

    /**
     * Whether holding this role satisfies {@code required}.
     */
    public boolean allows(SecretRole required) {
        return compareTo(required) >= 0;
    }

    public SecretRole max(SecretRole other) {
        return compareTo(other) >= 0 ? this : other;
    }

    @Override
    public String toString() {
        return value;
    }
}
