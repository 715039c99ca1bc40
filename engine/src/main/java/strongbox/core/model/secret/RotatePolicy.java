package strongbox.core.model.secret;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Optional;

/**
 * How often a secret should be rotated by its owner.
 *
 * <p>Offsets are calendar based and computed in UTC, so a monthly policy
 * applied on 31 January lands on the last day of February.
 */
public enum RotatePolicy {
    NEVER("never"),
    HOURLY("hourly"),
    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly"),
    QUARTERLY("quarterly"),
    YEARLY("yearly");

    private final String value;

    RotatePolicy(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parse a policy name. A null or blank value means {@link #NEVER}.
     *
     * @throws IllegalArgumentException for an unknown policy
     */
    public static RotatePolicy parse(String value) {
        if (value == null || value.isBlank()) {
            return NEVER;
        }
        final var normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RotatePolicy policy : values()) {
            if (policy.value.equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("secret rotate policy \"" + value + "\" not valid");
    }

    public boolean willRotate() {
        return this != NEVER;
    }

    /**
     * When the secret should next be rotated, given the last rotation time.
     *
     * @return empty for {@link #NEVER}
     */
    public Optional<Instant> nextRotateTime(Instant lastRotated) {
        final var utc = lastRotated.atZone(ZoneOffset.UTC);
        return switch (this) {
            case NEVER -> Optional.empty();
            case HOURLY -> Optional.of(lastRotated.plus(Duration.ofHours(1)));
            case DAILY -> Optional.of(utc.plusDays(1).toInstant());
            case WEEKLY -> Optional.of(utc.plusDays(7).toInstant());
            case MONTHLY -> Optional.of(utc.plusMonths(1).toInstant());
            case QUARTERLY -> Optional.of(utc.plusMonths(3).toInstant());
            case YEARLY -> Optional.of(utc.plusYears(1).toInstant());
        };
    }

    /**
     * Whether this policy rotates more frequently than {@code other}.
     */
    public boolean lessThan(RotatePolicy other) {
        if (!willRotate()) {
            return false;
        }
        if (!other.willRotate()) {
            return true;
        }
        final var now = Instant.now();
        return nextRotateTime(now).orElseThrow().isBefore(other.nextRotateTime(now).orElseThrow());
    }

    @Override
    public String toString() {
        return value;
    }
}
