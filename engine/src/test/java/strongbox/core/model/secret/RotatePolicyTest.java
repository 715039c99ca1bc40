package strongbox.core.model.secret;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RotatePolicy")
class RotatePolicyTest {

    private static final Instant LAST = Instant.parse("2024-01-31T10:15:00Z");

    @Nested
    @DisplayName("nextRotateTime()")
    class NextRotateTimeTests {

        @Test
        @DisplayName("should be empty for never")
        void shouldBeEmptyForNever() {
            assertEquals(Optional.empty(), RotatePolicy.NEVER.nextRotateTime(LAST));
        }

        @Test
        @DisplayName("should add fixed offsets")
        void shouldAddFixedOffsets() {
            assertEquals(Instant.parse("2024-01-31T11:15:00Z"), RotatePolicy.HOURLY.nextRotateTime(LAST).orElseThrow());
            assertEquals(Instant.parse("2024-02-01T10:15:00Z"), RotatePolicy.DAILY.nextRotateTime(LAST).orElseThrow());
            assertEquals(Instant.parse("2024-02-07T10:15:00Z"), RotatePolicy.WEEKLY.nextRotateTime(LAST).orElseThrow());
        }

        @Test
        @DisplayName("should add calendar months in UTC")
        void shouldAddCalendarMonths() {
            assertEquals(Instant.parse("2024-02-29T10:15:00Z"), RotatePolicy.MONTHLY.nextRotateTime(LAST).orElseThrow());
            assertEquals(
                    Instant.parse("2024-04-30T10:15:00Z"), RotatePolicy.QUARTERLY.nextRotateTime(LAST).orElseThrow());
            assertEquals(Instant.parse("2025-01-31T10:15:00Z"), RotatePolicy.YEARLY.nextRotateTime(LAST).orElseThrow());
        }
    }

    @Nested
    @DisplayName("parse()")
    class ParseTests {

        @Test
        @DisplayName("should treat blank as never")
        void shouldTreatBlankAsNever() {
            assertEquals(RotatePolicy.NEVER, RotatePolicy.parse(""));
            assertEquals(RotatePolicy.NEVER, RotatePolicy.parse(null));
        }

        @Test
        @DisplayName("should parse case-insensitively")
        void shouldParseCaseInsensitively() {
            assertEquals(RotatePolicy.QUARTERLY, RotatePolicy.parse("Quarterly"));
        }

        @Test
        @DisplayName("should reject unknown policy")
        void shouldRejectUnknownPolicy() {
            assertThrows(IllegalArgumentException.class, () -> RotatePolicy.parse("fortnightly"));
        }
    }

    @Test
    @DisplayName("lessThan() should order by frequency")
    void lessThanShouldOrderByFrequency() {
        assertTrue(RotatePolicy.HOURLY.lessThan(RotatePolicy.DAILY));
        assertTrue(RotatePolicy.YEARLY.lessThan(RotatePolicy.NEVER));
        assertFalse(RotatePolicy.NEVER.lessThan(RotatePolicy.HOURLY));
        assertFalse(RotatePolicy.MONTHLY.lessThan(RotatePolicy.WEEKLY));
    }
}
