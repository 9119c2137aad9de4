package org.tzguard.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tzguard.core.TimestampFactory;
import org.tzguard.core.TimestampFormatException;
import org.tzguard.core.UnknownTimezoneException;
import org.tzguard.core.time.Timestamp;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("DisplayFormatter Tests")
class DisplayFormatterTest {
    private static final String PATTERN = "yyyy-MM-dd HH:mm:ss";

    @Test
    @DisplayName("Display follows the target zone's offset on each date")
    void testSummerAndWinterOffsets() {
        DisplayFormatter paris = DisplayFormatter.of("Europe/Paris", PATTERN);

        assertEquals("2014-08-01 14:00:00", paris.format(Instant.parse("2014-08-01T12:00:00Z")));
        assertEquals("2014-01-01 13:00:00", paris.format(Instant.parse("2014-01-01T12:00:00Z")));
    }

    @Test
    @DisplayName("Attached zone of the timestamp does not matter")
    void testAttachedZoneIgnored() {
        DisplayFormatter paris = DisplayFormatter.of(ZoneId.of("Europe/Paris"), PATTERN);
        Instant instant = Instant.parse("2014-08-01T12:00:00Z");

        String fromUtc = paris.format(Timestamp.of(instant, ZoneOffset.UTC));
        String fromTokyo = paris.format(Timestamp.of(instant, ZoneId.of("Asia/Tokyo")));
        assertEquals(fromUtc, fromTokyo);

        Timestamp display = paris.toDisplayTimestamp(Timestamp.of(instant, ZoneId.of("Asia/Tokyo")));
        assertEquals("Europe/Paris", display.timezoneName());
        assertEquals(instant, display.instant());
    }

    @Test
    @DisplayName("Zone names render with the pattern letters")
    void testZonePatternLetters() {
        DisplayFormatter formatter = DisplayFormatter.of("America/Los_Angeles", "HH:mm VV xxx");
        assertEquals("05:00 America/Los_Angeles -07:00", formatter.format(Instant.parse("2014-08-01T12:00:00Z")));
        assertEquals("HH:mm VV xxx", formatter.pattern());
    }

    @Test
    @DisplayName("Invalid pattern is rejected with deterministic reason code")
    void testInvalidPattern() {
        TimestampFormatException ex = assertThrows(
                TimestampFormatException.class,
                () -> DisplayFormatter.of("UTC", "yyyy-MM-dd {")
        );
        assertEquals(TimestampFactory.REASON_UNSUPPORTED_PATTERN, ex.reasonCode());
        assertTrue(ex.getMessage().contains("yyyy-MM-dd {"));
    }

    @Test
    @DisplayName("Unknown target zone is rejected")
    void testUnknownZone() {
        UnknownTimezoneException ex = assertThrows(
                UnknownTimezoneException.class,
                () -> DisplayFormatter.of("Europe/Atlantis", PATTERN)
        );
        assertEquals(TimestampFactory.REASON_UNKNOWN_TIMEZONE, ex.reasonCode());
    }
}
