package org.tzguard.zone;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.tzguard.core.TimestampFactory;
import org.tzguard.core.UnknownTimezoneException;
import org.tzguard.testutil.AmbientTimezoneExtension;
import org.tzguard.testutil.TimestampTestFactories;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.TimeZone;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("AmbientTimezone Tests")
@ExtendWith(AmbientTimezoneExtension.class)
class AmbientTimezoneTest {

    @Test
    @DisplayName("Set returns the previous zone and is visible process-wide")
    void testSetReturnsPrevious() {
        ZoneId previous = AmbientTimezone.set("Europe/Paris");

        assertEquals(ZoneId.of("UTC"), previous);
        assertEquals(ZoneId.of("Europe/Paris"), AmbientTimezone.current());
        assertEquals("Europe/Paris", AmbientTimezone.id());
        assertEquals("Europe/Paris", TimeZone.getDefault().getID());
    }

    @Test
    @DisplayName("Unknown id leaves the ambient zone unchanged")
    void testUnknownIdLeavesZoneUnchanged() {
        AmbientTimezone.set("Asia/Tokyo");
        UnknownTimezoneException ex = assertThrows(
                UnknownTimezoneException.class,
                () -> AmbientTimezone.set("Asia/Atlantis")
        );
        assertEquals(TimestampFactory.REASON_UNKNOWN_TIMEZONE, ex.reasonCode());
        assertEquals("Asia/Tokyo", AmbientTimezone.id());
    }

    @Test
    @DisplayName("Offset ambient zones are read back through TimeZone naming")
    void testOffsetAmbientZoneNaming() {
        AmbientTimezone.set("+01:00");
        assertEquals("GMT+01:00", AmbientTimezone.id());

        AmbientTimezone.set("+00:00");
        assertEquals("UTC", AmbientTimezone.id());
    }

    @ParameterizedTest
    @CsvSource({
            "UTC+01:00, 3600",
            "UT+01:00,  3600",
            "GMT-05:30, -19800",
            "UT,        0"
    })
    @DisplayName("Prefixed ids install a zone with the same offset")
    void testPrefixedIdsKeepTheirOffset(String timezoneId, int expectedOffsetSeconds) {
        AmbientTimezone.set(timezoneId);

        ZoneId installed = AmbientTimezone.current();
        assertEquals(
                ZoneOffset.ofTotalSeconds(expectedOffsetSeconds),
                installed.getRules().getOffset(Instant.EPOCH)
        );
        assertEquals(TimezoneResolver.resolve(timezoneId).getRules(), installed.getRules());

        TimestampFactory factory = TimestampTestFactories.ambient();
        assertEquals(
                factory.parse("2014-01-01 12:00:00", timezoneId).epochSecond(),
                factory.parse("2014-01-01 12:00:00").epochSecond()
        );
    }

    @Test
    @DisplayName("Null zone is rejected")
    void testNullZoneRejected() {
        assertThrows(NullPointerException.class, () -> AmbientTimezone.set((ZoneId) null));
    }
}
