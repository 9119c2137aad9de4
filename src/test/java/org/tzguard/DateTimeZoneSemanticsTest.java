package org.tzguard;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.tzguard.core.TimestampFactory;
import org.tzguard.core.time.Timestamp;
import org.tzguard.serialization.TimestampCodec;
import org.tzguard.testutil.AmbientTimezoneExtension;
import org.tzguard.testutil.TimestampTestFactories;
import org.tzguard.text.DisplayFormatter;
import org.tzguard.text.FormatPattern;
import org.tzguard.zone.AmbientTimezone;

import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Executable notes on timezone-aware construction and formatting.
 *
 * <p>Every test starts with the ambient zone pinned to UTC.</p>
 */
@DisplayName("Timezone semantics")
@ExtendWith(AmbientTimezoneExtension.class)
class DateTimeZoneSemanticsTest {
    private static final ZoneId PARIS = ZoneId.of("Europe/Paris");
    private static final ZoneId LOS_ANGELES = ZoneId.of("America/Los_Angeles");
    private static final String NEW_YEAR_NOON = "2014-01-01 12:00:00";

    /** 2014-01-01T12:00:00Z. */
    private static final long NEW_YEAR_NOON_UTC = 1_388_577_600L;

    private final TimestampFactory factory = TimestampTestFactories.ambient();

    @Test
    @DisplayName("No-argument construction is the same as parsing 'now'")
    void testDefaultFirstArgumentIsNow() {
        Timestamp implicitNow = factory.now();
        Timestamp explicitNow = factory.parse("now");

        assertEquals(implicitNow, explicitNow);
        assertEquals("UTC", implicitNow.timezoneName());
    }

    @Test
    @DisplayName("Omitted zone falls back to the ambient zone")
    void testOmittedZoneUsesAmbientZone() {
        Timestamp explicit = factory.parse(NEW_YEAR_NOON, LOS_ANGELES);

        AmbientTimezone.set("America/Los_Angeles");
        Timestamp implicit = factory.parse(NEW_YEAR_NOON);

        assertEquals(explicit.format(FormatPattern.SIMPLE), implicit.format(FormatPattern.SIMPLE));
        assertEquals("America/Los_Angeles", explicit.timezoneName());
        assertEquals("America/Los_Angeles", implicit.timezoneName());
        assertEquals(explicit, implicit);
    }

    @Test
    @DisplayName("Explicit Paris zone and ambient Paris zone agree on 11:00 UTC")
    void testExplicitAndAmbientParisAgree() {
        Timestamp explicit = factory.parse(NEW_YEAR_NOON, PARIS);

        AmbientTimezone.set("Europe/Paris");
        Timestamp implicit = factory.parse(NEW_YEAR_NOON);

        long elevenUtc = NEW_YEAR_NOON_UTC - 3_600L;
        assertEquals(elevenUtc, explicit.epochSecond());
        assertEquals(elevenUtc, implicit.epochSecond());
        assertEquals(NEW_YEAR_NOON, explicit.format(FormatPattern.SIMPLE));
        assertEquals(NEW_YEAR_NOON, implicit.format(FormatPattern.SIMPLE));
        assertEquals("Europe/Paris", explicit.timezoneName());
        assertEquals("Europe/Paris", implicit.timezoneName());
    }

    @Test
    @DisplayName("Same text under different explicit zones gives different instants")
    void testSameTextDifferentExplicitZonesAreNotEqual() {
        Timestamp paris = factory.parse(NEW_YEAR_NOON, PARIS);
        Timestamp losAngeles = factory.parse(NEW_YEAR_NOON, LOS_ANGELES);

        assertEquals(paris.format(FormatPattern.SIMPLE), losAngeles.format(FormatPattern.SIMPLE));
        assertNotEquals(paris.epochSecond(), losAngeles.epochSecond());
        assertEquals(9 * 3_600L, losAngeles.epochSecond() - paris.epochSecond());
        assertNotEquals(paris, losAngeles);

        assertEquals("Europe/Paris", paris.timezoneName());
        assertEquals("America/Los_Angeles", losAngeles.timezoneName());
    }

    @Test
    @DisplayName("Same text under different ambient zones gives different instants")
    void testSameTextDifferentAmbientZonesAreNotEqual() {
        AmbientTimezone.set("Europe/Paris");
        Timestamp paris = factory.parse(NEW_YEAR_NOON);

        AmbientTimezone.set("America/Los_Angeles");
        Timestamp losAngeles = factory.parse(NEW_YEAR_NOON);

        assertEquals(paris.format(FormatPattern.SIMPLE), losAngeles.format(FormatPattern.SIMPLE));
        assertNotEquals(paris.epochSecond(), losAngeles.epochSecond());

        assertEquals("Europe/Paris", paris.timezoneName());
        assertEquals("America/Los_Angeles", losAngeles.timezoneName());
    }

    @Test
    @DisplayName("Offset in the text wins over the zone argument")
    void testOffsetInTextOverridesZoneArgument() {
        Timestamp paris = factory.parse("2014-01-01 12:00:00 +0000", PARIS);
        Timestamp losAngeles = factory.parse("2014-01-01 12:00:00 +0000", LOS_ANGELES);

        assertEquals(paris.format(FormatPattern.SIMPLE), losAngeles.format(FormatPattern.SIMPLE));
        assertEquals(NEW_YEAR_NOON_UTC, paris.epochSecond());
        assertEquals(paris.epochSecond(), losAngeles.epochSecond());
        assertEquals("+00:00", paris.timezoneName());
        assertEquals("+00:00", losAngeles.timezoneName());
    }

    @Test
    @DisplayName("Epoch marker is UTC-equivalent and ignores the zone argument")
    void testEpochMarkerOverridesZoneArgument() {
        Timestamp paris = factory.parse("@1388577600", PARIS);
        Timestamp losAngeles = factory.parse("@1388577600", LOS_ANGELES);

        assertEquals(NEW_YEAR_NOON, paris.format(FormatPattern.SIMPLE));
        assertEquals(paris.format(FormatPattern.SIMPLE), losAngeles.format(FormatPattern.SIMPLE));
        assertEquals(paris.epochSecond(), losAngeles.epochSecond());
        assertEquals("+00:00", paris.timezoneName());
    }

    @Test
    @DisplayName("Rule 1: never serialize with a pattern that drops the zone")
    void testNeverFormatWithoutTimezone() {
        Timestamp original = factory.now();
        String simpleText = original.format(FormatPattern.SIMPLE);
        String isoText = original.format(FormatPattern.ISO8601);
        long epochSecond = original.epochSecond();

        // The loading process may run under another ambient zone.
        AmbientTimezone.set("Europe/Paris");
        Timestamp reloaded = factory.createFromFormat(FormatPattern.SIMPLE, simpleText);
        assertNotEquals(original, reloaded);
        assertFalse(original.sameInstantAs(reloaded));

        reloaded = factory.createFromFormat(FormatPattern.ISO8601, isoText);
        assertTrue(original.sameInstantAs(reloaded));

        reloaded = factory.parse("@" + epochSecond);
        assertTrue(original.sameInstantAs(reloaded));

        // A zone-less value is usable only when the loader names the zone it was written in.
        reloaded = factory.createFromFormat(FormatPattern.SIMPLE, simpleText, ZoneId.of("UTC"));
        assertEquals(original, reloaded);
    }

    @Test
    @DisplayName("Rule 2: display in the zone the user expects")
    void testDisplayInExpectedTimezone() {
        Timestamp utc = factory.parse("2014-08-01 12:00:00 +0000");
        String expectedZone = "Europe/Paris";

        Timestamp toDisplay = utc.withTimezone(ZoneId.of(expectedZone));
        assertEquals("2014-08-01 14:00:00", toDisplay.format(FormatPattern.SIMPLE));
        assertEquals("2014-08-01 12:00:00", utc.format(FormatPattern.SIMPLE));

        DisplayFormatter formatter = DisplayFormatter.of(expectedZone, "yyyy-MM-dd HH:mm:ss");
        assertEquals("2014-08-01 14:00:00", formatter.format(utc));
    }

    @ParameterizedTest(name = "{0} reloaded under {1}")
    @CsvSource({
            "2014-01-01 12:00:00 +0000, Europe/Paris",
            "2014-08-01 12:00:00 +0000, America/Los_Angeles",
            "1969-07-20 20:17:40 +0000, Asia/Kolkata",
            "2014-03-30 01:30:00 +0000, Europe/Paris",
            "2038-01-19 03:14:08 +0000, Pacific/Chatham"
    })
    @DisplayName("Offset-bearing pattern and epoch value survive any ambient zone")
    void testOffsetBearingRoundTripIgnoresAmbientZone(String text, String ambientZone) {
        Timestamp original = factory.parse(text);
        String isoText = original.format(FormatPattern.ISO8601);
        String epochText = TimestampCodec.EPOCH_SECONDS.encode(original);

        AmbientTimezone.set(ambientZone);

        assertEquals(original.instant(), factory.createFromFormat(FormatPattern.ISO8601, isoText).instant());
        assertEquals(original.instant(), factory.parse(isoText).instant());
        assertEquals(original.instant(), TimestampCodec.EPOCH_SECONDS.decode(epochText, factory).instant());
    }

    @ParameterizedTest(name = "{0} vs {1}")
    @CsvSource({
            "Europe/Paris, America/Los_Angeles",
            "UTC, Asia/Tokyo",
            "Australia/Sydney, America/New_York"
    })
    @DisplayName("Same instant under two zones: not equal, same instant")
    void testSameInstantDifferentZonesAreNotEqual(String first, String second) {
        Timestamp base = factory.parse("@1388577600");

        Timestamp a = base.withTimezone(ZoneId.of(first));
        Timestamp b = base.withTimezone(ZoneId.of(second));

        assertNotEquals(a, b);
        assertTrue(a.sameInstantAs(b));
        assertEquals(a.instant(), b.instant());
    }
}
