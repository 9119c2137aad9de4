package org.tzguard.zone;

import org.tzguard.core.TimestampFactory;
import org.tzguard.core.UnknownTimezoneException;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Strict timezone id parsing.
 *
 * <p>Accepts region ids ({@code Europe/Paris}, {@code UTC}) and offsets ({@code Z}, {@code +01},
 * {@code +0100}, {@code +01:00}). Ids are case-sensitive; short aliases like {@code EST} are rejected.</p>
 */
public final class TimezoneResolver {

    private TimezoneResolver() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Parses a timezone id string.
     *
     * @param timezoneId timezone id string.
     * @return validated zone id.
     * @throws UnknownTimezoneException when the id is blank or not known to the tz database.
     */
    public static ZoneId resolve(String timezoneId) {
        if (timezoneId == null || timezoneId.isBlank()) {
            throw new UnknownTimezoneException(
                    TimestampFactory.REASON_UNKNOWN_TIMEZONE,
                    "timezone id missing"
            );
        }
        String normalized = timezoneId.trim();
        try {
            return ZoneId.of(normalized);
        } catch (DateTimeException ex) {
            throw new UnknownTimezoneException(
                    TimestampFactory.REASON_UNKNOWN_TIMEZONE,
                    "unknown timezone id: " + normalized,
                    ex
            );
        }
    }

    /**
     * Returns whether {@link #resolve(String)} would accept the id.
     */
    public static boolean isKnown(String timezoneId) {
        if (timezoneId == null || timezoneId.isBlank()) {
            return false;
        }
        try {
            ZoneId.of(timezoneId.trim());
            return true;
        } catch (DateTimeException ex) {
            return false;
        }
    }
}
