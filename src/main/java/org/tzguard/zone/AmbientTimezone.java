package org.tzguard.zone;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tzguard.core.TimestampFactory;
import org.tzguard.core.UnknownTimezoneException;
import org.tzguard.core.time.TimeUtils;

import java.time.ZoneId;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Process-wide ambient default timezone, backed by the JVM default {@link TimeZone}.
 *
 * <p>Every construction that omits an explicit zone under the {@code AMBIENT} fallback policy reads
 * this value at call time. It is shared by all threads and is not synchronized: a change made by
 * one component silently alters the instants computed by every other one. Already constructed
 * timestamps are never affected.</p>
 *
 * <p>Offset ids go through {@link TimeZone}, so {@code +01:00} is read back as {@code GMT+01:00}
 * and {@code +00:00} as {@code UTC}. Prefixed offsets such as {@code UTC+01:00}
 * are installed as their plain offset.</p>
 */
public final class AmbientTimezone {
    private static final Logger log = LoggerFactory.getLogger(AmbientTimezone.class);

    private AmbientTimezone() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Returns the ambient zone as seen right now.
     */
    public static ZoneId current() {
        return ZoneId.systemDefault();
    }

    /**
     * Returns the canonical name of the ambient zone.
     */
    public static String id() {
        return TimeUtils.timezoneName(current());
    }

    /**
     * Replaces the ambient zone.
     *
     * @param timezoneId timezone id string.
     * @return the previous ambient zone.
     * @throws org.tzguard.core.UnknownTimezoneException when the id is not recognized; the ambient
     *         zone is left unchanged.
     */
    public static ZoneId set(String timezoneId) {
        return set(TimezoneResolver.resolve(timezoneId));
    }

    /**
     * Replaces the ambient zone.
     *
     * @param zone new ambient zone.
     * @return the previous ambient zone.
     * @throws UnknownTimezoneException when {@link TimeZone} cannot hold the zone's rules; the ambient
     *         zone is left unchanged.
     */
    public static ZoneId set(ZoneId zone) {
        Objects.requireNonNull(zone, "zone");
        TimeZone timeZone = toTimeZone(zone);
        ZoneId previous = current();
        TimeZone.setDefault(timeZone);
        log.debug("Ambient timezone changed from {} to {}", previous.getId(), zone.getId());
        return previous;
    }

    // TimeZone maps ids it does not know to GMT, so the installed rules are checked.
    private static TimeZone toTimeZone(ZoneId zone) {
        TimeZone timeZone = TimeZone.getTimeZone(zone);
        if (sameRules(timeZone, zone)) {
            return timeZone;
        }
        TimeZone normalized = TimeZone.getTimeZone(zone.normalized());
        if (sameRules(normalized, zone)) {
            return normalized;
        }
        throw new UnknownTimezoneException(
                TimestampFactory.REASON_UNKNOWN_TIMEZONE,
                "timezone id cannot be installed as the ambient zone: " + zone.getId()
        );
    }

    private static boolean sameRules(TimeZone timeZone, ZoneId zone) {
        return timeZone.toZoneId().getRules().equals(zone.getRules());
    }
}
