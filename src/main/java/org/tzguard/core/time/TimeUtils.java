package org.tzguard.core.time;

import org.tzguard.core.TimestampFactory;
import org.tzguard.core.TimestampFormatException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Shared deterministic time helpers for timestamp construction and naming.
 *
 * <p>All epoch values are Unix epoch seconds and are safe for negative timestamps.</p>
 */
public final class TimeUtils {

    /**
     * Leading character of the epoch-marker text form, for example {@code @1388577600}.
     */
    public static final char EPOCH_MARKER = '@';

    /**
     * Canonical name of the zero offset. {@link ZoneOffset#UTC} reports {@code Z} as its id.
     */
    public static final String ZERO_OFFSET_NAME = "+00:00";

    /**
     * Smallest epoch second whose wall-clock view exists under every offset.
     */
    public static final long MIN_EPOCH_SECOND = LocalDateTime.MIN.toEpochSecond(ZoneOffset.MIN);

    /**
     * Largest epoch second whose wall-clock view exists under every offset.
     */
    public static final long MAX_EPOCH_SECOND = LocalDateTime.MAX.toEpochSecond(ZoneOffset.MAX);

    /**
     * Prevents instantiation of this utility class.
     */
    private TimeUtils() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Drops the sub-second part of an instant (floor, so pre-1970 instants move backwards).
     *
     * @param instant instant to truncate.
     * @return instant with zero nanoseconds.
     */
    public static Instant truncateToSeconds(Instant instant) {
        return Objects.requireNonNull(instant, "instant").truncatedTo(ChronoUnit.SECONDS);
    }

    /**
     * Returns the canonical timezone name reported by timestamps.
     *
     * <p>Region zones report their region id ({@code Europe/Paris}, {@code UTC}); fixed offsets
     * report {@code +HH:MM}, including {@code +00:00} for the zero offset.</p>
     *
     * @param zoneId zone to name.
     * @return canonical timezone name.
     */
    public static String timezoneName(ZoneId zoneId) {
        Objects.requireNonNull(zoneId, "zoneId");
        if (zoneId instanceof ZoneOffset) {
            ZoneOffset offset = (ZoneOffset) zoneId;
            if (offset.getTotalSeconds() == 0) {
                return ZERO_OFFSET_NAME;
            }
            return offset.getId();
        }
        return zoneId.getId();
    }

    /**
     * Formats epoch seconds using the epoch-marker text form.
     *
     * @param epochSec Unix timestamp in seconds.
     * @return text like {@code @1388577600}.
     */
    public static String epochMarker(long epochSec) {
        return EPOCH_MARKER + Long.toString(epochSec);
    }

    /**
     * Converts epoch seconds to an instant that can be formatted under any zone.
     *
     * @param epochSec Unix timestamp in seconds.
     * @return corresponding instant.
     * @throws TimestampFormatException when the value is outside
     *         {@link #MIN_EPOCH_SECOND}..{@link #MAX_EPOCH_SECOND}.
     */
    public static Instant instantOfEpochSecond(long epochSec) {
        if (epochSec < MIN_EPOCH_SECOND || epochSec > MAX_EPOCH_SECOND) {
            throw outOfRange(Long.toString(epochSec));
        }
        return Instant.ofEpochSecond(epochSec);
    }

    /**
     * Checks that an instant can be formatted under any zone.
     *
     * @param instant instant to check.
     * @return the same instant.
     * @throws TimestampFormatException when the instant is outside the displayable range.
     */
    public static Instant requireDisplayable(Instant instant) {
        long epochSec = Objects.requireNonNull(instant, "instant").getEpochSecond();
        if (epochSec < MIN_EPOCH_SECOND || epochSec > MAX_EPOCH_SECOND) {
            throw outOfRange(instant.toString());
        }
        return instant;
    }

    private static TimestampFormatException outOfRange(String value) {
        return new TimestampFormatException(
                TimestampFactory.REASON_EPOCH_OUT_OF_RANGE,
                "epoch seconds out of range: " + value
        );
    }
}
