package org.tzguard.text;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.tzguard.core.TimestampFactory;
import org.tzguard.core.TimestampFormatException;
import org.tzguard.core.time.Timestamp;
import org.tzguard.zone.TimezoneResolver;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * End-user display formatter bound to one target zone.
 *
 * <p>The zone attached to a timestamp is ignored: every value is re-expressed in the target zone
 * before formatting. Patterns use {@link DateTimeFormatter} letters ({@code yyyy-MM-dd HH:mm:ss}),
 * which differ from the single-character codes of {@link FormatPattern}, and are rendered with
 * {@link Locale#ROOT}.</p>
 */
@Getter
@Accessors(fluent = true)
public final class DisplayFormatter {
    private final ZoneId zone;
    private final String pattern;

    @Getter(AccessLevel.NONE)
    private final DateTimeFormatter formatter;

    private DisplayFormatter(ZoneId zone, String pattern, DateTimeFormatter formatter) {
        this.zone = zone;
        this.pattern = pattern;
        this.formatter = formatter;
    }

    /**
     * Creates a formatter for a target zone id.
     *
     * @param timezoneId display zone id.
     * @param pattern {@link DateTimeFormatter} pattern.
     * @return display formatter.
     * @throws org.tzguard.core.UnknownTimezoneException when the zone id is unknown.
     * @throws TimestampFormatException when the pattern is invalid.
     */
    public static DisplayFormatter of(String timezoneId, String pattern) {
        return of(TimezoneResolver.resolve(timezoneId), pattern);
    }

    /**
     * Creates a formatter for a target zone.
     */
    public static DisplayFormatter of(ZoneId zone, String pattern) {
        Objects.requireNonNull(zone, "zone");
        Objects.requireNonNull(pattern, "pattern");
        DateTimeFormatter formatter;
        try {
            formatter = DateTimeFormatter.ofPattern(pattern, Locale.ROOT).withZone(zone);
        } catch (IllegalArgumentException ex) {
            throw new TimestampFormatException(
                    TimestampFactory.REASON_UNSUPPORTED_PATTERN,
                    "invalid display pattern '" + pattern + "': " + ex.getMessage(),
                    ex
            );
        }
        return new DisplayFormatter(zone, pattern, formatter);
    }

    /**
     * Formats an instant in the target zone.
     */
    public String format(Instant instant) {
        return formatter.format(Objects.requireNonNull(instant, "instant"));
    }

    /**
     * Formats a timestamp in the target zone, whatever zone it carries.
     */
    public String format(Timestamp timestamp) {
        return format(Objects.requireNonNull(timestamp, "timestamp").instant());
    }

    /**
     * Returns the timestamp re-expressed in the target zone.
     */
    public Timestamp toDisplayTimestamp(Timestamp timestamp) {
        return Objects.requireNonNull(timestamp, "timestamp").withTimezone(zone);
    }
}
