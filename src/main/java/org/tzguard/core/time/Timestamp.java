package org.tzguard.core.time;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.tzguard.text.FormatPattern;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Immutable local timestamp: one absolute instant paired with the timezone used to display it.
 *
 * <p>Equality compares both the instant and the zone. Two timestamps that denote the same
 * instant under different zones are not equal; use {@link #sameInstantAs(Timestamp)} to compare
 * instants only. Instants are kept at second precision.</p>
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
public final class Timestamp {
    private final Instant instant;
    private final ZoneId zone;

    private Timestamp(Instant instant, ZoneId zone) {
        this.instant = TimeUtils.requireDisplayable(TimeUtils.truncateToSeconds(instant));
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    /**
     * Pairs an instant with a zone.
     *
     * @param instant absolute instant; sub-second precision is dropped.
     * @param zone display zone.
     * @return immutable timestamp.
     * @throws org.tzguard.core.TimestampFormatException when the instant cannot be displayed in every zone.
     */
    public static Timestamp of(Instant instant, ZoneId zone) {
        return new Timestamp(instant, zone);
    }

    /**
     * Creates a timestamp from a zoned date-time, keeping its zone.
     */
    public static Timestamp of(ZonedDateTime dateTime) {
        Objects.requireNonNull(dateTime, "dateTime");
        return new Timestamp(dateTime.toInstant(), dateTime.getZone());
    }

    /**
     * Returns Unix epoch seconds of the instant.
     */
    public long epochSecond() {
        return instant.getEpochSecond();
    }

    /**
     * Returns the canonical name of the attached zone ({@code Europe/Paris}, {@code +00:00}).
     */
    public String timezoneName() {
        return TimeUtils.timezoneName(zone);
    }

    /**
     * Re-expresses the same instant under another zone. This timestamp is left untouched.
     *
     * @param targetZone zone to attach.
     * @return new timestamp with the same instant.
     */
    public Timestamp withTimezone(ZoneId targetZone) {
        return new Timestamp(instant, targetZone);
    }

    /**
     * Returns whether both timestamps denote the same absolute instant, whatever their zones.
     */
    public boolean sameInstantAs(Timestamp other) {
        return instant.equals(Objects.requireNonNull(other, "other").instant);
    }

    /**
     * Returns the wall-clock view of this timestamp in its attached zone.
     */
    public ZonedDateTime toZonedDateTime() {
        return ZonedDateTime.ofInstant(instant, zone);
    }

    /**
     * Formats this timestamp in its attached zone.
     *
     * @param pattern compiled format pattern.
     * @return formatted text.
     */
    public String format(FormatPattern pattern) {
        return Objects.requireNonNull(pattern, "pattern").format(this);
    }

    @Override
    public String toString() {
        return toZonedDateTime().toString();
    }
}
