package org.tzguard.core.time;

import org.tzguard.core.TimestampFactory;
import org.tzguard.core.TimestampFormatException;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.zone.ZoneOffsetTransition;
import java.util.List;
import java.util.Objects;

/**
 * Placement rule for wall-clock times that a DST transition makes ambiguous.
 *
 * <p>A gap is a local time that never happens (clocks jump forward); an overlap is a local
 * time that happens twice (clocks fall back).</p>
 */
public enum LocalTimePolicy {
    /**
     * Overlap resolves to the earlier instant; gap shifts forward by the gap length.
     */
    EARLIER_OFFSET,
    /**
     * Overlap resolves to the later instant; gap shifts forward by the gap length.
     */
    LATER_OFFSET,
    /**
     * Gaps and overlaps are rejected.
     */
    REJECT;

    /**
     * Places one local date-time on the timeline of a zone.
     *
     * @param localDateTime wall-clock date-time.
     * @param zone zone whose rules apply.
     * @return zoned date-time in {@code zone}.
     * @throws TimestampFormatException when the local time is ambiguous and this policy is {@link #REJECT}.
     */
    public ZonedDateTime resolve(LocalDateTime localDateTime, ZoneId zone) {
        Objects.requireNonNull(localDateTime, "localDateTime");
        Objects.requireNonNull(zone, "zone");
        List<ZoneOffset> validOffsets = zone.getRules().getValidOffsets(localDateTime);
        if (validOffsets.size() == 1) {
            return ZonedDateTime.ofLocal(localDateTime, zone, validOffsets.get(0));
        }
        if (this == REJECT) {
            ZoneOffsetTransition transition = zone.getRules().getTransition(localDateTime);
            if (validOffsets.isEmpty()) {
                throw new TimestampFormatException(
                        TimestampFactory.REASON_LOCAL_TIME_GAP,
                        localDateTime + " does not exist in " + zone.getId() + " (" + transition + ")"
                );
            }
            throw new TimestampFormatException(
                    TimestampFactory.REASON_LOCAL_TIME_OVERLAP,
                    localDateTime + " occurs twice in " + zone.getId() + " (" + transition + ")"
            );
        }
        ZonedDateTime resolved = ZonedDateTime.ofLocal(localDateTime, zone, null);
        return this == LATER_OFFSET ? resolved.withLaterOffsetAtOverlap() : resolved.withEarlierOffsetAtOverlap();
    }
}
