package org.tzguard.text;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * Classified timestamp text, not yet placed on the timeline.
 */
@Value
@Builder
public class ParsedTimestampText {

    /**
     * Original input text.
     */
    String source;

    /**
     * Recognized shape.
     */
    InputShape shape;

    /**
     * Wall-clock date-time for {@code PLAIN}, {@code OFFSET_QUALIFIED} and {@code REGION_QUALIFIED};
     * {@code null} otherwise.
     */
    LocalDateTime localDateTime;

    /**
     * Zone carried by the text itself: the offset for {@code OFFSET_QUALIFIED}, the region for
     * {@code REGION_QUALIFIED}; {@code null} otherwise.
     */
    ZoneId textZone;

    /**
     * Epoch seconds for {@code EPOCH_MARKER}; zero otherwise.
     */
    long epochSecond;
}
