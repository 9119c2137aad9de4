package org.tzguard.text;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Shapes of timestamp text, and whether each shape lets a caller-supplied zone decide the instant.
 *
 * <p>Text that carries its own offset, region or epoch value is self-describing: the supplied zone
 * is ignored for instant computation and may only be applied afterwards for display.</p>
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum InputShape {
    /** {@code now}: current instant. */
    NOW(true),
    /** Wall-clock date-time without zone information, e.g. {@code 2014-01-01 12:00:00}. */
    PLAIN(true),
    /** Date-time with a numeric offset, e.g. {@code 2014-01-01 12:00:00 +0000}. */
    OFFSET_QUALIFIED(false),
    /** Date-time followed by a region id, e.g. {@code 2014-01-01 12:00:00 Europe/Paris}. */
    REGION_QUALIFIED(false),
    /** Epoch seconds behind a marker, e.g. {@code @1388577600}; always UTC-equivalent. */
    EPOCH_MARKER(false);

    /** True when an explicit zone argument is used to compute the instant. */
    private final boolean honorsExplicitZone;
}
