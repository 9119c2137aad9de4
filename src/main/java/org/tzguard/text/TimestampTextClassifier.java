package org.tzguard.text;

import org.tzguard.core.TimestampFactory;
import org.tzguard.core.TimestampFormatException;
import org.tzguard.core.UnknownTimezoneException;
import org.tzguard.core.time.TimeUtils;
import org.tzguard.zone.TimezoneResolver;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes the free-form text accepted by {@code TimestampFactory.parse}.
 *
 * <p>Accepted forms:</p>
 * <ul>
 *     <li>{@code now}, case-insensitive</li>
 *     <li>{@code @<signed decimal>}: epoch seconds</li>
 *     <li>{@code yyyy-MM-dd}, optionally followed by {@code HH:mm[:ss]} after a space or {@code T},
 *     optionally followed by an offset ({@code Z}, {@code +HH}, {@code +HHMM}, {@code +HH:MM})
 *     or a region id</li>
 * </ul>
 */
public final class TimestampTextClassifier {
    private static final String NOW = "now";
    private static final Pattern EPOCH_MARKER = Pattern.compile(
            Pattern.quote(String.valueOf(TimeUtils.EPOCH_MARKER)) + "([+-]?\\d+)"
    );
    private static final Pattern DATE_TIME = Pattern.compile(
            "(\\d{4})-(\\d{2})-(\\d{2})(?:[ T](\\d{2}):(\\d{2})(?::(\\d{2}))?)?\\s*(.*)"
    );
    private static final Pattern OFFSET = Pattern.compile("Z|[+-]\\d{2}(?::?\\d{2})?");
    private static final Pattern REGION = Pattern.compile("[A-Za-z][A-Za-z0-9_+\\-]*(?:/[A-Za-z0-9_+\\-]+)*");

    private TimestampTextClassifier() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Classifies one input text.
     *
     * @param text input text.
     * @return classified text.
     * @throws TimestampFormatException when the text matches no accepted form or holds invalid
     *         calendar values.
     */
    public static ParsedTimestampText classify(String text) {
        Objects.requireNonNull(text, "text");
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw malformed(text, "text is blank", null);
        }
        if (NOW.equals(trimmed.toLowerCase(Locale.ROOT))) {
            return ParsedTimestampText.builder()
                    .source(text)
                    .shape(InputShape.NOW)
                    .build();
        }
        if (trimmed.charAt(0) == TimeUtils.EPOCH_MARKER) {
            return classifyEpochMarker(text, trimmed);
        }

        Matcher matcher = DATE_TIME.matcher(trimmed);
        if (!matcher.matches()) {
            throw malformed(text, "unrecognized timestamp text", null);
        }
        LocalDateTime localDateTime = toLocalDateTime(text, matcher);
        String suffix = matcher.group(7);
        if (suffix.isEmpty()) {
            return ParsedTimestampText.builder()
                    .source(text)
                    .shape(InputShape.PLAIN)
                    .localDateTime(localDateTime)
                    .build();
        }
        if (OFFSET.matcher(suffix).matches()) {
            return ParsedTimestampText.builder()
                    .source(text)
                    .shape(InputShape.OFFSET_QUALIFIED)
                    .localDateTime(localDateTime)
                    .textZone(toOffset(text, suffix))
                    .build();
        }
        if (REGION.matcher(suffix).matches()) {
            return ParsedTimestampText.builder()
                    .source(text)
                    .shape(InputShape.REGION_QUALIFIED)
                    .localDateTime(localDateTime)
                    .textZone(toRegion(text, suffix))
                    .build();
        }
        throw malformed(text, "unrecognized zone suffix '" + suffix + "'", null);
    }

    private static ParsedTimestampText classifyEpochMarker(String text, String trimmed) {
        Matcher matcher = EPOCH_MARKER.matcher(trimmed);
        if (!matcher.matches()) {
            throw malformed(text, "epoch marker must be followed by a decimal integer", null);
        }
        long epochSecond;
        try {
            epochSecond = Long.parseLong(matcher.group(1));
        } catch (NumberFormatException ex) {
            throw new TimestampFormatException(
                    TimestampFactory.REASON_EPOCH_OUT_OF_RANGE,
                    "epoch seconds out of range: " + text,
                    ex
            );
        }
        return ParsedTimestampText.builder()
                .source(text)
                .shape(InputShape.EPOCH_MARKER)
                .epochSecond(epochSecond)
                .build();
    }

    private static LocalDateTime toLocalDateTime(String text, Matcher matcher) {
        try {
            LocalDate date = LocalDate.of(
                    Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)),
                    Integer.parseInt(matcher.group(3))
            );
            if (matcher.group(4) == null) {
                return date.atStartOfDay();
            }
            int second = matcher.group(6) == null ? 0 : Integer.parseInt(matcher.group(6));
            LocalTime time = LocalTime.of(
                    Integer.parseInt(matcher.group(4)),
                    Integer.parseInt(matcher.group(5)),
                    second
            );
            return date.atTime(time);
        } catch (DateTimeException ex) {
            throw malformed(text, ex.getMessage(), ex);
        }
    }

    private static ZoneOffset toOffset(String text, String suffix) {
        try {
            return ZoneOffset.of(suffix);
        } catch (DateTimeException ex) {
            throw malformed(text, "invalid offset '" + suffix + "'", ex);
        }
    }

    private static ZoneId toRegion(String text, String suffix) {
        try {
            return TimezoneResolver.resolve(suffix);
        } catch (UnknownTimezoneException ex) {
            throw malformed(text, "unrecognized zone suffix '" + suffix + "'", ex);
        }
    }

    private static TimestampFormatException malformed(String text, String detail, Throwable cause) {
        String message = "cannot parse '" + text + "': " + detail;
        if (cause == null) {
            return new TimestampFormatException(TimestampFactory.REASON_MALFORMED_TEXT, message);
        }
        return new TimestampFormatException(TimestampFactory.REASON_MALFORMED_TEXT, message, cause);
    }
}
