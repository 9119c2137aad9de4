package org.tzguard.text;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.tzguard.core.TimestampFactory;
import org.tzguard.core.TimestampFormatException;
import org.tzguard.core.time.Timestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.format.SignStyle;
import java.time.format.TextStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Compiled timestamp pattern written with single-character format codes.
 *
 * <p>Supported codes:</p>
 * <pre>
 *   Y  4-digit year          y  2-digit year (1970-2069)
 *   m  month, 2 digits       n  month, no padding
 *   d  day, 2 digits         j  day, no padding
 *   H  hour 00-23            G  hour, no padding
 *   i  minutes, 2 digits     s  seconds, 2 digits
 *   D  Mon..Sun              l  Monday..Sunday
 *   M  Jan..Dec              F  January..December
 *   O  offset +0000          P  offset +00:00
 *   e  zone id               T  zone abbreviation
 * </pre>
 * <p>{@code \} escapes the next character; other non-letter characters are literals.
 * Patterns without {@code O}, {@code P}, {@code e} or {@code T} drop the zone when formatting,
 * so their output cannot be mapped back to the original instant.</p>
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode(of = "source")
public final class FormatPattern {

    /**
     * {@code 2014-01-01 12:00:00}; carries no zone information.
     */
    public static final FormatPattern SIMPLE = compile("Y-m-d H:i:s");

    /**
     * {@code 2014-01-01T12:00:00+0000}.
     */
    public static final FormatPattern ISO8601 = compile("Y-m-d\\TH:i:sO");

    /**
     * {@code 2014-01-01T12:00:00+00:00}.
     */
    public static final FormatPattern ATOM = compile("Y-m-d\\TH:i:sP");

    private final String source;
    private final boolean carriesZone;

    @Getter(AccessLevel.NONE)
    private final DateTimeFormatter formatter;

    private FormatPattern(String source, DateTimeFormatter formatter, boolean carriesZone) {
        this.source = source;
        this.formatter = formatter;
        this.carriesZone = carriesZone;
    }

    /**
     * Compiles a pattern.
     *
     * @param source pattern text, for example {@code Y-m-d H:i:s}.
     * @return compiled pattern.
     * @throws TimestampFormatException when the pattern uses an unsupported code, lacks a full
     *         date, or ends with a dangling escape.
     */
    public static FormatPattern compile(String source) {
        Objects.requireNonNull(source, "source");
        DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder();
        Set<ChronoField> fields = EnumSet.noneOf(ChronoField.class);
        boolean carriesZone = false;

        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\\') {
                if (i + 1 >= source.length()) {
                    throw unsupported(source, "dangling escape at end of pattern");
                }
                builder.appendLiteral(source.charAt(++i));
                continue;
            }
            if (!Character.isLetter(c)) {
                builder.appendLiteral(c);
                continue;
            }
            switch (c) {
                case 'Y':
                    builder.appendValue(ChronoField.YEAR, 4, 10, SignStyle.EXCEEDS_PAD);
                    fields.add(ChronoField.YEAR);
                    break;
                case 'y':
                    builder.appendValueReduced(ChronoField.YEAR, 2, 2, LocalDate.of(1970, 1, 1));
                    fields.add(ChronoField.YEAR);
                    break;
                case 'm':
                    builder.appendValue(ChronoField.MONTH_OF_YEAR, 2);
                    fields.add(ChronoField.MONTH_OF_YEAR);
                    break;
                case 'n':
                    builder.appendValue(ChronoField.MONTH_OF_YEAR, 1, 2, SignStyle.NOT_NEGATIVE);
                    fields.add(ChronoField.MONTH_OF_YEAR);
                    break;
                case 'M':
                    builder.appendText(ChronoField.MONTH_OF_YEAR, TextStyle.SHORT);
                    fields.add(ChronoField.MONTH_OF_YEAR);
                    break;
                case 'F':
                    builder.appendText(ChronoField.MONTH_OF_YEAR, TextStyle.FULL);
                    fields.add(ChronoField.MONTH_OF_YEAR);
                    break;
                case 'd':
                    builder.appendValue(ChronoField.DAY_OF_MONTH, 2);
                    fields.add(ChronoField.DAY_OF_MONTH);
                    break;
                case 'j':
                    builder.appendValue(ChronoField.DAY_OF_MONTH, 1, 2, SignStyle.NOT_NEGATIVE);
                    fields.add(ChronoField.DAY_OF_MONTH);
                    break;
                case 'D':
                    builder.appendText(ChronoField.DAY_OF_WEEK, TextStyle.SHORT);
                    break;
                case 'l':
                    builder.appendText(ChronoField.DAY_OF_WEEK, TextStyle.FULL);
                    break;
                case 'H':
                    builder.appendValue(ChronoField.HOUR_OF_DAY, 2);
                    fields.add(ChronoField.HOUR_OF_DAY);
                    break;
                case 'G':
                    builder.appendValue(ChronoField.HOUR_OF_DAY, 1, 2, SignStyle.NOT_NEGATIVE);
                    fields.add(ChronoField.HOUR_OF_DAY);
                    break;
                case 'i':
                    builder.appendValue(ChronoField.MINUTE_OF_HOUR, 2);
                    fields.add(ChronoField.MINUTE_OF_HOUR);
                    break;
                case 's':
                    builder.appendValue(ChronoField.SECOND_OF_MINUTE, 2);
                    fields.add(ChronoField.SECOND_OF_MINUTE);
                    break;
                case 'O':
                    builder.appendOffset("+HHMM", "+0000");
                    carriesZone = true;
                    break;
                case 'P':
                    builder.appendOffset("+HH:MM", "+00:00");
                    carriesZone = true;
                    break;
                case 'e':
                    builder.appendZoneId();
                    carriesZone = true;
                    break;
                case 'T':
                    builder.appendZoneText(TextStyle.SHORT);
                    carriesZone = true;
                    break;
                default:
                    throw unsupported(source, "unsupported format character '" + c + "'");
            }
        }

        if (!fields.contains(ChronoField.YEAR)
                || !fields.contains(ChronoField.MONTH_OF_YEAR)
                || !fields.contains(ChronoField.DAY_OF_MONTH)) {
            throw unsupported(source, "pattern must contain a year, a month and a day");
        }
        // Time-of-day fields missing from the pattern parse as zero.
        defaultIfAbsent(builder, fields, ChronoField.HOUR_OF_DAY);
        defaultIfAbsent(builder, fields, ChronoField.MINUTE_OF_HOUR);
        defaultIfAbsent(builder, fields, ChronoField.SECOND_OF_MINUTE);

        DateTimeFormatter formatter = builder.toFormatter(Locale.ENGLISH)
                .withChronology(IsoChronology.INSTANCE)
                .withResolverStyle(ResolverStyle.STRICT);
        return new FormatPattern(source, formatter, carriesZone);
    }

    /**
     * Formats a timestamp in its attached zone.
     *
     * @param timestamp timestamp to format.
     * @return formatted text.
     */
    public String format(Timestamp timestamp) {
        Objects.requireNonNull(timestamp, "timestamp");
        return formatter.format(timestamp.toZonedDateTime());
    }

    /**
     * Parses text that must match this pattern exactly.
     *
     * <p>The result is {@code OFFSET_QUALIFIED} when the text carried an offset, {@code REGION_QUALIFIED}
     * when it carried a region, and {@code PLAIN} otherwise.</p>
     *
     * @param text text to parse.
     * @return classified text.
     * @throws TimestampFormatException when the text does not match.
     */
    public ParsedTimestampText parse(String text) {
        Objects.requireNonNull(text, "text");
        TemporalAccessor parsed;
        try {
            parsed = formatter.parse(text);
        } catch (DateTimeParseException ex) {
            throw new TimestampFormatException(
                    TimestampFactory.REASON_PATTERN_MISMATCH,
                    "'" + text + "' does not match pattern '" + source + "': " + ex.getMessage(),
                    ex
            );
        }

        LocalDate date = parsed.query(TemporalQueries.localDate());
        LocalTime time = parsed.query(TemporalQueries.localTime());
        if (date == null || time == null) {
            throw new TimestampFormatException(
                    TimestampFactory.REASON_PATTERN_MISMATCH,
                    "'" + text + "' does not resolve to a date-time under pattern '" + source + "'"
            );
        }
        LocalDateTime localDateTime = LocalDateTime.of(date, time);

        ZoneOffset textOffset = parsed.query(TemporalQueries.offset());
        ZoneId textZone = parsed.query(TemporalQueries.zoneId());
        ParsedTimestampText.ParsedTimestampTextBuilder result = ParsedTimestampText.builder()
                .source(text)
                .localDateTime(localDateTime);
        if (textOffset != null) {
            return result.shape(InputShape.OFFSET_QUALIFIED).textZone(textOffset).build();
        }
        if (textZone instanceof ZoneOffset) {
            return result.shape(InputShape.OFFSET_QUALIFIED).textZone(textZone).build();
        }
        if (textZone != null) {
            return result.shape(InputShape.REGION_QUALIFIED).textZone(textZone).build();
        }
        return result.shape(InputShape.PLAIN).build();
    }

    @Override
    public String toString() {
        return source;
    }

    private static void defaultIfAbsent(DateTimeFormatterBuilder builder, Set<ChronoField> fields, ChronoField field) {
        if (!fields.contains(field)) {
            builder.parseDefaulting(field, 0);
        }
    }

    private static TimestampFormatException unsupported(String source, String detail) {
        return new TimestampFormatException(
                TimestampFactory.REASON_UNSUPPORTED_PATTERN,
                "invalid pattern '" + source + "': " + detail
        );
    }
}
