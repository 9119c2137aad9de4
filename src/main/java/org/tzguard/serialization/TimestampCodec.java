package org.tzguard.serialization;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.tzguard.core.TimestampFactory;
import org.tzguard.core.TimestampFormatException;
import org.tzguard.core.time.TimeUtils;
import org.tzguard.core.time.Timestamp;
import org.tzguard.text.FormatPattern;
import org.tzguard.text.InputShape;
import org.tzguard.text.TimestampTextClassifier;

import java.time.ZoneId;
import java.util.Objects;

/**
 * Text encodings for storing timestamps outside the process.
 *
 * <p>Only encodings that keep an offset or the epoch value reload the same instant in any
 * process. {@link #SIMPLE_LOCAL} drops the zone: a reload yields the original instant only when
 * the loader supplies the zone that was in effect at encode time.</p>
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum TimestampCodec {
    /**
     * {@code 2014-01-01 12:00:00}, wall-clock only. Typical of SQL {@code DATETIME} columns.
     */
    SIMPLE_LOCAL("simple-local", false) {
        @Override
        public String encode(Timestamp timestamp) {
            return FormatPattern.SIMPLE.format(timestamp);
        }

        @Override
        Timestamp decodeWith(String text, TimestampFactory factory, ZoneId zone) {
            return zone == null
                    ? factory.createFromFormat(FormatPattern.SIMPLE, text)
                    : factory.createFromFormat(FormatPattern.SIMPLE, text, zone);
        }
    },
    /**
     * {@code 2014-01-01T12:00:00+0000}.
     */
    ISO8601_OFFSET("iso8601", true) {
        @Override
        public String encode(Timestamp timestamp) {
            return FormatPattern.ISO8601.format(timestamp);
        }

        @Override
        Timestamp decodeWith(String text, TimestampFactory factory, ZoneId zone) {
            return factory.createFromFormat(FormatPattern.ISO8601, text);
        }
    },
    /**
     * {@code @1388577600}.
     */
    EPOCH_SECONDS("epoch", true) {
        @Override
        public String encode(Timestamp timestamp) {
            return TimeUtils.epochMarker(timestamp.epochSecond());
        }

        @Override
        Timestamp decodeWith(String text, TimestampFactory factory, ZoneId zone) {
            if (TimestampTextClassifier.classify(text).getShape() != InputShape.EPOCH_MARKER) {
                throw new TimestampFormatException(
                        TimestampFactory.REASON_MALFORMED_TEXT,
                        "expected epoch marker text, got '" + text + "'"
                );
            }
            return factory.parse(text);
        }
    };

    /** Stable codec id. */
    private final String id;
    /** True when a reload yields the encoded instant regardless of the loader's zone. */
    private final boolean preservesInstant;

    /**
     * Encodes a timestamp.
     */
    public abstract String encode(Timestamp timestamp);

    /**
     * Decodes text with the factory's fallback zone.
     */
    public Timestamp decode(String text, TimestampFactory factory) {
        return decodeWith(Objects.requireNonNull(text, "text"), Objects.requireNonNull(factory, "factory"), null);
    }

    /**
     * Decodes text with an explicit zone. Codecs that preserve the instant ignore the zone
     * when computing it; the result is not re-expressed in {@code zone}.
     */
    public Timestamp decode(String text, TimestampFactory factory, ZoneId zone) {
        return decodeWith(
                Objects.requireNonNull(text, "text"),
                Objects.requireNonNull(factory, "factory"),
                Objects.requireNonNull(zone, "zone")
        );
    }

    abstract Timestamp decodeWith(String text, TimestampFactory factory, ZoneId zone);

    /**
     * Returns codec by id, or {@code null} when unknown.
     */
    public static TimestampCodec fromId(String id) {
        if (id == null) {
            return null;
        }
        String normalized = id.trim();
        for (TimestampCodec codec : values()) {
            if (codec.id.equals(normalized)) {
                return codec;
            }
        }
        return null;
    }
}
