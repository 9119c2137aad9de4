package org.tzguard.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tzguard.core.time.LocalTimePolicy;
import org.tzguard.core.time.TimeUtils;
import org.tzguard.core.time.Timestamp;
import org.tzguard.text.FormatPattern;
import org.tzguard.text.InputShape;
import org.tzguard.text.ParsedTimestampText;
import org.tzguard.text.TimestampTextClassifier;
import org.tzguard.zone.FallbackZonePolicyRegistry;
import org.tzguard.zone.TimezoneResolver;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Immutable timestamp construction API bound once by {@link TimestampRuntimeBinder}.
 *
 * <p>Every construction either names its zone explicitly or takes it from the bound fallback
 * policy. Text that carries its own offset, region or epoch value decides the instant by itself:</p>
 * <pre>
 *   shape             instant from                 attached zone            explicit zone
 *   NOW               clock                        explicit, else fallback  honored
 *   PLAIN             local date-time in zone      explicit, else fallback  honored
 *   OFFSET_QUALIFIED  local date-time at offset    text offset              ignored
 *   REGION_QUALIFIED  local date-time in region    text region              ignored
 *   EPOCH_MARKER      epoch seconds                +00:00                   ignored
 * </pre>
 */
public final class TimestampFactory {
    public static final String REASON_MALFORMED_TEXT = "MALFORMED_TEXT";
    public static final String REASON_PATTERN_MISMATCH = "PATTERN_MISMATCH";
    public static final String REASON_UNSUPPORTED_PATTERN = "UNSUPPORTED_PATTERN";
    public static final String REASON_LOCAL_TIME_GAP = "LOCAL_TIME_GAP";
    public static final String REASON_LOCAL_TIME_OVERLAP = "LOCAL_TIME_OVERLAP";
    public static final String REASON_EPOCH_OUT_OF_RANGE = "EPOCH_OUT_OF_RANGE";
    public static final String REASON_UNKNOWN_TIMEZONE = "UNKNOWN_TIMEZONE";
    public static final String REASON_TIMEZONE_REQUIRED = "TIMEZONE_REQUIRED";
    public static final String REASON_CONFIG_REQUIRED = "CONFIG_REQUIRED";
    public static final String REASON_UNKNOWN_FALLBACK_POLICY = "UNKNOWN_FALLBACK_POLICY";

    private static final Logger log = LoggerFactory.getLogger(TimestampFactory.class);

    private final Supplier<ZoneId> fallbackZone;
    private final LocalTimePolicy localTimePolicy;
    private final Clock clock;

    TimestampFactory(Supplier<ZoneId> fallbackZone, LocalTimePolicy localTimePolicy, Clock clock) {
        this.fallbackZone = Objects.requireNonNull(fallbackZone, "fallbackZone");
        this.localTimePolicy = Objects.requireNonNull(localTimePolicy, "localTimePolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Binds a factory with the default policy registry and the system clock.
     *
     * @param runtimeConfig runtime configuration.
     * @return bound factory.
     */
    public static TimestampFactory create(TimestampRuntimeConfig runtimeConfig) {
        return create(runtimeConfig, Clock.systemUTC());
    }

    /**
     * Binds a factory with the default policy registry and the given clock.
     */
    public static TimestampFactory create(TimestampRuntimeConfig runtimeConfig, Clock clock) {
        return new TimestampRuntimeBinder()
                .bind(runtimeConfig, FallbackZonePolicyRegistry.defaultRegistry(), clock)
                .getTimestampFactory();
    }

    /**
     * Returns a factory that reads the process-wide ambient zone whenever no zone is given.
     */
    public static TimestampFactory ambient() {
        return create(TimestampRuntimeConfig.ambient());
    }

    /**
     * Returns the current instant in the fallback zone.
     */
    public Timestamp now() {
        return Timestamp.of(clock.instant(), zoneOrFallback(null));
    }

    /**
     * Returns the current instant in an explicit zone.
     */
    public Timestamp now(ZoneId zone) {
        return Timestamp.of(clock.instant(), Objects.requireNonNull(zone, "zone"));
    }

    /**
     * Parses free-form text using the fallback zone for zone-less text.
     *
     * @param text timestamp text.
     * @return timestamp.
     * @throws TimestampFormatException when the text is not recognized.
     */
    public Timestamp parse(String text) {
        return resolve(TimestampTextClassifier.classify(text), null);
    }

    /**
     * Parses free-form text with an explicit zone.
     *
     * <p>The zone is ignored when the text carries its own offset, region or epoch value.</p>
     *
     * @param text timestamp text.
     * @param zone explicit zone.
     * @return timestamp.
     */
    public Timestamp parse(String text, ZoneId zone) {
        return resolve(TimestampTextClassifier.classify(text), Objects.requireNonNull(zone, "zone"));
    }

    /**
     * Parses free-form text with an explicit zone id.
     *
     * @throws UnknownTimezoneException when the zone id is unknown.
     */
    public Timestamp parse(String text, String timezoneId) {
        return parse(text, TimezoneResolver.resolve(timezoneId));
    }

    /**
     * Parses text that must match a pattern exactly, using the fallback zone for zone-less text.
     *
     * @param pattern compiled pattern.
     * @param text text to parse.
     * @return timestamp.
     */
    public Timestamp createFromFormat(FormatPattern pattern, String text) {
        return resolve(Objects.requireNonNull(pattern, "pattern").parse(text), null);
    }

    /**
     * Parses text that must match a pattern exactly, with an explicit zone.
     *
     * <p>The zone is ignored when the pattern parsed an offset or zone from the text.</p>
     */
    public Timestamp createFromFormat(FormatPattern pattern, String text, ZoneId zone) {
        return resolve(
                Objects.requireNonNull(pattern, "pattern").parse(text),
                Objects.requireNonNull(zone, "zone")
        );
    }

    /**
     * Creates a UTC-equivalent timestamp from epoch seconds.
     */
    public Timestamp fromEpochSecond(long epochSecond) {
        return Timestamp.of(TimeUtils.instantOfEpochSecond(epochSecond), ZoneOffset.UTC);
    }

    /**
     * Formats a timestamp in its attached zone.
     */
    public String format(Timestamp timestamp, FormatPattern pattern) {
        return Objects.requireNonNull(pattern, "pattern").format(timestamp);
    }

    /**
     * Returns the zone used right now for constructions without an explicit zone.
     *
     * @throws UnknownTimezoneException when the bound policy has no fallback.
     */
    public ZoneId fallbackZone() {
        return fallbackZone.get();
    }

    public LocalTimePolicy localTimePolicy() {
        return localTimePolicy;
    }

    public Clock clock() {
        return clock;
    }

    private Timestamp resolve(ParsedTimestampText text, ZoneId explicitZone) {
        InputShape shape = text.getShape();
        if (explicitZone != null && !shape.honorsExplicitZone()) {
            log.debug("Explicit timezone {} ignored: '{}' is {}", explicitZone.getId(), text.getSource(), shape);
        }
        switch (shape) {
            case NOW:
                return Timestamp.of(clock.instant(), zoneOrFallback(explicitZone));
            case PLAIN:
                return Timestamp.of(localTimePolicy.resolve(text.getLocalDateTime(), zoneOrFallback(explicitZone)));
            case OFFSET_QUALIFIED:
                ZoneOffset offset = (ZoneOffset) text.getTextZone();
                return Timestamp.of(text.getLocalDateTime().toInstant(offset), offset);
            case REGION_QUALIFIED:
                return Timestamp.of(localTimePolicy.resolve(text.getLocalDateTime(), text.getTextZone()));
            case EPOCH_MARKER:
                return fromEpochSecond(text.getEpochSecond());
            default:
                throw new IllegalStateException("unhandled input shape: " + shape);
        }
    }

    private ZoneId zoneOrFallback(ZoneId explicitZone) {
        if (explicitZone != null) {
            return explicitZone;
        }
        return Objects.requireNonNull(fallbackZone.get(), "fallback zone");
    }
}
