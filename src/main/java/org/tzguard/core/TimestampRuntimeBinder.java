package org.tzguard.core;

import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tzguard.core.time.LocalTimePolicy;
import org.tzguard.zone.FallbackZonePolicy;
import org.tzguard.zone.FallbackZonePolicyRegistry;

import java.time.Clock;
import java.time.ZoneId;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Startup-only timestamp runtime binder.
 *
 * <p>This component validates one runtime config, resolves the fallback zone policy once,
 * and constructs the immutable factory used for all construction calls.</p>
 */
public final class TimestampRuntimeBinder {
    private static final Logger log = LoggerFactory.getLogger(TimestampRuntimeBinder.class);

    /**
     * Binds one runtime config into an immutable factory.
     *
     * @param runtimeConfig timestamp runtime configuration.
     * @param policyRegistry fallback zone policy registry.
     * @param clock instant source for {@code now}.
     * @return immutable runtime binding.
     */
    public Binding bind(
            TimestampRuntimeConfig runtimeConfig,
            FallbackZonePolicyRegistry policyRegistry,
            Clock clock
    ) {
        if (runtimeConfig == null) {
            throw new TimestampException(
                    TimestampFactory.REASON_CONFIG_REQUIRED,
                    "timestampRuntimeConfig must be provided at startup"
            );
        }
        FallbackZonePolicyRegistry nonNullRegistry = Objects.requireNonNull(policyRegistry, "policyRegistry");
        Clock nonNullClock = Objects.requireNonNull(clock, "clock");

        String policyId = normalizeOptionalId(runtimeConfig.getFallbackPolicyId());
        if (policyId == null) {
            throw new TimestampException(
                    TimestampFactory.REASON_CONFIG_REQUIRED,
                    "fallbackPolicyId must be provided"
            );
        }
        FallbackZonePolicy policy = nonNullRegistry.policy(policyId);
        if (policy == null) {
            throw new TimestampException(
                    TimestampFactory.REASON_UNKNOWN_FALLBACK_POLICY,
                    "unknown fallback zone policy id: " + policyId
            );
        }

        Supplier<ZoneId> fallbackZone;
        try {
            fallbackZone = Objects.requireNonNull(policy.bind(runtimeConfig), "fallback zone source");
        } catch (TimestampException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new TimestampException(
                    TimestampFactory.REASON_CONFIG_REQUIRED,
                    "fallback zone policy " + policy.id() + " failed to bind: " + ex.getMessage(),
                    ex
            );
        }

        LocalTimePolicy localTimePolicy = runtimeConfig.getLocalTimePolicy() == null
                ? LocalTimePolicy.EARLIER_OFFSET
                : runtimeConfig.getLocalTimePolicy();

        TimestampFactory factory = new TimestampFactory(fallbackZone, localTimePolicy, nonNullClock);
        TimestampTelemetry telemetry = TimestampTelemetry.builder()
                .fallbackPolicyId(policy.id())
                .fixedTimezone(normalizeOptionalId(runtimeConfig.getFixedTimezone()))
                .localTimePolicy(localTimePolicy.name())
                .clockZone(nonNullClock.getZone().getId())
                .build();
        log.info("Bound timestamp runtime: fallbackPolicy={}, localTimePolicy={}",
                telemetry.getFallbackPolicyId(), telemetry.getLocalTimePolicy());
        return Binding.builder()
                .timestampFactory(factory)
                .timestampTelemetry(telemetry)
                .build();
    }

    private static String normalizeOptionalId(String id) {
        if (id == null) {
            return null;
        }
        String normalized = id.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        return normalized;
    }

    /**
     * Immutable timestamp runtime binding output.
     */
    @Value
    @Builder
    public static class Binding {
        /**
         * Locked factory for all construction calls.
         */
        TimestampFactory timestampFactory;

        /**
         * Startup telemetry for the bound configuration.
         */
        TimestampTelemetry timestampTelemetry;
    }
}
