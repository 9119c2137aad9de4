package org.tzguard.core;

import lombok.Builder;
import lombok.Value;
import org.tzguard.core.time.LocalTimePolicy;
import org.tzguard.zone.FallbackZonePolicyRegistry;

/**
 * Runtime configuration used to bind timestamp construction behavior once at startup.
 */
@Value
@Builder
public class TimestampRuntimeConfig {

    /**
     * Selected fallback zone policy id (for example {@code AMBIENT} or {@code FIXED}).
     */
    String fallbackPolicyId;

    /**
     * Zone id used by the {@code FIXED} policy. Ignored by other built-in policies.
     */
    String fixedTimezone;

    /**
     * Placement rule for local times inside DST gaps and overlaps.
     */
    @Builder.Default
    LocalTimePolicy localTimePolicy = LocalTimePolicy.EARLIER_OFFSET;

    /**
     * Returns convenience runtime config that reads the process-wide ambient zone.
     */
    public static TimestampRuntimeConfig ambient() {
        return TimestampRuntimeConfig.builder()
                .fallbackPolicyId(FallbackZonePolicyRegistry.POLICY_AMBIENT)
                .build();
    }

    /**
     * Returns convenience runtime config that falls back to {@code UTC}.
     */
    public static TimestampRuntimeConfig utc() {
        return TimestampRuntimeConfig.builder()
                .fallbackPolicyId(FallbackZonePolicyRegistry.POLICY_UTC)
                .build();
    }

    /**
     * Returns convenience runtime config that falls back to one configured zone.
     *
     * @param timezoneId fallback zone id.
     */
    public static TimestampRuntimeConfig fixed(String timezoneId) {
        return TimestampRuntimeConfig.builder()
                .fallbackPolicyId(FallbackZonePolicyRegistry.POLICY_FIXED)
                .fixedTimezone(timezoneId)
                .build();
    }

    /**
     * Returns convenience runtime config that requires an explicit zone on every construction.
     */
    public static TimestampRuntimeConfig explicitOnly() {
        return TimestampRuntimeConfig.builder()
                .fallbackPolicyId(FallbackZonePolicyRegistry.POLICY_EXPLICIT_ONLY)
                .build();
    }
}
