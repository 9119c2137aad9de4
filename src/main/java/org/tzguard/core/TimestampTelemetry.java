package org.tzguard.core;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable timestamp-runtime telemetry snapshot.
 */
@Value
@Builder
public class TimestampTelemetry {

    /**
     * Bound fallback zone policy id.
     */
    String fallbackPolicyId;

    /**
     * Configured fixed zone id, or {@code null} when the policy does not use one.
     */
    String fixedTimezone;

    /**
     * Bound DST gap/overlap policy name.
     */
    String localTimePolicy;

    /**
     * Zone of the bound clock. Only the instant of the clock is used.
     */
    String clockZone;
}
