package org.tzguard.zone;

import org.tzguard.core.TimestampRuntimeConfig;

import java.time.ZoneId;
import java.util.function.Supplier;

/**
 * Source of the zone used when a construction call does not name one explicitly.
 */
public interface FallbackZonePolicy {

    /**
     * Returns stable policy identifier.
     */
    String id();

    /**
     * Validates policy-specific configuration and returns the fallback source.
     *
     * <p>The returned supplier is consulted on every construction that lacks an explicit zone.
     * Configuration problems must surface here, at bind time, rather than from the supplier.</p>
     *
     * @param runtimeConfig locked runtime configuration.
     * @return fallback zone source.
     * @throws org.tzguard.core.UnknownTimezoneException when a configured zone is missing or unknown.
     */
    Supplier<ZoneId> bind(TimestampRuntimeConfig runtimeConfig);
}
