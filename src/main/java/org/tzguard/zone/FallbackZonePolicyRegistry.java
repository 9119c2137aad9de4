package org.tzguard.zone;

import org.tzguard.core.TimestampFactory;
import org.tzguard.core.TimestampRuntimeConfig;
import org.tzguard.core.UnknownTimezoneException;

import java.time.ZoneId;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Immutable registry of fallback zone policies.
 */
public final class FallbackZonePolicyRegistry {
    public static final String POLICY_AMBIENT = "AMBIENT";
    public static final String POLICY_UTC = "UTC";
    public static final String POLICY_FIXED = "FIXED";
    public static final String POLICY_EXPLICIT_ONLY = "EXPLICIT_ONLY";

    private static final FallbackZonePolicy AMBIENT_POLICY = new AmbientFallbackPolicy();
    private static final FallbackZonePolicy UTC_POLICY = new UtcFallbackPolicy();
    private static final FallbackZonePolicy FIXED_POLICY = new FixedFallbackPolicy();
    private static final FallbackZonePolicy EXPLICIT_ONLY_POLICY = new ExplicitOnlyFallbackPolicy();

    private final Map<String, FallbackZonePolicy> policiesById;

    /**
     * Creates a registry with built-in policies only.
     */
    public FallbackZonePolicyRegistry() {
        this(null);
    }

    /**
     * Creates a registry of the built-in policies plus custom ones.
     *
     * <p>A custom policy replaces the built-in registered under the same id.</p>
     *
     * @param customPolicies extra policies, or {@code null} for none.
     */
    public FallbackZonePolicyRegistry(Collection<? extends FallbackZonePolicy> customPolicies) {
        Map<String, FallbackZonePolicy> byId = new LinkedHashMap<>();
        register(byId, List.of(AMBIENT_POLICY, UTC_POLICY, FIXED_POLICY, EXPLICIT_ONLY_POLICY));
        if (customPolicies != null) {
            register(byId, customPolicies);
        }
        this.policiesById = Map.copyOf(byId);
    }

    /**
     * Returns policy by id, or {@code null} when not registered.
     */
    public FallbackZonePolicy policy(String policyId) {
        return policyId == null ? null : policiesById.get(policyId);
    }

    /**
     * Returns immutable set of registered policy ids.
     */
    public Set<String> policyIds() {
        return policiesById.keySet();
    }

    public static FallbackZonePolicyRegistry defaultRegistry() {
        return new FallbackZonePolicyRegistry();
    }

    private static void register(
            Map<String, FallbackZonePolicy> byId,
            Collection<? extends FallbackZonePolicy> policies
    ) {
        for (FallbackZonePolicy policy : policies) {
            String id = Objects.requireNonNull(Objects.requireNonNull(policy, "policy").id(), "policy.id").trim();
            if (id.isEmpty()) {
                throw new IllegalArgumentException("policy.id must be non-blank");
            }
            byId.put(id, policy);
        }
    }

    private static final class AmbientFallbackPolicy implements FallbackZonePolicy {
        @Override
        public String id() {
            return POLICY_AMBIENT;
        }

        @Override
        public Supplier<ZoneId> bind(TimestampRuntimeConfig runtimeConfig) {
            return AmbientTimezone::current;
        }
    }

    private static final class UtcFallbackPolicy implements FallbackZonePolicy {
        private static final ZoneId UTC = ZoneId.of("UTC");

        @Override
        public String id() {
            return POLICY_UTC;
        }

        @Override
        public Supplier<ZoneId> bind(TimestampRuntimeConfig runtimeConfig) {
            return () -> UTC;
        }
    }

    private static final class FixedFallbackPolicy implements FallbackZonePolicy {
        @Override
        public String id() {
            return POLICY_FIXED;
        }

        @Override
        public Supplier<ZoneId> bind(TimestampRuntimeConfig runtimeConfig) {
            Objects.requireNonNull(runtimeConfig, "runtimeConfig");
            String timezoneId = runtimeConfig.getFixedTimezone();
            if (timezoneId == null || timezoneId.isBlank()) {
                throw new UnknownTimezoneException(
                        TimestampFactory.REASON_TIMEZONE_REQUIRED,
                        "fixedTimezone is required for FIXED policy"
                );
            }
            ZoneId zone = TimezoneResolver.resolve(timezoneId);
            return () -> zone;
        }
    }

    private static final class ExplicitOnlyFallbackPolicy implements FallbackZonePolicy {
        @Override
        public String id() {
            return POLICY_EXPLICIT_ONLY;
        }

        @Override
        public Supplier<ZoneId> bind(TimestampRuntimeConfig runtimeConfig) {
            return () -> {
                throw new UnknownTimezoneException(
                        TimestampFactory.REASON_TIMEZONE_REQUIRED,
                        "an explicit timezone is required: EXPLICIT_ONLY policy has no fallback"
                );
            };
        }
    }
}
