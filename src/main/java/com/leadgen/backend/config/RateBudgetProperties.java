package com.leadgen.backend.config;

import com.leadgen.backend.enums.Capability;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Pacing, concurrency and backoff limits per external capability.
 * Capabilities missing from configuration get {@link CapabilityLimits#defaults()}.
 */
@ConfigurationProperties(prefix = "leadgen.rate-budget")
public record RateBudgetProperties(
        Map<Capability, CapabilityLimits> capabilities,
        @DefaultValue Backoff backoff
) {
    public RateBudgetProperties {
        Map<Capability, CapabilityLimits> merged = new EnumMap<>(Capability.class);
        for (Capability capability : Capability.values()) {
            CapabilityLimits configured = capabilities != null ? capabilities.get(capability) : null;
            merged.put(capability, configured != null ? configured : CapabilityLimits.defaults());
        }
        capabilities = Map.copyOf(merged);
        if (backoff == null) {
            backoff = Backoff.defaults();
        }
    }

    public CapabilityLimits limitsFor(Capability capability) {
        return capabilities.get(capability);
    }

    public int minConcurrency() {
        return capabilities.values().stream().mapToInt(CapabilityLimits::maxConcurrent).min().orElse(1);
    }

    /**
     * @param minInterval    minimum time between two grants for the capability; zero disables pacing
     * @param maxConcurrent  grants in flight at once
     * @param costCeiling    per-campaign spend cap for this capability; null for none
     */
    public record CapabilityLimits(
            @DefaultValue("0s") Duration minInterval,
            @DefaultValue("8") int maxConcurrent,
            BigDecimal costCeiling
    ) {
        public CapabilityLimits {
            if (minInterval == null || minInterval.isNegative()) {
                minInterval = Duration.ZERO;
            }
            if (maxConcurrent < 1) {
                throw new IllegalArgumentException("maxConcurrent must be at least 1");
            }
        }

        public static CapabilityLimits defaults() {
            return new CapabilityLimits(Duration.ZERO, 8, null);
        }
    }

    /**
     * Exponential backoff applied when a provider signals throttling.
     */
    public record Backoff(
            @DefaultValue("1s") Duration baseDelay,
            @DefaultValue("30s") Duration maxDelay,
            @DefaultValue("3") int maxRetries
    ) {
        public static Backoff defaults() {
            return new Backoff(Duration.ofSeconds(1), Duration.ofSeconds(30), 3);
        }

        /**
         * Delay before retry number {@code retry} (1-based): base doubled per retry, capped.
         */
        public Duration delayFor(int retry) {
            long factor = 1L << Math.min(Math.max(retry - 1, 0), 30);
            Duration delay = baseDelay.multipliedBy(factor);
            return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
        }
    }
}
