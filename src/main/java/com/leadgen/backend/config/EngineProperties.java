package com.leadgen.backend.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.Instant;

/**
 * Campaign engine settings.
 *
 * @param workerPoolSize         work items processed concurrently within a coverage unit
 * @param heartbeatInterval      how often running campaigns write their liveness heartbeat
 * @param staleAfter             heartbeat age after which a RUNNING campaign counts as stalled
 * @param staleCheckInterval     how often stalled campaigns are looked for
 * @param autoRecover            resume stalled campaigns from their checkpoint automatically
 * @param maxResultsPerUnit      discovery results requested per coverage unit, split across keywords
 * @param maxResultsPageSize     upper clamp for {@code listResults} page size
 * @param defaultUnitBusinesses  expected business count of the fallback unit for unknown regions
 * @param discoveryTimeout       wall-clock limit for the provider searches of one unit
 * @param contactEnrichmentTimeout wall-clock limit for looking up missing emails of one unit
 * @param itemEnrichmentTimeout  wall-clock limit for running the items of one unit through the pipeline;
 *                               items not admitted in time fail with PHASE_TIMEOUT
 * <p>
 * A zero timeout disables that limit.
 */
@ConfigurationProperties(prefix = "leadgen.engine")
@Validated
public record EngineProperties(
        @DefaultValue("4") @Min(1) int workerPoolSize,
        @DefaultValue("60s") Duration heartbeatInterval,
        @DefaultValue("5m") Duration staleAfter,
        @DefaultValue("5m") Duration staleCheckInterval,
        @DefaultValue("false") boolean autoRecover,
        @DefaultValue("1000") @Min(1) int maxResultsPerUnit,
        @DefaultValue("500") @Min(1) int maxResultsPageSize,
        @DefaultValue("250") @Min(1) int defaultUnitBusinesses,
        @DefaultValue("30m") Duration discoveryTimeout,
        @DefaultValue("60m") Duration contactEnrichmentTimeout,
        @DefaultValue("90m") Duration itemEnrichmentTimeout
) {
    public static EngineProperties defaults() {
        return new EngineProperties(4, Duration.ofSeconds(60), Duration.ofMinutes(5), Duration.ofMinutes(5), false, 1000, 500, 250,
                Duration.ofMinutes(30), Duration.ofMinutes(60), Duration.ofMinutes(90));
    }

    /**
     * True when {@code timeout} is set and at least that much time passed since {@code started}.
     */
    public static boolean isExpired(Duration timeout, Instant started, Instant now) {
        return timeout != null && !timeout.isZero() && !timeout.isNegative()
                && !now.isBefore(started.plus(timeout));
    }
}
