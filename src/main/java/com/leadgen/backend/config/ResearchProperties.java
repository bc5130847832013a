package com.leadgen.backend.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Limits for the website research stage.
 *
 * @param maxLinks               linked sub-pages read per item besides the home page
 * @param maxTotalBytes          byte budget across all pages of one item
 * @param maxPageChars           text kept per page for summarization
 * @param fetchTimeout           per-request timeout
 * @param userAgent              user agent sent by the content fetcher
 * @param domainMinDelay         minimum time between two requests to the same host
 * @param domainFailureThreshold consecutive failures after which a host is skipped
 * @param domainBlockDuration    how long a host stays skipped once blocked
 * @param domainIdleEviction     idle time after which a host's politeness state is dropped
 */
@ConfigurationProperties(prefix = "leadgen.research")
@Validated
public record ResearchProperties(
        @DefaultValue("3") @Min(0) int maxLinks,
        @DefaultValue("524288") @Min(1) long maxTotalBytes,
        @DefaultValue("4000") @Min(1) int maxPageChars,
        @DefaultValue("7s") Duration fetchTimeout,
        @DefaultValue("Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36") String userAgent,
        @DefaultValue("2s") Duration domainMinDelay,
        @DefaultValue("3") @Min(1) int domainFailureThreshold,
        @DefaultValue("30m") Duration domainBlockDuration,
        @DefaultValue("1h") Duration domainIdleEviction
) {
    public static ResearchProperties defaults() {
        return new ResearchProperties(3, 524288L, 4000, Duration.ofSeconds(7),
                "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36",
                Duration.ofSeconds(2), 3, Duration.ofMinutes(30), Duration.ofHours(1));
    }
}
