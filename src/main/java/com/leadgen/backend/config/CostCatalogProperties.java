package com.leadgen.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.math.BigDecimal;

/**
 * Provider pricing in USD. Defaults follow published pay-per-result prices:
 * maps scraping $4 per 1000 results, email verification $2 per 1000 checks,
 * a small chat model at $0.15 / $0.60 per million input / output tokens,
 * social profile email lookups at $10 per 1000.
 */
@ConfigurationProperties(prefix = "leadgen.costs")
public record CostCatalogProperties(
        @DefaultValue("0.004") BigDecimal discoveryPerResult,
        @DefaultValue("0") BigDecimal researchPerFetch,
        @DefaultValue("0") BigDecimal summarizerPerCall,
        @DefaultValue("0.00015") BigDecimal summarizerInputPerThousandTokens,
        @DefaultValue("0.0006") BigDecimal summarizerOutputPerThousandTokens,
        @DefaultValue("2000") int summarizerEstimatedInputTokens,
        @DefaultValue("400") int summarizerEstimatedOutputTokens,
        @DefaultValue("0.002") BigDecimal verifierPerCall,
        @DefaultValue("0.01") BigDecimal contactEnrichmentPerLookup
) {
    public static CostCatalogProperties defaults() {
        return new CostCatalogProperties(new BigDecimal("0.004"), BigDecimal.ZERO, BigDecimal.ZERO,
                new BigDecimal("0.00015"), new BigDecimal("0.0006"), 2000, 400, new BigDecimal("0.002"),
                new BigDecimal("0.01"));
    }
}
