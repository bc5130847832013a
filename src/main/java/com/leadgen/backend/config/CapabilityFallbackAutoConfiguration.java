package com.leadgen.backend.config;

import com.leadgen.backend.enums.VerificationStatus;
import com.leadgen.backend.integrations.CapabilityException;
import com.leadgen.backend.integrations.ConfidenceScore;
import com.leadgen.backend.integrations.DiscoveryProvider;
import com.leadgen.backend.integrations.Verifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * Placeholders for the capabilities this service does not ship a client for. Registered as an
 * auto-configuration so the missing-bean conditions are evaluated after every application bean;
 * deployments register their own {@link DiscoveryProvider} and {@link Verifier} to replace them.
 */
@AutoConfiguration
@Slf4j
public class CapabilityFallbackAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(DiscoveryProvider.class)
    public DiscoveryProvider fallbackDiscoveryProvider() {
        log.warn("No DiscoveryProvider configured; campaign discovery will fail every unit");
        return (unit, keyword, maxResults) -> {
            throw new CapabilityException("No discovery provider configured");
        };
    }

    @Bean
    @ConditionalOnMissingBean(Verifier.class)
    public Verifier fallbackVerifier() {
        log.warn("No Verifier configured; contact channels will be marked UNKNOWN");
        return contactChannel -> new ConfidenceScore(VerificationStatus.UNKNOWN, 0, "No verifier configured");
    }
}
