package com.leadgen.backend.config;

import com.leadgen.backend.enums.VerificationStatus;
import com.leadgen.backend.integrations.CapabilityException;
import com.leadgen.backend.integrations.ConfidenceScore;
import com.leadgen.backend.integrations.DiscoveryProvider;
import com.leadgen.backend.integrations.Verifier;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CapabilityFallbackAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(CapabilityFallbackAutoConfiguration.class));

    @Test
    void testFallbacksRegisteredWhenNothingElseIs() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(DiscoveryProvider.class);
            assertThat(context).hasSingleBean(Verifier.class);

            DiscoveryProvider discovery = context.getBean(DiscoveryProvider.class);
            assertThatThrownBy(() -> discovery.search(null, "plumber", 10))
                    .isInstanceOf(CapabilityException.class)
                    .hasMessageContaining("No discovery provider configured");
            assertThat(context.getBean(Verifier.class).verify("joe@example.com").status())
                    .isEqualTo(VerificationStatus.UNKNOWN);
        });
    }

    @Test
    void testApplicationBeansReplaceTheFallbacks() {
        DiscoveryProvider custom = (unit, keyword, maxResults) -> List.of();
        Verifier customVerifier = channel -> new ConfidenceScore(VerificationStatus.DELIVERABLE, 95, "ok");

        contextRunner
                .withBean("customDiscovery", DiscoveryProvider.class, () -> custom)
                .withBean("customVerifier", Verifier.class, () -> customVerifier)
                .run(context -> {
                    assertThat(context).hasSingleBean(DiscoveryProvider.class);
                    assertThat(context).hasSingleBean(Verifier.class);
                    assertThat(context).doesNotHaveBean("fallbackDiscoveryProvider");
                    assertThat(context).doesNotHaveBean("fallbackVerifier");
                    assertThat(context.getBean(DiscoveryProvider.class)).isSameAs(custom);
                    assertThat(context.getBean(Verifier.class)).isSameAs(customVerifier);
                });
    }
}
