package com.leadgen.backend.services.budget;

import com.leadgen.backend.config.RateBudgetProperties.Backoff;
import com.leadgen.backend.enums.Capability;
import com.leadgen.backend.integrations.CapabilityException;
import com.leadgen.backend.integrations.ThrottledException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class BackoffPolicyTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private final BackoffPolicy policy = new BackoffPolicy(
            new Backoff(Duration.ofSeconds(1), Duration.ofSeconds(3), 3), sleeps::add);

    @Test
    void testRetriesThrottledCallsWithGrowingDelay() throws Exception {
        // Given
        AtomicInteger attempts = new AtomicInteger();

        // When
        String result = policy.execute(Capability.SUMMARIZER, () -> {
            if (attempts.incrementAndGet() < 4) {
                throw new ThrottledException("429");
            }
            return "ok";
        });

        // Then
        assertThat(result).isEqualTo("ok");
        assertThat(attempts.get()).isEqualTo(4);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(3));
    }

    @Test
    void testGivesUpAfterMaxRetries() {
        // Given
        AtomicInteger attempts = new AtomicInteger();

        // Then
        assertThatThrownBy(() -> policy.execute(Capability.DISCOVERY, () -> {
            attempts.incrementAndGet();
            throw new ThrottledException("429");
        })).isInstanceOf(ProviderThrottledException.class)
                .hasCauseInstanceOf(ThrottledException.class);
        assertThat(attempts.get()).isEqualTo(4);
        assertThat(sleeps).hasSize(3);
    }

    @Test
    void testOtherFailuresAreNotRetried() {
        // Given
        AtomicInteger attempts = new AtomicInteger();

        // Then
        assertThatThrownBy(() -> policy.execute(Capability.VERIFIER, () -> {
            attempts.incrementAndGet();
            throw new CapabilityException("bad request");
        })).isExactlyInstanceOf(CapabilityException.class).hasMessage("bad request");
        assertThat(attempts.get()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void testInterruptedBackoffStopsRetrying() {
        // Given
        BackoffPolicy interrupted = new BackoffPolicy(new Backoff(Duration.ofSeconds(1), Duration.ofSeconds(3), 3),
                duration -> {
                    throw new InterruptedException();
                });

        // Then
        try {
            assertThatThrownBy(() -> interrupted.execute(Capability.RESEARCH, () -> {
                throw new ThrottledException("429");
            })).isInstanceOf(CapabilityException.class)
                    .isNotInstanceOf(ProviderThrottledException.class)
                    .hasCauseInstanceOf(InterruptedException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
