package com.leadgen.backend.services.budget;

import com.leadgen.backend.config.RateBudgetProperties.Backoff;
import com.leadgen.backend.enums.Capability;
import com.leadgen.backend.integrations.CapabilityException;
import com.leadgen.backend.integrations.ThrottledException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Retries a call while the provider signals throttling, doubling the delay each time.
 * Any other failure is passed through untouched.
 */
@Slf4j
public class BackoffPolicy {

    /**
     * Waits between attempts. Replaced in tests to avoid real sleeps.
     */
    @FunctionalInterface
    public interface Sleeper {
        Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

        void sleep(Duration duration) throws InterruptedException;
    }

    private final Backoff backoff;
    private final Sleeper sleeper;

    public BackoffPolicy(Backoff backoff, Sleeper sleeper) {
        this.backoff = backoff;
        this.sleeper = sleeper;
    }

    public <T> T execute(Capability capability, CapabilityCall<T> call) throws CapabilityException {
        int attempts = backoff.maxRetries() + 1;
        ThrottledException lastThrottle = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return call.call();
            } catch (ThrottledException e) {
                lastThrottle = e;
                if (attempt < attempts) {
                    Duration delay = backoff.delayFor(attempt);
                    log.warn("{} throttled on attempt {} of {}, retrying in {} ms: {}",
                            capability, attempt, attempts, delay.toMillis(), e.getMessage());
                    try {
                        sleeper.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new CapabilityException(capability + " backoff interrupted", ie);
                    }
                }
            }
        }

        throw new ProviderThrottledException(capability, attempts, lastThrottle);
    }
}
