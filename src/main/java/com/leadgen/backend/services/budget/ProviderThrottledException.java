package com.leadgen.backend.services.budget;

import com.leadgen.backend.enums.Capability;
import com.leadgen.backend.integrations.CapabilityException;
import lombok.Getter;

/**
 * The provider kept throttling after every backoff retry was spent.
 */
@Getter
public class ProviderThrottledException extends CapabilityException {

    private final Capability capability;
    private final int attempts;

    public ProviderThrottledException(Capability capability, int attempts, Throwable cause) {
        super(capability.getDisplayName() + " still throttled after " + attempts + " attempts", cause);
        this.capability = capability;
        this.attempts = attempts;
    }
}
