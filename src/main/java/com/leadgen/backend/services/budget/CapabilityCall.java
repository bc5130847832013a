package com.leadgen.backend.services.budget;

import com.leadgen.backend.integrations.CapabilityException;

/**
 * One external call executed under a grant.
 */
@FunctionalInterface
public interface CapabilityCall<T> {

    T call() throws CapabilityException;
}
