package com.leadgen.backend.integrations;

/**
 * The provider signalled throttling (HTTP 429 or equivalent). Callers back off and retry.
 */
public class ThrottledException extends CapabilityException {

    public ThrottledException(String message) {
        super(message);
    }

    public ThrottledException(String message, Throwable cause) {
        super(message, cause);
    }
}
