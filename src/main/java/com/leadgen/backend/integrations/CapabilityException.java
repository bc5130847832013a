package com.leadgen.backend.integrations;

/**
 * Raised by an external capability (discovery, content, AI, verification) when a call fails.
 */
public class CapabilityException extends Exception {

    public CapabilityException(String message) {
        super(message);
    }

    public CapabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
