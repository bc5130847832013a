package com.leadgen.backend.integrations;

public interface Verifier {

    ConfidenceScore verify(String contactChannel) throws CapabilityException;
}
