package com.leadgen.backend.support;

import com.leadgen.backend.enums.VerificationStatus;
import com.leadgen.backend.integrations.CapabilityException;
import com.leadgen.backend.integrations.ConfidenceScore;
import com.leadgen.backend.integrations.Verifier;

import java.util.ArrayList;
import java.util.List;

/**
 * Marks every address deliverable. An optional hook runs after the n-th verification,
 * which lets tests pause or cancel a campaign at an exact point.
 */
public class FakeVerifier implements Verifier {

    private final List<String> verified = new ArrayList<>();
    private CapabilityException failure;
    private int hookAfter = -1;
    private Runnable hook;

    public FakeVerifier failingWith(CapabilityException exception) {
        this.failure = exception;
        return this;
    }

    public FakeVerifier afterVerifications(int count, Runnable action) {
        this.hookAfter = count;
        this.hook = action;
        return this;
    }

    public synchronized List<String> verified() {
        return new ArrayList<>(verified);
    }

    @Override
    public ConfidenceScore verify(String contactChannel) throws CapabilityException {
        int count;
        synchronized (this) {
            verified.add(contactChannel);
            count = verified.size();
        }
        if (failure != null) {
            throw failure;
        }
        if (count == hookAfter && hook != null) {
            hook.run();
        }
        return new ConfidenceScore(VerificationStatus.DELIVERABLE, 92, "ok");
    }
}
