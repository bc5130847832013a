package com.leadgen.backend.integrations;

import com.leadgen.backend.enums.VerificationStatus;

/**
 * Verification verdict for a contact channel. Score is 0-100.
 */
public record ConfidenceScore(VerificationStatus status, int score, String reason) {

    public static final int SAFE_SCORE_THRESHOLD = 70;

    public boolean isSafe() {
        return status == VerificationStatus.DELIVERABLE && score >= SAFE_SCORE_THRESHOLD;
    }
}
