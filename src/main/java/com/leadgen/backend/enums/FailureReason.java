package com.leadgen.backend.enums;

/**
 * Classification of every fault recorded against a work item or coverage unit.
 */
public enum FailureReason {
    PROVIDER_THROTTLED,
    SUMMARIZATION_FAILED,
    CAPABILITY_ERROR,
    PHASE_TIMEOUT,
    UNEXPECTED_ERROR
}
