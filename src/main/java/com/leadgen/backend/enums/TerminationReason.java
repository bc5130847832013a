package com.leadgen.backend.enums;

/**
 * Why a campaign reached a terminal state other than plain exhaustion of its plan.
 */
public enum TerminationReason {
    BUDGET_EXHAUSTED,
    CANCELLED,
    INFRASTRUCTURE_ERROR
}
