package com.leadgen.backend.enums;

public enum DenialReason {
    BUDGET_EXCEEDED
}
