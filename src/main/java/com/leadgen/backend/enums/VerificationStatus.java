package com.leadgen.backend.enums;

public enum VerificationStatus {
    DELIVERABLE,
    UNDELIVERABLE,
    RISKY,
    UNKNOWN,
    ERROR
}
