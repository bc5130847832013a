package com.leadgen.backend.enums;

public enum CampaignStatus {
    PENDING,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED;

    public boolean isFinished() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canStart() {
        return this == PENDING;
    }

    public boolean canResume() {
        return this == PAUSED;
    }

    public boolean canCancel() {
        return this == PENDING || this == RUNNING || this == PAUSED;
    }
}
