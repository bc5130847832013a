package com.leadgen.backend.enums;

public enum UnitStatus {
    PLANNED,
    DISCOVERED,
    COMPLETED,
    FAILED
}
