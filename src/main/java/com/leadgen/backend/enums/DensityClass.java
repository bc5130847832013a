package com.leadgen.backend.enums;

public enum DensityClass {
    VERY_HIGH,
    HIGH,
    MEDIUM,
    LOW,
    UNKNOWN
}
