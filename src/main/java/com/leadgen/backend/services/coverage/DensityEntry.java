package com.leadgen.backend.services.coverage;

import com.leadgen.backend.enums.DensityClass;

/**
 * Expected business density of one candidate unit (e.g. a ZIP code) in a region.
 */
public record DensityEntry(String unitKey, String label, DensityClass densityClass, int expectedBusinesses) {

    public DensityEntry {
        if (unitKey == null || unitKey.isBlank()) {
            throw new IllegalArgumentException("unitKey is required");
        }
        if (expectedBusinesses < 0) {
            throw new IllegalArgumentException("expectedBusinesses must not be negative: " + unitKey);
        }
        if (densityClass == null) {
            densityClass = DensityClass.UNKNOWN;
        }
    }
}
