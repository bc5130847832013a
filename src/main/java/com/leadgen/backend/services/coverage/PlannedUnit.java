package com.leadgen.backend.services.coverage;

import com.leadgen.backend.enums.DensityClass;

/**
 * One unit of a coverage plan. {@code weight} is the unit's share of the plan's expected businesses.
 */
public record PlannedUnit(
        int rank,
        String unitKey,
        String label,
        DensityClass densityClass,
        int expectedBusinesses,
        double weight
) {
}
