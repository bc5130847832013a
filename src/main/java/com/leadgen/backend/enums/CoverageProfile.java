package com.leadgen.backend.enums;

/**
 * How much of a region a campaign tries to cover.
 * <p>
 * Units are taken in rank order: the first {@code minUnits} always, then more until the
 * selected units account for {@code targetCoverage} of the expected businesses or
 * {@code maxUnits} is reached. {@link #CUSTOM} takes every unit.
 */
public enum CoverageProfile {
    BUDGET(0.90, 5, 10),
    BALANCED(0.94, 10, 25),
    AGGRESSIVE(0.97, 25, Integer.MAX_VALUE),
    CUSTOM(1.0, 1, Integer.MAX_VALUE);

    private final double targetCoverage;
    private final int minUnits;
    private final int maxUnits;

    CoverageProfile(double targetCoverage, int minUnits, int maxUnits) {
        this.targetCoverage = targetCoverage;
        this.minUnits = minUnits;
        this.maxUnits = maxUnits;
    }

    public double getTargetCoverage() {
        return targetCoverage;
    }

    public int getMinUnits() {
        return minUnits;
    }

    public int getMaxUnits() {
        return maxUnits;
    }
}
