package com.leadgen.backend.services.coverage;

/**
 * The region cannot be planned: it is blank, has no keywords, or has no density entries.
 */
public class InvalidRegionException extends RuntimeException {

    private final boolean missingDensityData;

    public InvalidRegionException(String message, boolean missingDensityData) {
        super(message);
        this.missingDensityData = missingDensityData;
    }

    /**
     * True when the input was valid but no density data exists for the region.
     * Callers may fall back to a single coarse unit in that case.
     */
    public boolean isMissingDensityData() {
        return missingDensityData;
    }
}
