package com.leadgen.backend.services.coverage;

/**
 * Source of density tables. Returns an empty table for regions it knows nothing about.
 */
public interface DensityTableProvider {

    DensityTable tableFor(String region);
}
