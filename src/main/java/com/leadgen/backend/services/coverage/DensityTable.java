package com.leadgen.backend.services.coverage;

import java.util.List;

/**
 * Density entries for one region.
 */
public record DensityTable(String region, List<DensityEntry> entries) {

    public DensityTable {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static DensityTable empty(String region) {
        return new DensityTable(region, List.of());
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
