package com.leadgen.backend.services.coverage;

import java.util.Iterator;
import java.util.List;

/**
 * Immutable, ordered sequence of units to process. Restartable: {@link #after(int)} yields the
 * remaining units after a checkpoint rank without replanning.
 */
public final class CoveragePlan implements Iterable<PlannedUnit> {

    private final String region;
    private final List<String> keywords;
    private final List<PlannedUnit> units;

    CoveragePlan(String region, List<String> keywords, List<PlannedUnit> units) {
        this.region = region;
        this.keywords = List.copyOf(keywords);
        this.units = List.copyOf(units);
    }

    public String getRegion() {
        return region;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public List<PlannedUnit> getUnits() {
        return units;
    }

    public int size() {
        return units.size();
    }

    public int totalExpectedBusinesses() {
        return units.stream().mapToInt(PlannedUnit::expectedBusinesses).sum();
    }

    /**
     * Units with rank greater than {@code lastCompletedRank}; pass -1 for the whole plan.
     */
    public Iterable<PlannedUnit> after(int lastCompletedRank) {
        int from = Math.max(0, Math.min(lastCompletedRank + 1, units.size()));
        return () -> units.subList(from, units.size()).iterator();
    }

    @Override
    public Iterator<PlannedUnit> iterator() {
        return units.iterator();
    }
}
