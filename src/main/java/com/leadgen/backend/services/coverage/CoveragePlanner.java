package com.leadgen.backend.services.coverage;

import com.leadgen.backend.enums.CoverageProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a region and its density table into a coverage plan. Pure: no network or database access,
 * and the same input always yields the same plan.
 */
@Component
@Slf4j
public class CoveragePlanner {

    private static final Comparator<DensityEntry> DENSEST_FIRST = Comparator
            .comparingInt(DensityEntry::expectedBusinesses).reversed()
            .thenComparing(DensityEntry::unitKey);

    /**
     * Plan every entry of the table.
     */
    public CoveragePlan plan(String region, List<String> keywords, DensityTable densityTable) {
        return plan(region, keywords, densityTable, CoverageProfile.CUSTOM);
    }

    /**
     * Plan the densest units needed to reach the profile's target coverage.
     *
     * @throws InvalidRegionException when the region or keywords are blank, or the table has no entries
     */
    public CoveragePlan plan(String region, List<String> keywords, DensityTable densityTable, CoverageProfile profile) {
        List<String> cleanKeywords = validate(region, keywords);

        if (densityTable == null || densityTable.isEmpty()) {
            throw new InvalidRegionException("No density data for region '" + region + "'", true);
        }

        List<DensityEntry> ranked = new ArrayList<>(dedupe(densityTable.entries()));
        ranked.sort(DENSEST_FIRST);

        List<DensityEntry> selected = select(ranked, profile);
        int total = selected.stream().mapToInt(DensityEntry::expectedBusinesses).sum();

        List<PlannedUnit> units = new ArrayList<>(selected.size());
        for (int rank = 0; rank < selected.size(); rank++) {
            DensityEntry entry = selected.get(rank);
            double weight = total == 0 ? 1.0 / selected.size() : (double) entry.expectedBusinesses() / total;
            units.add(new PlannedUnit(rank, entry.unitKey(), entry.label(), entry.densityClass(),
                    entry.expectedBusinesses(), weight));
        }

        log.info("Planned {} of {} units for region '{}' (profile {}, {} expected businesses)",
                units.size(), ranked.size(), region, profile, total);
        return new CoveragePlan(region.trim(), cleanKeywords, units);
    }

    /**
     * Rejects a blank region or keyword set and returns the trimmed, de-duplicated keywords.
     */
    public List<String> validate(String region, List<String> keywords) {
        if (region == null || region.isBlank()) {
            throw new InvalidRegionException("Region must not be blank", false);
        }
        Set<String> clean = new LinkedHashSet<>();
        if (keywords != null) {
            for (String keyword : keywords) {
                if (keyword != null && !keyword.isBlank()) {
                    clean.add(keyword.trim());
                }
            }
        }
        if (clean.isEmpty()) {
            throw new InvalidRegionException("At least one keyword is required for region '" + region + "'", false);
        }
        return List.copyOf(clean);
    }

    // First occurrence of a unit key wins
    private List<DensityEntry> dedupe(List<DensityEntry> entries) {
        Set<String> seen = new LinkedHashSet<>();
        List<DensityEntry> unique = new ArrayList<>();
        for (DensityEntry entry : entries) {
            if (seen.add(entry.unitKey())) {
                unique.add(entry);
            }
        }
        return unique;
    }

    private List<DensityEntry> select(List<DensityEntry> ranked, CoverageProfile profile) {
        if (profile == null || profile == CoverageProfile.CUSTOM) {
            return ranked;
        }

        long totalExpected = ranked.stream().mapToLong(DensityEntry::expectedBusinesses).sum();
        double target = totalExpected * profile.getTargetCoverage();

        List<DensityEntry> selected = new ArrayList<>();
        long covered = 0;
        for (DensityEntry entry : ranked) {
            if (selected.size() >= profile.getMaxUnits()) {
                break;
            }
            if (selected.size() >= profile.getMinUnits() && covered >= target) {
                break;
            }
            selected.add(entry);
            covered += entry.expectedBusinesses();
        }
        return selected;
    }
}
