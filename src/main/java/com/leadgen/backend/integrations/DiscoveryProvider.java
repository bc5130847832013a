package com.leadgen.backend.integrations;

import com.leadgen.backend.models.CoverageUnit;

import java.util.List;

/**
 * Scraping provider that finds businesses for a keyword inside one coverage unit.
 */
public interface DiscoveryProvider {

    /**
     * @param unit       coverage unit to search (its key is the location, e.g. a ZIP code)
     * @param keyword    business keyword
     * @param maxResults upper bound on returned records
     * @return records found, never null
     */
    List<RawRecord> search(CoverageUnit unit, String keyword, int maxResults) throws CapabilityException;
}
