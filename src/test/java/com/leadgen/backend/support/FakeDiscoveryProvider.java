package com.leadgen.backend.support;

import com.leadgen.backend.integrations.CapabilityException;
import com.leadgen.backend.integrations.DiscoveryProvider;
import com.leadgen.backend.integrations.RawRecord;
import com.leadgen.backend.models.CoverageUnit;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class FakeDiscoveryProvider implements DiscoveryProvider {

    private final Map<String, List<RawRecord>> recordsByUnit = new HashMap<>();
    private final Map<String, CapabilityException> failuresByUnit = new HashMap<>();
    private final List<String> calls = new ArrayList<>();

    public FakeDiscoveryProvider withRecords(String unitKey, List<RawRecord> records) {
        recordsByUnit.put(unitKey, records);
        return this;
    }

    public FakeDiscoveryProvider failingFor(String unitKey, CapabilityException failure) {
        failuresByUnit.put(unitKey, failure);
        return this;
    }

    public synchronized List<String> calls() {
        return new ArrayList<>(calls);
    }

    @Override
    public synchronized List<RawRecord> search(CoverageUnit unit, String keyword, int maxResults)
            throws CapabilityException {
        calls.add(unit.getUnitKey() + "/" + keyword);
        CapabilityException failure = failuresByUnit.get(unit.getUnitKey());
        if (failure != null) {
            throw failure;
        }
        List<RawRecord> records = recordsByUnit.getOrDefault(unit.getUnitKey(), List.of());
        return records.size() > maxResults ? records.subList(0, maxResults) : records;
    }

    /**
     * {@code count} businesses with an email and a website each, ids prefixed by {@code prefix}.
     */
    public static List<RawRecord> businesses(String prefix, int count) {
        List<RawRecord> records = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            records.add(RawRecord.builder()
                    .externalId(prefix + "-" + i)
                    .name("Business " + prefix + " " + i)
                    .email("lead" + i + "@" + prefix + ".example")
                    .website("https://" + prefix + i + ".example")
                    .category("Plumber")
                    .address(i + " Main St, Los Angeles, CA")
                    .rating(4.5)
                    .reviewCount(10 * i)
                    .build());
        }
        return records;
    }
}
