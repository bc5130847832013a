package com.leadgen.backend.services.coverage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadgen.backend.enums.DensityClass;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads density tables shipped as JSON under {@code classpath:density-tables/}. Each file names its
 * region and any aliases; lookups are case and punctuation insensitive.
 */
@Component
@Slf4j
public class ClasspathDensityTableProvider implements DensityTableProvider {

    static final String LOCATION = "classpath*:density-tables/*.json";

    private final ObjectMapper objectMapper;
    private final Map<String, DensityTable> tables = new ConcurrentHashMap<>();

    public ClasspathDensityTableProvider(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        load();
    }

    @Override
    public DensityTable tableFor(String region) {
        if (region == null) {
            return DensityTable.empty(null);
        }
        DensityTable table = tables.get(normalize(region));
        return table != null ? table : DensityTable.empty(region);
    }

    static String normalize(String region) {
        return region.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ").trim();
    }

    private void load() {
        Resource[] resources;
        try {
            resources = new PathMatchingResourcePatternResolver().getResources(LOCATION);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot scan density tables at " + LOCATION, e);
        }

        for (Resource resource : resources) {
            try (InputStream in = resource.getInputStream()) {
                DensityFile file = objectMapper.readValue(in, DensityFile.class);
                DensityTable table = file.toTable();
                tables.put(normalize(file.getRegion()), table);
                for (String alias : file.getAliases()) {
                    tables.put(normalize(alias), table);
                }
                log.info("Loaded density table '{}' with {} units from {}",
                        file.getRegion(), table.entries().size(), resource.getFilename());
            } catch (IOException e) {
                throw new IllegalStateException("Invalid density table " + resource.getFilename(), e);
            }
        }
    }

    @Data
    static class DensityFile {
        private String region;
        private List<String> aliases = new ArrayList<>();
        private List<Row> units = new ArrayList<>();

        DensityTable toTable() {
            List<DensityEntry> entries = new ArrayList<>(units.size());
            for (Row row : units) {
                entries.add(new DensityEntry(row.getKey(), row.getLabel(), row.getDensity(), row.getBusinesses()));
            }
            return new DensityTable(region, entries);
        }
    }

    @Data
    static class Row {
        private String key;
        private String label;
        private DensityClass density;
        private int businesses;
    }
}
