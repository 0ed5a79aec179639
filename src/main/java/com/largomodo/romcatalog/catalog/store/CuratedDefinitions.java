package com.largomodo.romcatalog.catalog.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.largomodo.romcatalog.catalog.Company;
import com.largomodo.romcatalog.catalog.FieldOverride;
import com.largomodo.romcatalog.catalog.Platform;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Hand-maintained platform, company and override definitions, stored as one JSON document.
 */
public record CuratedDefinitions(List<Platform> platforms,
                                 List<Company> companies,
                                 List<FieldOverride> overrides) {

    public CuratedDefinitions {
        platforms = platforms == null ? List.of() : List.copyOf(platforms);
        companies = companies == null ? List.of() : List.copyOf(companies);
        overrides = overrides == null ? List.of() : List.copyOf(overrides);
    }

    public static CuratedDefinitions read(Path file, ObjectMapper mapper) throws IOException {
        return mapper.readValue(file.toFile(), CuratedDefinitions.class);
    }
}
