package com.largomodo.romcatalog.catalog.store;

import com.largomodo.romcatalog.catalog.CatalogSchema;
import com.largomodo.romcatalog.catalog.Company;
import com.largomodo.romcatalog.catalog.Disagreement;
import com.largomodo.romcatalog.catalog.FieldOverride;
import com.largomodo.romcatalog.catalog.ImportLog;
import com.largomodo.romcatalog.catalog.Media;
import com.largomodo.romcatalog.catalog.Platform;
import com.largomodo.romcatalog.catalog.Release;
import com.largomodo.romcatalog.catalog.Work;

import java.util.List;

/**
 * Complete, detached copy of a catalog's rows. Serialised as-is by {@link JsonCatalogRepository}.
 */
public record CatalogSnapshot(int schemaVersion,
                              List<Platform> platforms,
                              List<Company> companies,
                              List<Work> works,
                              List<Release> releases,
                              List<Media> media,
                              List<FieldOverride> overrides,
                              List<Disagreement> disagreements,
                              List<ImportLog> importLogs) {

    public CatalogSnapshot {
        platforms = platforms == null ? List.of() : List.copyOf(platforms);
        companies = companies == null ? List.of() : List.copyOf(companies);
        works = works == null ? List.of() : List.copyOf(works);
        releases = releases == null ? List.of() : List.copyOf(releases);
        media = media == null ? List.of() : List.copyOf(media);
        overrides = overrides == null ? List.of() : List.copyOf(overrides);
        disagreements = disagreements == null ? List.of() : List.copyOf(disagreements);
        importLogs = importLogs == null ? List.of() : List.copyOf(importLogs);
    }

    public static CatalogSnapshot empty() {
        return new CatalogSnapshot(CatalogSchema.CURRENT_VERSION, List.of(), List.of(), List.of(), List.of(),
                List.of(), List.of(), List.of(), List.of());
    }
}
