package com.largomodo.romcatalog.catalog;

/**
 * Row counts per entity type.
 */
public record CatalogStats(int platforms,
                           int companies,
                           int works,
                           int releases,
                           int media,
                           int overrides,
                           int disagreements,
                           int unresolvedDisagreements,
                           int importLogs) {
}
