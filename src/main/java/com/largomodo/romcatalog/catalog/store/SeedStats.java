package com.largomodo.romcatalog.catalog.store;

/**
 * Rows written by one {@link CatalogSeeder#seed} call. Overrides already present are not counted.
 */
public record SeedStats(int platforms, int companies, int overrides) {
}
