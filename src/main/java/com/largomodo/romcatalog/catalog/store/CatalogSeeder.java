package com.largomodo.romcatalog.catalog.store;

import com.largomodo.romcatalog.catalog.Company;
import com.largomodo.romcatalog.catalog.FieldOverride;
import com.largomodo.romcatalog.catalog.Platform;
import com.largomodo.romcatalog.catalog.PlatformRelationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads curated definitions into a store. Safe to run repeatedly: platforms and companies
 * are upserted by id and duplicate overrides are ignored.
 */
public class CatalogSeeder {

    private static final Logger log = LoggerFactory.getLogger(CatalogSeeder.class);

    private final CatalogStore store;

    public CatalogSeeder(CatalogStore store) {
        this.store = store;
    }

    public SeedStats seed(CuratedDefinitions definitions) {
        return store.inTransaction(() -> {
            for (Platform platform : definitions.platforms()) {
                store.upsertPlatform(platform);
            }
            // Relationships may point forward, so check them once every platform exists
            for (Platform platform : definitions.platforms()) {
                for (PlatformRelationship rel : platform.relationships()) {
                    if (store.findPlatform(rel.platformId()).isEmpty()) {
                        log.warn("Platform {} declares {} relationship to unknown platform {}",
                                platform.id(), rel.type(), rel.platformId());
                    }
                }
            }
            for (Company company : definitions.companies()) {
                store.upsertCompany(company);
            }
            int overrides = 0;
            for (FieldOverride override : definitions.overrides()) {
                if (store.addOverride(override)) {
                    overrides++;
                }
            }
            SeedStats stats = new SeedStats(definitions.platforms().size(), definitions.companies().size(), overrides);
            log.info("Seeded {} platforms, {} companies, {} new overrides",
                    stats.platforms(), stats.companies(), stats.overrides());
            return stats;
        });
    }
}
