package com.largomodo.romcatalog.catalog;

import java.time.Instant;

/**
 * Append-only audit entry for one import or enrichment run.
 */
public record ImportLog(long id,
                        String sourceType,
                        String sourceName,
                        String sourceVersion,
                        Instant importedAt,
                        long recordsCreated,
                        long recordsUpdated,
                        long recordsUnchanged,
                        long disagreementsFound) {

    public ImportLog withId(long newId) {
        return new ImportLog(newId, sourceType, sourceName, sourceVersion, importedAt,
                recordsCreated, recordsUpdated, recordsUnchanged, disagreementsFound);
    }
}
