package com.largomodo.romcatalog.catalog.importer;

/**
 * Counts from one DAT import.
 */
public record ImportStats(int totalGames,
                          int worksCreated,
                          int worksExisting,
                          int releasesCreated,
                          int releasesExisting,
                          int mediaCreated,
                          int mediaUpdated,
                          int mediaUnchanged,
                          int skippedBad) {
}
