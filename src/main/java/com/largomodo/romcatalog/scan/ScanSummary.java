package com.largomodo.romcatalog.scan;

/**
 * Outcome counts for a batch.
 */
public record ScanSummary(int total, int matched, int unmatched, int needsRepair, int errors) {
}
