package com.largomodo.romcatalog.scan;

import java.nio.file.Path;

/**
 * Observer for batch identification.
 * <p>
 * All methods have default no-op implementations so callers override only what they need.
 * Callbacks arrive from worker threads; implementations must be thread-safe.
 */
public interface ScanListener {

    /**
     * Called before a file is hashed.
     *
     * @param current 1-based position of the file in the batch
     * @param total   number of files in the batch
     * @param name    file name
     */
    default void onFile(int current, int total, String name) {
    }

    default void onMatched(Identification result) {
    }

    default void onUnmatched(Identification result) {
    }

    default void onNeedsRepair(Identification result) {
    }

    /**
     * Called when a file could not be identified at all. The batch continues.
     */
    default void onError(Path file, Exception e) {
    }

    default void onComplete(ScanSummary summary) {
    }
}
