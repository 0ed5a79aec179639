package com.largomodo.romcatalog.catalog.importer;

/**
 * Progress callback for {@link DatImporter}. Methods default to no-ops.
 */
public interface ImportListener {

    ImportListener NONE = new ImportListener() {
    };

    /**
     * Called after each DAT game has been processed.
     *
     * @param current 1-based position of the game
     * @param total   number of games in the DAT
     * @param name    game name as written in the DAT
     */
    default void onGame(int current, int total, String name) {
    }

    default void onComplete(ImportStats stats) {
    }
}
