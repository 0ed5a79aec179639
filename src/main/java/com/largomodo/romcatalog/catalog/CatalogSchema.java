package com.largomodo.romcatalog.catalog;

/**
 * Persisted catalog layout version.
 */
public final class CatalogSchema {

    /** Bumped whenever the stored shape of an entity changes incompatibly. */
    public static final int CURRENT_VERSION = 2;

    private CatalogSchema() {
        // Static utility class - prevent instantiation
    }
}
