package com.largomodo.romcatalog.catalog;

/**
 * An abstract game, independent of region and platform.
 */
public record Work(String id, String canonicalName) {

    public Work {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (canonicalName == null) {
            throw new IllegalArgumentException("canonicalName must not be null");
        }
    }

    public Work withCanonicalName(String name) {
        return new Work(id, name);
    }
}
