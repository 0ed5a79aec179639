package com.largomodo.romcatalog.catalog;

/**
 * Directed link from the owning platform to another one.
 */
public record PlatformRelationship(String platformId, Type type) {

    public enum Type {
        REGIONAL_VARIANT,
        SUCCESSOR,
        ADDON,
        COMPATIBLE
    }
}
