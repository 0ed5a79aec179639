package com.largomodo.romcatalog.catalog;

import java.util.List;

/**
 * A console or computer platform, loaded from curated definitions.
 */
public record Platform(String id,
                       String displayName,
                       String shortName,
                       String manufacturer,
                       MediaType mediaType,
                       Integer releaseYear,
                       List<PlatformRegion> regions,
                       List<PlatformRelationship> relationships) {

    public Platform {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (displayName == null) {
            displayName = id;
        }
        if (mediaType == null) {
            mediaType = MediaType.CARTRIDGE;
        }
        regions = regions == null ? List.of() : List.copyOf(regions);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
    }

    public static Platform of(String id, String displayName, MediaType mediaType) {
        return new Platform(id, displayName, id, null, mediaType, null, List.of(), List.of());
    }
}
