package com.largomodo.romcatalog.catalog;

/**
 * A curated correction: set {@code field} to {@code value} on matching entities.
 *
 * @param entityType     "release" or "media"
 * @param entityId       direct target, or null
 * @param platformId     restricts pattern matching to one platform, or null for all
 * @param datNamePattern glob matched against media dat names ({@code *} any run, {@code ?} one char), or null
 * @param field          snake_case field name
 * @param value          replacement value
 * @param reason         why the correction exists
 */
public record FieldOverride(String entityType,
                            String entityId,
                            String platformId,
                            String datNamePattern,
                            String field,
                            String value,
                            String reason) {

    public FieldOverride {
        if (entityType == null || field == null || value == null) {
            throw new IllegalArgumentException("entityType, field and value must not be null");
        }
    }
}
