package com.largomodo.romcatalog.catalog;

/**
 * A platform's launch in one region. The date is ISO text ("1985-10-18") or null.
 */
public record PlatformRegion(String region, String releaseDate) {
}
