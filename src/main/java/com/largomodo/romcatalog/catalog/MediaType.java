package com.largomodo.romcatalog.catalog;

/**
 * Physical media type of a platform.
 */
public enum MediaType {
    CARTRIDGE,
    DISC,
    CARD,
    DIGITAL
}
