package com.largomodo.romcatalog.catalog;

import java.util.Locale;

/**
 * Fidelity of a media dump relative to its reference.
 */
public enum MediaStatus {
    VERIFIED,
    BAD,
    OVERDUMP,
    PROTOTYPE,
    BETA,
    SAMPLE;

    /**
     * Lenient parse used for overrides and imported text; unknown values mean VERIFIED.
     */
    public static MediaStatus fromLoose(String text) {
        if (text == null) {
            return VERIFIED;
        }
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "bad", "bad_dump", "baddump" -> BAD;
            case "overdump" -> OVERDUMP;
            case "prototype", "proto" -> PROTOTYPE;
            case "beta" -> BETA;
            case "sample" -> SAMPLE;
            default -> VERIFIED;
        };
    }
}
