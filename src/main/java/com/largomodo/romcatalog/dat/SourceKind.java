package com.largomodo.romcatalog.dat;

import java.util.Locale;

/**
 * Physical origin of a reference set, which decides the repair hypotheses worth trying.
 * <p>
 * No-Intro sets describe cartridge-style dumps; Redump sets describe optical discs.
 */
public enum SourceKind {
    CARTRIDGE("no-intro"),
    OPTICAL_DISC("redump");

    private final String datSource;

    SourceKind(String datSource) {
        this.datSource = datSource;
    }

    /**
     * Tag recorded on imported media ("no-intro" or "redump").
     */
    public String getDatSource() {
        return datSource;
    }

    public static SourceKind fromDatSource(String tag) {
        if (tag == null) {
            throw new IllegalArgumentException("DAT source cannot be null. Supported: no-intro, redump");
        }
        return switch (tag.toLowerCase(Locale.ROOT)) {
            case "no-intro", "nointro", "cartridge" -> CARTRIDGE;
            case "redump", "disc", "optical-disc" -> OPTICAL_DISC;
            default -> throw new IllegalArgumentException(
                    "Invalid DAT source: " + tag + ". Supported: no-intro, redump");
        };
    }
}
