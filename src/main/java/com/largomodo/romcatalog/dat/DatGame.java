package com.largomodo.romcatalog.dat;

import java.util.List;

/**
 * A game entry from a DAT file: one release name and the ROMs that make it up.
 *
 * @param name   release name following the No-Intro / Redump convention
 * @param region DAT-level region attribute, or null
 * @param roms   ROM entries (one per track or file)
 */
public record DatGame(String name, String region, List<DatRom> roms) {

    public DatGame {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        roms = List.copyOf(roms);
    }
}
