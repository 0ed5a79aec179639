package com.largomodo.romcatalog.dat;

import java.util.ArrayList;
import java.util.List;

/**
 * A parsed reference DAT.
 */
public record DatFile(String name, String description, String version, List<DatGame> games) {

    public DatFile {
        games = List.copyOf(games);
    }

    /**
     * Flatten games into reference records, one per ROM.
     * <p>
     * Single-ROM games keep the game name as title; multi-ROM games (disc tracks) use the
     * ROM file name so each track stays identifiable.
     */
    public List<ReferenceRecord> toReferenceRecords(SourceKind kind) {
        List<ReferenceRecord> records = new ArrayList<>();
        for (DatGame game : games) {
            for (DatRom rom : game.roms()) {
                String title = game.roms().size() == 1 ? game.name() : rom.name();
                records.add(new ReferenceRecord(title, rom.crc(), rom.sha1(), rom.serial(), rom.size(), kind));
            }
        }
        return records;
    }
}
