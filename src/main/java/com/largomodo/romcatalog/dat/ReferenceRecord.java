package com.largomodo.romcatalog.dat;

/**
 * One known-good dump from a reference set.
 *
 * @param title          release name as written in the reference set
 * @param primaryHash    CRC32 as hex, or null
 * @param secondaryHash  SHA-1 as hex, or null
 * @param serial         product serial, or null
 * @param expectedLength size of the known-good dump in bytes, or null when unknown
 * @param sourceKind     cartridge-style or optical-disc-style origin
 */
public record ReferenceRecord(String title,
                              String primaryHash,
                              String secondaryHash,
                              String serial,
                              Long expectedLength,
                              SourceKind sourceKind) {

    public ReferenceRecord {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title must not be null or blank");
        }
        if (sourceKind == null) {
            sourceKind = SourceKind.CARTRIDGE;
        }
    }

    public static ReferenceRecord of(String title, String primaryHash, String secondaryHash) {
        return new ReferenceRecord(title, primaryHash, secondaryHash, null, null, SourceKind.CARTRIDGE);
    }
}
