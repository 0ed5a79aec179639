package com.largomodo.romcatalog.dat;

/**
 * A single ROM entry within a DAT game. Hashes are stored lowercase.
 */
public record DatRom(String name, long size, String crc, String sha1, String md5, String serial) {

    public DatRom {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative, got: " + size);
        }
        crc = HashIndex.normalizeHash(crc);
        sha1 = HashIndex.normalizeHash(sha1);
        md5 = HashIndex.normalizeHash(md5);
    }
}
