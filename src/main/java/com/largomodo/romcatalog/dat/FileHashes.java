package com.largomodo.romcatalog.dat;

/**
 * Checksums of one file's data after header skip and virtual padding.
 *
 * @param crc32    lowercase 8-digit hex
 * @param sha1     lowercase hex, or null when not computed
 * @param md5      lowercase hex, or null when not computed
 * @param dataSize number of bytes that went through the digests
 */
public record FileHashes(String crc32, String sha1, String md5, long dataSize) {

    public FileHashes {
        if (crc32 == null) {
            throw new IllegalArgumentException("crc32 must not be null");
        }
        if (dataSize < 0) {
            throw new IllegalArgumentException("dataSize must not be negative, got: " + dataSize);
        }
    }
}
