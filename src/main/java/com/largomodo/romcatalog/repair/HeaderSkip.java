package com.largomodo.romcatalog.repair;

/**
 * Capability for platforms whose dumps carry a header that reference sets do not hash.
 */
@FunctionalInterface
public interface HeaderSkip {

    /**
     * Number of leading bytes to exclude from hashing.
     *
     * @param head     the first bytes of the file (at most {@link HeaderSkipRule#PROBE_SIZE})
     * @param fileSize total size of the file in bytes
     * @return bytes to skip, 0 when the file has no header
     */
    long deriveHeaderSkip(byte[] head, long fileSize);
}
