package com.largomodo.romcatalog.repair;

import com.largomodo.romcatalog.dat.FileHashes;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.zip.CRC32;

/**
 * Computes CRC32, SHA-1 and MD5 of {@code [prepend fill] + data + [append fill]} in one
 * streaming pass.
 * <p>
 * Fill bytes come from a single reusable chunk, so memory use is bounded by the chunk size
 * however large the padding is. The source is never modified.
 */
public class PaddedHasher {

    public static final int DEFAULT_CHUNK_SIZE = 64 * 1024;

    private final int chunkSize;

    public PaddedHasher() {
        this(DEFAULT_CHUNK_SIZE);
    }

    public PaddedHasher(int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive, got: " + chunkSize);
        }
        this.chunkSize = chunkSize;
    }

    /**
     * Hash a file's data after its header, with virtual padding.
     *
     * @param file       file to read
     * @param headerSkip header rule applied before hashing
     * @param padding    virtual padding, {@link PaddingSpec#NONE} for a plain hash
     */
    public FileHashes hash(Path file, HeaderSkip headerSkip, PaddingSpec padding) throws IOException {
        long skip = HeaderSkipRule.headerSkipOf(file, headerSkip);
        try (InputStream in = Files.newInputStream(file)) {
            in.skipNBytes(skip);
            return hash(in, padding);
        }
    }

    /**
     * Hash a stream positioned at the first data byte. The stream is read to its end
     * but not closed.
     */
    public FileHashes hash(InputStream data, PaddingSpec padding) throws IOException {
        CRC32 crc = new CRC32();
        MessageDigest sha1 = digest("SHA-1");
        MessageDigest md5 = digest("MD5");

        byte[] fill = new byte[(int) Math.min(chunkSize, Math.max(padding.totalAdded(), 1))];
        Arrays.fill(fill, padding.fillByte());

        long total = 0;
        total += feedFill(fill, padding.prependSize(), crc, sha1, md5);

        byte[] buf = new byte[chunkSize];
        int n;
        while ((n = data.read(buf)) != -1) {
            crc.update(buf, 0, n);
            sha1.update(buf, 0, n);
            md5.update(buf, 0, n);
            total += n;
        }

        total += feedFill(fill, padding.appendSize(), crc, sha1, md5);

        HexFormat hex = HexFormat.of();
        return new FileHashes(
                String.format("%08x", crc.getValue()),
                hex.formatHex(sha1.digest()),
                hex.formatHex(md5.digest()),
                total);
    }

    private static long feedFill(byte[] fill, long count, CRC32 crc, MessageDigest sha1, MessageDigest md5) {
        long remaining = count;
        while (remaining > 0) {
            int n = (int) Math.min(remaining, fill.length);
            crc.update(fill, 0, n);
            sha1.update(fill, 0, n);
            md5.update(fill, 0, n);
            remaining -= n;
        }
        return count;
    }

    private static MessageDigest digest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            // Every JDK ships SHA-1 and MD5
            throw new IllegalStateException(algorithm + " not available", e);
        }
    }
}
