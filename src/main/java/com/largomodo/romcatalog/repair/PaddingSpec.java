package com.largomodo.romcatalog.repair;

/**
 * Virtual padding placed around a file's data before hashing.
 *
 * @param prependSize fill bytes placed before the data
 * @param appendSize  fill bytes placed after the data
 * @param fillByte    fill value (typically 0x00 or 0xFF)
 */
public record PaddingSpec(long prependSize, long appendSize, byte fillByte) {

    public static final PaddingSpec NONE = new PaddingSpec(0, 0, (byte) 0x00);

    public PaddingSpec {
        if (prependSize < 0 || appendSize < 0) {
            throw new IllegalArgumentException(
                    "padding sizes must not be negative, got prepend=" + prependSize + " append=" + appendSize);
        }
    }

    public static PaddingSpec append(long size, int fillByte) {
        return new PaddingSpec(0, size, (byte) fillByte);
    }

    public static PaddingSpec prepend(long size, int fillByte) {
        return new PaddingSpec(size, 0, (byte) fillByte);
    }

    public long totalAdded() {
        return prependSize + appendSize;
    }

    public int fillValue() {
        return fillByte & 0xFF;
    }
}
