package com.largomodo.romcatalog.repair;

/**
 * How a matched repair would modify the file.
 */
public record RepairMethod(Kind kind, int fillByte, long bytesAdded) {

    public enum Kind {
        APPEND,
        PREPEND
    }

    public static RepairMethod of(PaddingSpec padding) {
        if (padding.prependSize() > 0) {
            return new RepairMethod(Kind.PREPEND, padding.fillValue(), padding.prependSize());
        }
        return new RepairMethod(Kind.APPEND, padding.fillValue(), padding.appendSize());
    }

    /**
     * Human-readable form, e.g. "append 1 MB of 0x00" or "prepend 352800 bytes of 0x00".
     */
    public String description() {
        String verb = kind == Kind.APPEND ? "append" : "prepend";
        return String.format("%s %s of 0x%02X", verb, formatBytes(bytesAdded), fillByte);
    }

    static String formatBytes(long bytes) {
        if (bytes >= 1024 * 1024 && bytes % (1024 * 1024) == 0) {
            return (bytes / (1024 * 1024)) + " MB";
        }
        if (bytes >= 1024 && bytes % 1024 == 0) {
            return (bytes / 1024) + " KB";
        }
        return bytes + " bytes";
    }
}
