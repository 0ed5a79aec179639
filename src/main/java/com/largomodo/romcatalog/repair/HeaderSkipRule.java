package com.largomodo.romcatalog.repair;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Closed set of header detection rules, one per platform family.
 */
public enum HeaderSkipRule implements HeaderSkip {

    /** Headerless dumps. */
    NONE {
        @Override
        public long deriveHeaderSkip(byte[] head, long fileSize) {
            return 0;
        }
    },

    /** iNES / NES 2.0: 16-byte header starting with "NES" 0x1A. */
    INES {
        @Override
        public long deriveHeaderSkip(byte[] head, long fileSize) {
            return startsWith(head, INES_MAGIC) && fileSize >= 16 ? 16 : 0;
        }
    },

    /** SNES copier units (SMC/SWC/FIG): 512-byte header detected by size modulo 1 KB. */
    SNES_COPIER {
        @Override
        public long deriveHeaderSkip(byte[] head, long fileSize) {
            return fileSize % 1024 == 512 ? 512 : 0;
        }
    },

    /** Atari Lynx: 64-byte header starting with "LYNX". */
    LYNX {
        @Override
        public long deriveHeaderSkip(byte[] head, long fileSize) {
            return startsWith(head, LYNX_MAGIC) && fileSize >= 64 ? 64 : 0;
        }
    };

    /** Bytes read from the start of a file before asking a rule for its skip. */
    public static final int PROBE_SIZE = 16;

    private static final byte[] INES_MAGIC = {'N', 'E', 'S', 0x1A};
    private static final byte[] LYNX_MAGIC = "LYNX".getBytes(StandardCharsets.US_ASCII);

    private static boolean startsWith(byte[] head, byte[] magic) {
        if (head == null || head.length < magic.length) {
            return false;
        }
        for (int i = 0; i < magic.length; i++) {
            if (head[i] != magic[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Accepts CLI-style names such as "snes-copier" as well as constant names.
     */
    public static HeaderSkipRule fromCliArgument(String arg) {
        if (arg == null) {
            throw new IllegalArgumentException("Header rule cannot be null. Supported: none, ines, snes-copier, lynx");
        }
        try {
            return valueOf(arg.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid header rule: " + arg
                    + ". Supported: none, ines, snes-copier, lynx", e);
        }
    }

    /**
     * Probe the start of a file and apply the given rule.
     */
    public static long headerSkipOf(Path file, HeaderSkip rule) throws IOException {
        long size = Files.size(file);
        byte[] head;
        try (InputStream in = Files.newInputStream(file)) {
            head = in.readNBytes(PROBE_SIZE);
        }
        long skip = rule.deriveHeaderSkip(head, size);
        return Math.min(Math.max(skip, 0), size);
    }
}
