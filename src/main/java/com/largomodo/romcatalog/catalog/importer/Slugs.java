package com.largomodo.romcatalog.catalog.importer;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.zip.CRC32;

/**
 * Stable identifier fragments derived from display names.
 */
final class Slugs {

    private Slugs() {
        // Static utility class - prevent instantiation
    }

    /**
     * Lower-case ASCII letters and digits; every other run of characters becomes a single
     * hyphen, never leading or trailing. A non-blank name with no ASCII letters or digits
     * yields {@code x} followed by the CRC32 of its UTF-8 bytes.
     */
    static String slugify(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean lastWasSeparator = false;
        for (char c : text.toCharArray()) {
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
                sb.append(c);
                lastWasSeparator = false;
            } else if (c >= 'A' && c <= 'Z') {
                sb.append((char) (c + ('a' - 'A')));
                lastWasSeparator = false;
            } else if (!lastWasSeparator && sb.length() > 0) {
                sb.append('-');
                lastWasSeparator = true;
            }
        }
        if (sb.length() > 0 && sb.charAt(sb.length() - 1) == '-') {
            sb.setLength(sb.length() - 1);
        }
        if (sb.length() == 0 && !text.isBlank()) {
            return "x" + crc32Hex(text);
        }
        return sb.toString();
    }

    private static String crc32Hex(String text) {
        CRC32 crc = new CRC32();
        crc.update(text.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().toHexDigits((int) crc.getValue());
    }

    static String workId(String platformId, String title) {
        return platformId + ":" + slugify(title);
    }

    static String releaseId(String workId, String platformId, String regionSlug) {
        return workId + ":" + platformId + ":" + regionSlug;
    }

    static String mediaId(String releaseId, String romName) {
        return releaseId + ":" + slugify(romName);
    }
}
