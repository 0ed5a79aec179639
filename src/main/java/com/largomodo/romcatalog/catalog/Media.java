package com.largomodo.romcatalog.catalog;

import java.util.List;
import java.util.Locale;

/**
 * One dump of a {@link Release}, carrying its hashes and status.
 * <p>
 * Any subset of the hashes may be null; duplicate hashes across media are legitimate.
 */
public record Media(String id,
                    String releaseId,
                    String mediaSerial,
                    Integer discNumber,
                    String discLabel,
                    String revision,
                    MediaStatus status,
                    String datName,
                    String datSource,
                    Long fileSize,
                    String crc32,
                    String sha1,
                    String md5) {

    public static final List<String> TEXT_FIELDS = List.of(
            "media_serial", "disc_label", "revision", "status", "dat_name", "dat_source");

    public Media {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (releaseId == null) {
            throw new IllegalArgumentException("releaseId must not be null");
        }
        if (status == null) {
            status = MediaStatus.VERIFIED;
        }
    }

    public Media withReleaseId(String newReleaseId) {
        return new Media(id, newReleaseId, mediaSerial, discNumber, discLabel, revision, status,
                datName, datSource, fileSize, crc32, sha1, md5);
    }

    public String field(String name) {
        return switch (name) {
            case "media_serial" -> mediaSerial;
            case "disc_label" -> discLabel;
            case "revision" -> revision;
            case "status" -> status.name().toLowerCase(Locale.ROOT);
            case "dat_name" -> datName;
            case "dat_source" -> datSource;
            default -> throw new IllegalArgumentException("Unknown media field: " + name);
        };
    }

    public Media withField(String name, String value) {
        if (!TEXT_FIELDS.contains(name)) {
            throw new IllegalArgumentException("Unknown media field: " + name);
        }
        return new Media(id, releaseId,
                name.equals("media_serial") ? value : mediaSerial,
                discNumber,
                name.equals("disc_label") ? value : discLabel,
                name.equals("revision") ? value : revision,
                name.equals("status") ? MediaStatus.fromLoose(value) : status,
                name.equals("dat_name") ? value : datName,
                name.equals("dat_source") ? value : datSource,
                fileSize, crc32, sha1, md5);
    }
}
