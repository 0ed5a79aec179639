package com.largomodo.romcatalog.catalog;

import java.util.List;

/**
 * One platform- and region-specific edition of a {@link Work}.
 * <p>
 * Text fields are addressed by their snake_case names ({@code release_date},
 * {@code alt_title}, ...) when merge and override logic needs generic access.
 */
public record Release(String id,
                      String workId,
                      String platformId,
                      String region,
                      String title,
                      String altTitle,
                      String publisherId,
                      String developerId,
                      String releaseDate,
                      String gameSerial,
                      String genre,
                      String players,
                      Double rating,
                      String description,
                      String externalId,
                      boolean notFoundInEnrichment) {

    /** Text fields addressable through {@link #field(String)} and {@link #withField}. */
    public static final List<String> TEXT_FIELDS = List.of(
            "title", "alt_title", "publisher_id", "developer_id", "release_date",
            "game_serial", "genre", "players", "description", "external_id");

    public Release {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (workId == null || platformId == null) {
            throw new IllegalArgumentException("workId and platformId must not be null");
        }
        if (region == null) {
            region = "unknown";
        }
        if (title == null) {
            title = "";
        }
    }

    /**
     * Minimal release as created by a DAT import.
     */
    public static Release of(String id, String workId, String platformId, String region, String title) {
        return new Release(id, workId, platformId, region, title, null, null, null, null, null,
                null, null, null, null, null, false);
    }

    public Release withWorkId(String newWorkId) {
        return new Release(id, newWorkId, platformId, region, title, altTitle, publisherId, developerId,
                releaseDate, gameSerial, genre, players, rating, description, externalId, notFoundInEnrichment);
    }

    public Release withRating(Double newRating) {
        return new Release(id, workId, platformId, region, title, altTitle, publisherId, developerId,
                releaseDate, gameSerial, genre, players, newRating, description, externalId, notFoundInEnrichment);
    }

    public String field(String name) {
        return switch (name) {
            case "title" -> title;
            case "alt_title" -> altTitle;
            case "publisher_id" -> publisherId;
            case "developer_id" -> developerId;
            case "release_date" -> releaseDate;
            case "game_serial" -> gameSerial;
            case "genre" -> genre;
            case "players" -> players;
            case "description" -> description;
            case "external_id" -> externalId;
            default -> throw new IllegalArgumentException("Unknown release field: " + name);
        };
    }

    public Release withField(String name, String value) {
        if (!TEXT_FIELDS.contains(name)) {
            throw new IllegalArgumentException("Unknown release field: " + name);
        }
        return new Release(id, workId, platformId, region,
                name.equals("title") ? value : title,
                name.equals("alt_title") ? value : altTitle,
                name.equals("publisher_id") ? value : publisherId,
                name.equals("developer_id") ? value : developerId,
                name.equals("release_date") ? value : releaseDate,
                name.equals("game_serial") ? value : gameSerial,
                name.equals("genre") ? value : genre,
                name.equals("players") ? value : players,
                rating,
                name.equals("description") ? value : description,
                name.equals("external_id") ? value : externalId,
                notFoundInEnrichment);
    }
}
