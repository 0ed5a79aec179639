package com.largomodo.romcatalog.catalog.merge;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Release field values proposed by one source. Any field may be null (the source has no opinion).
 */
public record ReleaseFieldValues(String title,
                                 String altTitle,
                                 String releaseDate,
                                 String genre,
                                 String players,
                                 String description,
                                 String gameSerial,
                                 String publisherId) {

    /**
     * Proposed values keyed by release field name, in comparison order.
     */
    Map<String, String> byFieldName() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("title", title);
        fields.put("alt_title", altTitle);
        fields.put("release_date", releaseDate);
        fields.put("genre", genre);
        fields.put("players", players);
        fields.put("description", description);
        fields.put("game_serial", gameSerial);
        fields.put("publisher_id", publisherId);
        return fields;
    }
}
