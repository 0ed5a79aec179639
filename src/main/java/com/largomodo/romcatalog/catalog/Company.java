package com.largomodo.romcatalog.catalog;

import java.util.List;

/**
 * A publisher or developer. Aliases resolve free-text credits to this company.
 */
public record Company(String id, String name, String country, List<String> aliases) {

    public Company {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }

    public boolean answersTo(String text) {
        if (text == null) {
            return false;
        }
        if (name != null && name.equalsIgnoreCase(text.trim())) {
            return true;
        }
        return aliases.stream().anyMatch(alias -> alias.equalsIgnoreCase(text.trim()));
    }
}
