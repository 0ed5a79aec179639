package com.largomodo.romcatalog.catalog.reconcile;

import com.largomodo.romcatalog.naming.NameTagParser;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reduces a work name to the key used to spot duplicates.
 * <p>
 * Tags are stripped with {@link NameTagParser}, then the title is lower-cased, punctuation is
 * dropped and whitespace collapsed: {@code "Super Mario Bros."} and {@code "super mario bros"}
 * share a key.
 */
public final class TitleNormalizer {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TitleNormalizer() {
        // Static utility class - prevent instantiation
    }

    public static String key(String name) {
        if (name == null) {
            return "";
        }
        String title = NameTagParser.parse(name).title().toLowerCase(Locale.ROOT);
        // "Mario & Luigi" and "Mario and Luigi" are the same game
        title = title.replace("&", " and ");
        title = NON_WORD.matcher(title).replaceAll("");
        return WHITESPACE.matcher(title).replaceAll(" ").trim();
    }
}
