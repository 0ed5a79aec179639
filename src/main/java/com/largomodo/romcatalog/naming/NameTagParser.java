package com.largomodo.romcatalog.naming;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parser for the No-Intro / Redump release naming convention.
 * <p>
 * Names look like {@code Game Name (Region1, Region2) (Rev X) (En,Fr,De) [!]}. The title is
 * everything before the first tag group. Parenthesised groups are classified one by one,
 * in no fixed positional order; anything that is not a region, revision, version, disc
 * or language list becomes a flag. Bracketed groups carry the dump status.
 * <p>
 * Stateless and free of I/O. Safe for concurrent use.
 */
public final class NameTagParser {

    private static final Set<String> KNOWN_REGIONS = Set.of(
            "usa", "japan", "europe", "world", "australia", "korea", "china", "taiwan",
            "brazil", "france", "germany", "spain", "italy", "netherlands", "sweden",
            "norway", "denmark", "finland", "portugal", "russia", "hong kong", "asia",
            "canada", "mexico", "argentina", "chile", "colombia", "india", "south africa",
            "united kingdom", "new zealand", "poland", "czech republic", "hungary",
            "greece", "turkey", "israel", "saudi arabia", "uae", "scandinavia",
            "latin america"
    );

    private static final Map<String, String> REGION_ALIASES = Map.ofEntries(
            Map.entry("usa", "usa"), Map.entry("us", "usa"), Map.entry("united states", "usa"),
            Map.entry("japan", "japan"), Map.entry("jp", "japan"), Map.entry("jpn", "japan"),
            Map.entry("europe", "europe"), Map.entry("eu", "europe"), Map.entry("eur", "europe"),
            Map.entry("world", "world"), Map.entry("wld", "world"),
            Map.entry("australia", "australia"), Map.entry("aus", "australia"),
            Map.entry("korea", "korea"), Map.entry("kor", "korea"), Map.entry("kr", "korea"),
            Map.entry("china", "china"), Map.entry("chn", "china"), Map.entry("cn", "china"),
            Map.entry("taiwan", "taiwan"), Map.entry("twn", "taiwan"), Map.entry("tw", "taiwan"),
            Map.entry("brazil", "brazil"), Map.entry("bra", "brazil"), Map.entry("br", "brazil"),
            Map.entry("france", "france"), Map.entry("fra", "france"), Map.entry("fr", "france"),
            Map.entry("germany", "germany"), Map.entry("ger", "germany"), Map.entry("de", "germany"),
            Map.entry("deu", "germany"),
            Map.entry("spain", "spain"), Map.entry("esp", "spain"), Map.entry("es", "spain"),
            Map.entry("italy", "italy"), Map.entry("ita", "italy"), Map.entry("it", "italy"),
            Map.entry("netherlands", "netherlands"), Map.entry("holland", "netherlands"),
            Map.entry("nl", "netherlands"), Map.entry("nld", "netherlands"), Map.entry("ned", "netherlands"),
            Map.entry("hong kong", "hong-kong"), Map.entry("hk", "hong-kong"), Map.entry("hkg", "hong-kong"),
            Map.entry("united kingdom", "united-kingdom"), Map.entry("uk", "united-kingdom"),
            Map.entry("gb", "united-kingdom"), Map.entry("gbr", "united-kingdom"),
            Map.entry("latin america", "latin-america")
    );

    private static final Pattern VERSION = Pattern.compile("[vV]\\d.*");
    private static final Pattern DISC = Pattern.compile("Disc (\\d+)(?: - (.+))?");
    private static final Pattern LANGUAGE_CODE = Pattern.compile("[A-Z][a-z]{1,2}");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");

    private NameTagParser() {
        // Static utility class - prevent instantiation
    }

    /**
     * Parse a release name into its structured fields.
     *
     * @param name free-text release name (must not be null)
     * @return parsed fields; a name without tags yields the whole trimmed string as title
     */
    public static ParsedName parse(String name) {
        if (name == null) {
            throw new IllegalArgumentException("name must not be null");
        }

        Builder result = new Builder();
        int titleEnd = -1;
        int i = 0;
        while (i < name.length()) {
            char ch = name.charAt(i);
            if (ch != '(' && ch != '[') {
                i++;
                continue;
            }
            if (titleEnd < 0) {
                titleEnd = i;
            }
            char close = ch == '(' ? ')' : ']';
            int depth = 1;
            int start = i + 1;
            int end = name.length();
            int j = start;
            for (; j < name.length(); j++) {
                char c = name.charAt(j);
                if (c == ch) {
                    depth++;
                } else if (c == close && --depth == 0) {
                    end = j;
                    break;
                }
            }
            String content = name.substring(start, end).trim();
            if (!content.isEmpty()) {
                if (ch == '(') {
                    classifyParen(content, result);
                } else {
                    classifyBracket(content, result);
                }
            }
            i = j + 1;
        }

        result.title = titleEnd < 0 ? name.trim() : name.substring(0, titleEnd).trim();
        return result.build();
    }

    /**
     * Map a region display name to the lowercase hyphenated slug used as a catalog key.
     * <p>
     * Known abbreviations resolve to their canonical slug ("UK" and "United Kingdom" both
     * give "united-kingdom"); other names are lowercased with non-alphanumeric runs
     * collapsed to a single hyphen.
     *
     * @param region region display name or abbreviation
     * @return slug, or "unknown" for a null or blank input
     */
    public static String regionToSlug(String region) {
        if (region == null || region.isBlank()) {
            return "unknown";
        }
        String lower = region.trim().toLowerCase(Locale.ROOT);
        String alias = REGION_ALIASES.get(lower);
        if (alias != null) {
            return alias;
        }
        String slug = NON_ALNUM.matcher(lower).replaceAll("-");
        slug = slug.replaceAll("^-+|-+$", "");
        return slug.isEmpty() ? "unknown" : slug;
    }

    /**
     * True if every comma-separated part is a known region name (case-insensitive).
     */
    public static boolean isRegionList(String text) {
        for (String part : text.split(",")) {
            if (!KNOWN_REGIONS.contains(part.trim().toLowerCase(Locale.ROOT))) {
                return false;
            }
        }
        return true;
    }

    private static void classifyParen(String content, Builder result) {
        if (isRegionList(content)) {
            for (String part : content.split(",")) {
                String region = part.trim();
                if (!result.regions.contains(region)) {
                    result.regions.add(region);
                }
            }
            return;
        }

        if (content.startsWith("Rev ")) {
            result.revision = "Rev " + content.substring(4).trim();
            return;
        }

        if (VERSION.matcher(content).matches()) {
            result.version = content;
            return;
        }

        var disc = DISC.matcher(content);
        if (disc.matches()) {
            try {
                result.discNumber = Integer.parseInt(disc.group(1));
            } catch (NumberFormatException e) {
                // out of range: the tag is still a disc tag, number stays unset
                result.discNumber = null;
            }
            if (disc.group(2) != null) {
                result.discLabel = disc.group(2).trim();
            }
            return;
        }

        if (isLanguageList(content)) {
            for (String lang : content.split(",")) {
                result.languages.add(lang.trim());
            }
            return;
        }

        result.flags.add(content);
    }

    // Single codes are ambiguous with flags, so a list needs at least two entries
    private static boolean isLanguageList(String content) {
        String[] parts = content.split(",");
        if (parts.length < 2) {
            return false;
        }
        for (String part : parts) {
            if (!LANGUAGE_CODE.matcher(part.trim()).matches()) {
                return false;
            }
        }
        return true;
    }

    private static void classifyBracket(String content, Builder result) {
        switch (content) {
            case "!" -> result.status = DumpStatus.VERIFIED;
            case "b" -> result.status = DumpStatus.BAD_DUMP;
            case "o" -> result.status = DumpStatus.OVERDUMP;
            default -> result.flags.add("[" + content + "]");
        }
    }

    private static final class Builder {
        private String title = "";
        private final List<String> regions = new ArrayList<>();
        private String revision;
        private String version;
        private final List<String> languages = new ArrayList<>();
        private Integer discNumber;
        private String discLabel;
        private final List<String> flags = new ArrayList<>();
        private DumpStatus status = DumpStatus.VERIFIED;

        private ParsedName build() {
            return new ParsedName(title, regions, revision, version, languages,
                    discNumber, discLabel, flags, status);
        }
    }
}
