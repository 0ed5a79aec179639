package com.largomodo.romcatalog.naming;

import java.util.List;

/**
 * Structured fields extracted from a No-Intro / Redump release name.
 *
 * @param title      base title without any parenthesised or bracketed tags
 * @param regions    region names in the order they appear (de-duplicated)
 * @param revision   revision tag such as "Rev A", or null
 * @param version    version tag such as "v1.1", or null
 * @param languages  language codes such as "En", "Fr"
 * @param discNumber disc number for multi-disc sets, or null
 * @param discLabel  label following the disc number ("Disc 1 - Leon"), or null
 * @param flags      every other tag, in order ("Proto", "Unl", "Part 1", "[a]")
 * @param dumpStatus status from the bracket tags
 */
public record ParsedName(String title,
                         List<String> regions,
                         String revision,
                         String version,
                         List<String> languages,
                         Integer discNumber,
                         String discLabel,
                         List<String> flags,
                         DumpStatus dumpStatus) {

    public ParsedName {
        if (title == null) {
            throw new IllegalArgumentException("title must not be null");
        }
        regions = List.copyOf(regions);
        languages = List.copyOf(languages);
        flags = List.copyOf(flags);
        if (dumpStatus == null) {
            dumpStatus = DumpStatus.VERIFIED;
        }
    }

    /**
     * True when any flag equals one of the given values, ignoring case.
     */
    public boolean hasFlag(String... candidates) {
        for (String flag : flags) {
            for (String candidate : candidates) {
                if (flag.equalsIgnoreCase(candidate)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * First region, or null when the name carried none.
     */
    public String primaryRegion() {
        return regions.isEmpty() ? null : regions.get(0);
    }
}
