package com.largomodo.romcatalog.naming;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NameTagParserTest {

    @Test
    void parsesRegionAndRevision() {
        ParsedName parsed = NameTagParser.parse("The Legend of Zelda (USA) (Rev A)");

        assertEquals("The Legend of Zelda", parsed.title());
        assertEquals(List.of("USA"), parsed.regions());
        assertEquals("Rev A", parsed.revision());
        assertEquals(DumpStatus.VERIFIED, parsed.dumpStatus());
        assertTrue(parsed.flags().isEmpty());
    }

    @Test
    void parsesDiscNumberAndLabel() {
        ParsedName parsed = NameTagParser.parse("Resident Evil 2 (USA) (Disc 1) (Leon)");

        assertEquals("Resident Evil 2", parsed.title());
        assertEquals(1, parsed.discNumber());
        assertNull(parsed.discLabel());
        assertEquals(List.of("Leon"), parsed.flags());
    }

    @Test
    void parsesDiscLabelAfterDash() {
        ParsedName parsed = NameTagParser.parse("Resident Evil 2 (USA) (Disc 2 - Claire)");

        assertEquals(2, parsed.discNumber());
        assertEquals("Claire", parsed.discLabel());
    }

    @Test
    void oversizedDiscNumberLeavesNumberUnset() {
        ParsedName parsed = NameTagParser.parse("Game (USA) (Disc 99999999999)");

        assertEquals("Game", parsed.title());
        assertEquals(List.of("USA"), parsed.regions());
        assertNull(parsed.discNumber());
        assertTrue(parsed.flags().isEmpty());
    }

    @Test
    void subtitleLikeGroupIsAFlag() {
        ParsedName parsed = NameTagParser.parse("Game (Part 1) (USA)");

        assertEquals("Game", parsed.title());
        assertEquals(List.of("USA"), parsed.regions());
        assertEquals(List.of("Part 1"), parsed.flags());
    }

    @Test
    void parsesMultiRegionVersionAndLanguages() {
        ParsedName parsed = NameTagParser.parse("Some Game (USA, Europe) (En,Fr,De) (v1.1)");

        assertEquals(List.of("USA", "Europe"), parsed.regions());
        assertEquals(List.of("En", "Fr", "De"), parsed.languages());
        assertEquals("v1.1", parsed.version());
        assertEquals("USA", parsed.primaryRegion());
    }

    @Test
    void duplicateRegionsAreKeptOnce() {
        ParsedName parsed = NameTagParser.parse("Game (USA) (USA, Japan)");

        assertEquals(List.of("USA", "Japan"), parsed.regions());
    }

    @ParameterizedTest
    @CsvSource({
            "'Tetris (USA) [!]', VERIFIED",
            "'Tetris (USA) [b]', BAD_DUMP",
            "'Tetris (USA) [o]', OVERDUMP",
            "'Tetris (USA)', VERIFIED"
    })
    void bracketSetsDumpStatus(String name, DumpStatus expected) {
        assertEquals(expected, NameTagParser.parse(name).dumpStatus());
    }

    @Test
    void unknownBracketIsRecordedAsFlag() {
        ParsedName parsed = NameTagParser.parse("Tetris (USA) [a1]");

        assertEquals(List.of("[a1]"), parsed.flags());
        assertEquals(DumpStatus.VERIFIED, parsed.dumpStatus());
    }

    @Test
    void nameWithoutTagsIsAllTitle() {
        ParsedName parsed = NameTagParser.parse("  Plain Title  ");

        assertEquals("Plain Title", parsed.title());
        assertTrue(parsed.regions().isEmpty());
        assertTrue(parsed.languages().isEmpty());
        assertTrue(parsed.flags().isEmpty());
        assertNull(parsed.revision());
        assertNull(parsed.version());
        assertNull(parsed.discNumber());
        assertEquals(DumpStatus.VERIFIED, parsed.dumpStatus());
    }

    @Test
    void nestedParenthesesStayInOneGroup() {
        ParsedName parsed = NameTagParser.parse("Game (USA) (Demo (Kiosk))");

        assertEquals(List.of("Demo (Kiosk)"), parsed.flags());
    }

    @Test
    void emptyGroupsAreIgnored() {
        ParsedName parsed = NameTagParser.parse("Game () (Japan) []");

        assertEquals(List.of("Japan"), parsed.regions());
        assertTrue(parsed.flags().isEmpty());
    }

    @Test
    void prototypeFlagIsPreserved() {
        ParsedName parsed = NameTagParser.parse("Metroid (USA) (Proto)");

        assertTrue(parsed.hasFlag("proto"));
    }

    @ParameterizedTest
    @CsvSource({
            "United Kingdom, united-kingdom",
            "USA, usa",
            "UK, united-kingdom",
            "Hong Kong, hong-kong",
            "South Africa, south-africa",
            "Latin America, latin-america",
            "'  Some  Odd / Place ', some-odd-place"
    })
    void regionToSlug(String region, String expected) {
        assertEquals(expected, NameTagParser.regionToSlug(region));
    }

    @Test
    void blankRegionSlugIsUnknown() {
        assertEquals("unknown", NameTagParser.regionToSlug(" "));
        assertEquals("unknown", NameTagParser.regionToSlug(null));
    }
}
