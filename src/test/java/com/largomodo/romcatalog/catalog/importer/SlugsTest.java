package com.largomodo.romcatalog.catalog.importer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class SlugsTest {

    @ParameterizedTest
    @CsvSource({
            "'Super Mario Bros.', super-mario-bros",
            "'  The Legend of Zelda  ', the-legend-of-zelda",
            "'Mega Man 2 - Dr. Wily', mega-man-2-dr-wily",
            "'Pokémon Red', pok-mon-red"
    })
    void slugifyKeepsAsciiLettersAndDigits(String title, String expected) {
        assertEquals(expected, Slugs.slugify(title));
    }

    @Test
    void titlesWithoutAsciiGetDistinctStableIds() {
        String dq = Slugs.workId("nes", "ドラゴンクエスト");
        String ff = Slugs.workId("nes", "ファイナルファンタジー");

        assertTrue(dq.matches("nes:x[0-9a-f]{8}"), dq);
        assertTrue(ff.matches("nes:x[0-9a-f]{8}"), ff);
        assertNotEquals(dq, ff);
        assertEquals(dq, Slugs.workId("nes", "ドラゴンクエスト"));
    }

    @Test
    void blankTitleStaysEmpty() {
        assertEquals("", Slugs.slugify("   "));
    }
}
