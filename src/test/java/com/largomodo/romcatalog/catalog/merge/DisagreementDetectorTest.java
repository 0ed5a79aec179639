package com.largomodo.romcatalog.catalog.merge;

import com.largomodo.romcatalog.catalog.Disagreement;
import com.largomodo.romcatalog.catalog.EntityNotFoundException;
import com.largomodo.romcatalog.catalog.MediaType;
import com.largomodo.romcatalog.catalog.Platform;
import com.largomodo.romcatalog.catalog.Release;
import com.largomodo.romcatalog.catalog.Work;
import com.largomodo.romcatalog.catalog.store.InMemoryCatalogStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DisagreementDetectorTest {

    private static final String RELEASE_ID = "nes:super-mario-bros:usa";

    private InMemoryCatalogStore store;
    private DisagreementDetector detector;

    @BeforeEach
    void setUp() {
        store = new InMemoryCatalogStore();
        store.upsertPlatform(Platform.of("nes", "NES", MediaType.CARTRIDGE));
        store.upsertWork(new Work("nes:super-mario-bros", "Super Mario Bros."));
        store.upsertRelease(Release.of(RELEASE_ID, "nes:super-mario-bros", "nes", "usa", "Super Mario Bros.")
                .withField("release_date", "1985-10-18")
                .withField("genre", "Platform"));
        detector = new DisagreementDetector(store);
    }

    @Test
    void conflictingValuesAreRecorded() {
        boolean recorded = detector.checkField("release", RELEASE_ID, "release_date",
                "no-intro", "1985-10-18", "screenscraper", "1985-09-13");

        assertTrue(recorded);
        List<Disagreement> rows = store.disagreements();
        assertEquals(1, rows.size());
        Disagreement row = rows.get(0);
        assertEquals("release", row.entityType());
        assertEquals(RELEASE_ID, row.entityId());
        assertEquals("release_date", row.field());
        assertEquals("no-intro", row.sourceA());
        assertEquals("1985-10-18", row.valueA());
        assertEquals("screenscraper", row.sourceB());
        assertEquals("1985-09-13", row.valueB());
        assertFalse(row.resolved());
    }

    @ParameterizedTest
    @CsvSource(value = {
            "NULL, X",
            "X, NULL",
            "'', X",
            "X, ''",
            "X, X",
    }, nullValues = "NULL")
    void nothingRecordedWithoutARealConflict(String existing, String proposed) {
        assertFalse(detector.checkField("release", RELEASE_ID, "genre", "a", existing, "b", proposed));
        assertTrue(store.disagreements().isEmpty());
    }

    @Test
    void comparisonIsCaseSensitive() {
        assertTrue(detector.checkField("release", RELEASE_ID, "genre", "a", "Platform", "b", "platform"));
    }

    @Test
    void mergeFillsEmptyFieldsAndFlagsConflicts() {
        ReleaseFieldValues proposed = new ReleaseFieldValues(
                "Super Mario Bros.", "Super Mario Brothers", "1985-09-13", "Platform",
                "1-2", "Plumbers save a princess.", null, null);

        int conflicts = detector.mergeReleaseFields(RELEASE_ID, "no-intro", proposed, "screenscraper");

        assertEquals(1, conflicts);
        Release merged = store.findRelease(RELEASE_ID).orElseThrow();
        assertEquals("1985-10-18", merged.releaseDate());
        assertEquals("Super Mario Brothers", merged.altTitle());
        assertEquals("1-2", merged.players());
        assertEquals("Plumbers save a princess.", merged.description());
        assertNull(merged.gameSerial());

        Disagreement row = store.unresolvedDisagreements().get(0);
        assertEquals("release_date", row.field());
        assertEquals("1985-09-13", row.valueB());
    }

    @Test
    void mergingSameValuesTwiceAddsNothing() {
        ReleaseFieldValues proposed = new ReleaseFieldValues(
                null, null, "1985-10-18", "Platform", null, null, null, null);

        assertEquals(0, detector.mergeReleaseFields(RELEASE_ID, "no-intro", proposed, "screenscraper"));
        assertEquals(0, detector.mergeReleaseFields(RELEASE_ID, "no-intro", proposed, "screenscraper"));
        assertTrue(store.disagreements().isEmpty());
    }

    @Test
    void mergeIntoMissingReleaseFails() {
        ReleaseFieldValues proposed = new ReleaseFieldValues(
                "X", null, null, null, null, null, null, null);

        assertThrows(EntityNotFoundException.class,
                () -> detector.mergeReleaseFields("nes:nothing:usa", "a", proposed, "b"));
    }
}
