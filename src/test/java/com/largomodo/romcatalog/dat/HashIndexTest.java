package com.largomodo.romcatalog.dat;

import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class HashIndexTest {

    private static ReferenceRecord record(String title, String crc, String sha1, String serial, Long length) {
        return new ReferenceRecord(title, crc, sha1, serial, length, SourceKind.CARTRIDGE);
    }

    @Property
    void primaryLookupIgnoresCase(@ForAll("hexHashes") String hash) {
        HashIndex index = new HashIndex(List.of(ReferenceRecord.of("Game", hash.toUpperCase(Locale.ROOT), null)));

        assertEquals("Game", index.findByPrimaryHash(hash.toLowerCase(Locale.ROOT)).orElseThrow().title());
        assertEquals("Game", index.findByPrimaryHash(hash.toUpperCase(Locale.ROOT)).orElseThrow().title());
    }

    @Property
    void secondaryLookupIgnoresCase(@ForAll("hexHashes") String hash) {
        HashIndex index = new HashIndex(List.of(ReferenceRecord.of("Game", null, hash.toLowerCase(Locale.ROOT))));

        assertTrue(index.findBySecondaryHash(hash.toUpperCase(Locale.ROOT)).isPresent());
    }

    @Provide
    Arbitrary<String> hexHashes() {
        return Arbitraries.strings().withChars("0123456789abcdefABCDEF").ofMinLength(8).ofMaxLength(40);
    }

    @Test
    void firstInsertedRecordWinsOnDuplicateKeys() {
        HashIndex index = new HashIndex(List.of(
                ReferenceRecord.of("First", "abcd1234", "sha-a"),
                ReferenceRecord.of("Second", "ABCD1234", "sha-b")));

        assertEquals("First", index.findByPrimaryHash("abcd1234").orElseThrow().title());
        assertEquals("Second", index.findBySecondaryHash("sha-b").orElseThrow().title());
        assertEquals(2, index.recordCount());
        assertEquals(1, index.primaryHashCount());
        assertEquals(2, index.secondaryHashCount());
    }

    @Test
    void serialLookupIgnoresCaseAndSpaces() {
        HashIndex index = new HashIndex(List.of(record("Disc Game", null, null, "SLUS-00123", null)));

        assertTrue(index.findBySerial("slus-00123").isPresent());
        assertTrue(index.findBySerial("SLUS -00123").isPresent());
        assertFalse(index.findBySerial("SLUS00123").isPresent());
        assertEquals(1, index.serialCount());
    }

    @Test
    void missesAreEmpty() {
        HashIndex index = new HashIndex(List.of(ReferenceRecord.of("Game", "abcd1234", null)));

        assertTrue(index.findByPrimaryHash("ffffffff").isEmpty());
        assertTrue(index.findByPrimaryHash(null).isEmpty());
        assertTrue(index.findBySecondaryHash("").isEmpty());
        assertTrue(index.findBySerial(null).isEmpty());
    }

    @Test
    void matchFallsBackToSecondaryWhenPrimaryLengthDisagrees() {
        HashIndex index = new HashIndex(List.of(
                record("Short", "abcd1234", "1111", null, 100L),
                record("Long", "ffff0000", "2222", null, 200L)));

        FileHashes wrongSize = new FileHashes("abcd1234", "2222", null, 150);
        assertEquals("Long", index.match(wrongSize).orElseThrow().title());

        FileHashes rightSize = new FileHashes("abcd1234", "9999", null, 100);
        assertEquals("Short", index.match(rightSize).orElseThrow().title());
    }

    @Test
    void lengthPrefilter() {
        HashIndex known = new HashIndex(List.of(record("A", "01", null, null, 1024L)));
        assertTrue(known.mayHaveLength(1024));
        assertFalse(known.mayHaveLength(2048));

        HashIndex partlyUnknown = new HashIndex(List.of(
                record("A", "01", null, null, 1024L),
                record("B", "02", null, null, null)));
        assertTrue(partlyUnknown.mayHaveLength(2048));
    }

    @Property
    void everyInsertedCrcIsFound(@ForAll @IntRange(min = 0, max = 200) int count) {
        List<ReferenceRecord> records = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            records.add(ReferenceRecord.of("T" + i, String.format("%08x", i), null));
        }
        HashIndex index = new HashIndex(records);

        assertEquals(count, index.primaryHashCount());
        for (int i = 0; i < count; i++) {
            assertEquals("T" + i, index.findByPrimaryHash(String.format("%08X", i)).orElseThrow().title());
        }
    }
}
