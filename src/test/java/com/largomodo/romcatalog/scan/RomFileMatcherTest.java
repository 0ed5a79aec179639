package com.largomodo.romcatalog.scan;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RomFileMatcherTest {

    @TempDir
    Path tempDir;

    @Test
    void recognisesKnownExtensionsIgnoringCase() throws IOException {
        assertTrue(RomFileMatcher.isRom(Files.createFile(tempDir.resolve("Metroid (USA).nes"))));
        assertTrue(RomFileMatcher.isRom(Files.createFile(tempDir.resolve("CHRONO.SFC"))));
        assertTrue(RomFileMatcher.isRom(Files.createFile(tempDir.resolve("track01.bin"))));
    }

    @Test
    void rejectsDescriptorsAndDirectories() throws IOException {
        assertFalse(RomFileMatcher.isRom(Files.createFile(tempDir.resolve("game.cue"))));
        assertFalse(RomFileMatcher.isRom(Files.createFile(tempDir.resolve("readme"))));
        assertFalse(RomFileMatcher.isRom(Files.createDirectory(tempDir.resolve("folder.nes"))));
        assertFalse(RomFileMatcher.isRom(tempDir.resolve("missing.nes")));
        assertFalse(RomFileMatcher.isRom(null));
    }

    @Test
    void findsRomsRecursivelyInSortedOrder() throws IOException {
        Path nested = Files.createDirectories(tempDir.resolve("nes/usa"));
        Path b = Files.createFile(nested.resolve("b.nes"));
        Path a = Files.createFile(tempDir.resolve("nes/a.nes"));
        Files.createFile(nested.resolve("notes.txt"));

        List<Path> roms = RomFileMatcher.findRoms(tempDir);

        assertEquals(List.of(a, b), roms);
    }

    @Test
    void singleFileRootIsReturnedDirectly() throws IOException {
        Path rom = Files.createFile(tempDir.resolve("single.gb"));
        Path text = Files.createFile(tempDir.resolve("single.txt"));

        assertEquals(List.of(rom), RomFileMatcher.findRoms(rom));
        assertTrue(RomFileMatcher.findRoms(text).isEmpty());
    }

    @Test
    void missingRootThrows() {
        assertThrows(IOException.class, () -> RomFileMatcher.findRoms(tempDir.resolve("absent")));
    }
}
