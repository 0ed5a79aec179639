package com.largomodo.romcatalog.repair;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class HeaderSkipRuleTest {

    @TempDir
    Path tempDir;

    @Test
    void inesHeaderIsSixteenBytes() {
        byte[] head = {'N', 'E', 'S', 0x1A, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0};

        assertEquals(16, HeaderSkipRule.INES.deriveHeaderSkip(head, 40976));
        assertEquals(0, HeaderSkipRule.INES.deriveHeaderSkip(new byte[16], 40960));
    }

    @Test
    void snesCopierHeaderDependsOnSize() {
        assertEquals(512, HeaderSkipRule.SNES_COPIER.deriveHeaderSkip(new byte[16], 1024 * 1024 + 512));
        assertEquals(0, HeaderSkipRule.SNES_COPIER.deriveHeaderSkip(new byte[16], 1024 * 1024));
    }

    @Test
    void lynxHeaderIsSixtyFourBytes() {
        byte[] head = "LYNX\0\0\0\0\0\0\0\0\0\0\0\0".getBytes(StandardCharsets.US_ASCII);

        assertEquals(64, HeaderSkipRule.LYNX.deriveHeaderSkip(head, 256 * 1024 + 64));
    }

    @Test
    void noneNeverSkips() {
        assertEquals(0, HeaderSkipRule.NONE.deriveHeaderSkip("NES\u001A".getBytes(StandardCharsets.ISO_8859_1), 100));
    }

    @Test
    void fileShorterThanHeaderIsNotSkipped() throws IOException {
        Path tiny = Files.write(tempDir.resolve("tiny.nes"), new byte[]{'N', 'E', 'S', 0x1A});

        assertEquals(0, HeaderSkipRule.headerSkipOf(tiny, HeaderSkipRule.INES));
    }

    @Test
    void customRuleIsClampedToFileSize() throws IOException {
        Path tiny = Files.write(tempDir.resolve("tiny.bin"), new byte[4]);

        assertEquals(4, HeaderSkipRule.headerSkipOf(tiny, (head, size) -> 100));
        assertEquals(0, HeaderSkipRule.headerSkipOf(tiny, (head, size) -> -8));
    }

    @ParameterizedTest
    @CsvSource({"none, NONE", "ines, INES", "snes-copier, SNES_COPIER", "LYNX, LYNX", "Snes_Copier, SNES_COPIER"})
    void parsesCliNames(String arg, HeaderSkipRule expected) {
        assertEquals(expected, HeaderSkipRule.fromCliArgument(arg));
    }

    @Test
    void rejectsUnknownCliName() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> HeaderSkipRule.fromCliArgument("smd"));
        assertTrue(e.getMessage().contains("Supported"));
    }
}
