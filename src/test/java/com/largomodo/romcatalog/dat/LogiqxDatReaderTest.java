package com.largomodo.romcatalog.dat;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LogiqxDatReaderTest {

    private final LogiqxDatReader reader = new LogiqxDatReader();

    private DatFile readSample() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/dat/sample-nes.dat")) {
            assertNotNull(in, "sample DAT missing from test resources");
            return reader.read(in);
        }
    }

    @Test
    void readsHeader() throws IOException {
        DatFile dat = readSample();

        assertEquals("Nintendo - Nintendo Entertainment System (Headerless)", dat.name());
        assertEquals("20240101-000000", dat.version());
    }

    @Test
    void readsGamesAndSkipsNamelessOnes() throws IOException {
        DatFile dat = readSample();

        assertEquals(4, dat.games().size());
        DatGame smb = dat.games().get(0);
        assertEquals("Super Mario Bros. (World)", smb.name());
        assertEquals(1, smb.roms().size());
        DatRom rom = smb.roms().get(0);
        assertEquals(40960, rom.size());
        assertEquals("3337ec46", rom.crc(), "hashes are lower-cased");
        assertEquals("ea343f4e445a9050d4b4fbac2c77d0693b1d0922", rom.sha1());
    }

    @Test
    void flattensToReferenceRecords() throws IOException {
        List<ReferenceRecord> records = readSample().toReferenceRecords(SourceKind.CARTRIDGE);

        assertEquals(4, records.size());
        assertEquals("Super Mario Bros. (World)", records.get(0).title());
        assertEquals(40960L, records.get(0).expectedLength());
        assertEquals(SourceKind.CARTRIDGE, records.get(0).sourceKind());
    }

    @Test
    void multiRomGamesUseRomNamesAsTitles() throws IOException {
        String xml = "<datafile><header><name>Disc Set</name></header>"
                + "<game name=\"Game (USA)\">"
                + "<rom name=\"Game (USA) (Track 1).bin\" size=\"1000\" crc=\"00000001\"/>"
                + "<rom name=\"Game (USA) (Track 2).bin\" size=\"2000\" crc=\"00000002\"/>"
                + "</game></datafile>";

        List<ReferenceRecord> records = read(xml).toReferenceRecords(SourceKind.OPTICAL_DISC);

        assertEquals(List.of("Game (USA) (Track 1).bin", "Game (USA) (Track 2).bin"),
                records.stream().map(ReferenceRecord::title).toList());
    }

    @Test
    void romWithUnparseableSizeIsSkipped() throws IOException {
        String xml = "<datafile><game name=\"Game\">"
                + "<rom name=\"good.bin\" size=\"16\" crc=\"00000001\"/>"
                + "<rom name=\"bad.bin\" size=\"sixteen\" crc=\"00000002\"/>"
                + "<rom name=\"negative.bin\" size=\"-1\" crc=\"00000003\"/>"
                + "</game></datafile>";

        DatFile dat = read(xml);

        assertEquals(1, dat.games().get(0).roms().size());
        assertEquals("good.bin", dat.games().get(0).roms().get(0).name());
    }

    @Test
    void machineElementsAreGames() throws IOException {
        DatFile dat = read("<datafile><machine name=\"Arcade\"><rom name=\"a.rom\" size=\"4\" crc=\"0a\"/></machine></datafile>");

        assertEquals("Arcade", dat.games().get(0).name());
    }

    @Test
    void malformedXmlRaisesDatParseException() {
        assertThrows(DatParseException.class, () -> read("<datafile><game name=\"x\"><rom"));
    }

    private DatFile read(String xml) throws IOException {
        return reader.read(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    }
}
