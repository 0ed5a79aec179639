package com.largomodo.romcatalog.repair;

import com.largomodo.romcatalog.dat.SourceKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RepairStrategyPlannerTest {

    private static final long MB = 1024 * 1024;

    @Test
    void cartridgeShortOfExpectedSizeGetsTwoAppendHypotheses() {
        List<RepairStrategy> strategies = RepairStrategyPlanner.buildStrategies(2 * MB, 4 * MB, SourceKind.CARTRIDGE);

        assertEquals(2, strategies.size());
        assertEquals(PaddingSpec.append(2 * MB, 0x00), strategies.get(0).padding());
        assertEquals(PaddingSpec.append(2 * MB, 0xFF), strategies.get(1).padding());
        assertEquals("append 2 MB of 0x00", strategies.get(0).method().description());
        assertEquals("append 2 MB of 0xFF", strategies.get(1).method().description());
    }

    @Test
    void discShortOfExpectedSizeAlsoTriesPregap() {
        List<RepairStrategy> strategies =
                RepairStrategyPlanner.buildStrategies(600 * MB, 650 * MB, SourceKind.OPTICAL_DISC);

        assertEquals(3, strategies.size());
        assertEquals(50 * MB, strategies.get(0).padding().appendSize());
        assertEquals(50 * MB, strategies.get(1).padding().appendSize());
        PaddingSpec pregap = strategies.get(2).padding();
        assertEquals(RepairStrategyPlanner.CD_PREGAP_SIZE, pregap.prependSize());
        assertEquals(0, pregap.appendSize());
        assertEquals(0x00, pregap.fillValue());
        assertEquals("prepend 352800 bytes of 0x00", strategies.get(2).method().description());
    }

    @Test
    void powerOfTwoCartridgeWithoutExpectedSizeHasNoHypotheses() {
        assertTrue(RepairStrategyPlanner.buildStrategies(4 * MB, null, SourceKind.CARTRIDGE).isEmpty());
    }

    @Test
    void oddSizedCartridgeIsPaddedToNextPowerOfTwo() {
        List<RepairStrategy> strategies = RepairStrategyPlanner.buildStrategies(3 * MB, null, SourceKind.CARTRIDGE);

        assertEquals(2, strategies.size());
        assertEquals(MB, strategies.get(0).padding().appendSize());
        assertEquals(4 * MB, strategies.get(0).targetLength(3 * MB));
        assertTrue(strategies.get(0).description().contains("next power-of-2 (4 MB)"));
    }

    @Test
    void discWithoutExpectedSizeOnlyTriesPregap() {
        List<RepairStrategy> strategies = RepairStrategyPlanner.buildStrategies(3 * MB, null, SourceKind.OPTICAL_DISC);

        assertEquals(1, strategies.size());
        assertEquals(RepairStrategyPlanner.CD_PREGAP_SIZE, strategies.get(0).padding().prependSize());
    }

    @Test
    void expectedSizeNotLargerMeansNoAppend() {
        assertTrue(RepairStrategyPlanner.buildStrategies(4 * MB, 4 * MB, SourceKind.CARTRIDGE).isEmpty());
        assertTrue(RepairStrategyPlanner.buildStrategies(4 * MB, 2 * MB, SourceKind.CARTRIDGE).isEmpty());
    }

    @ParameterizedTest
    @CsvSource({"1, 1", "2, 2", "3, 4", "1000, 1024", "1025, 2048", "0, 1"})
    void nextPowerOfTwo(long n, long expected) {
        assertEquals(expected, RepairStrategyPlanner.nextPowerOfTwo(n));
    }

    @ParameterizedTest
    @CsvSource({
            "1048576, 1 MB",
            "3145728, 3 MB",
            "2048, 2 KB",
            "352800, 352800 bytes",
            "1536, 1536 bytes",
            "100, 100 bytes"
    })
    void formatBytes(long bytes, String expected) {
        assertEquals(expected, RepairMethod.formatBytes(bytes));
    }
}
