package com.largomodo.romcatalog.repair;

import com.largomodo.romcatalog.dat.SourceKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Generates ordered padding hypotheses for a dump whose hash is not in the index.
 * <p>
 * Rules accumulate in this order:
 * <ol>
 *   <li>expected length known and larger than actual: append the difference with 0x00, then 0xFF</li>
 *   <li>optical disc: prepend a CD pregap of 0x00</li>
 *   <li>cartridge, no expected length, size not a power of two: append up to the next power
 *       of two with 0x00, then 0xFF</li>
 * </ol>
 * A cartridge dump that is already a power of two with no expected length yields nothing.
 */
public final class RepairStrategyPlanner {

    /** CD pregap: 2 seconds x 75 sectors/second x 2352 bytes/sector. */
    public static final long CD_PREGAP_SIZE = 352_800L;

    private RepairStrategyPlanner() {
        // Static utility class - prevent instantiation
    }

    /**
     * @param actualLength   current data length (after header skip)
     * @param expectedLength declared data length, or null when unknown
     * @param kind           cartridge-style or optical-disc-style source
     * @return hypotheses in the order they must be tried
     */
    public static List<RepairStrategy> buildStrategies(long actualLength, Long expectedLength, SourceKind kind) {
        if (actualLength < 0) {
            throw new IllegalArgumentException("actualLength must not be negative, got: " + actualLength);
        }
        List<RepairStrategy> strategies = new ArrayList<>();

        if (expectedLength != null && expectedLength > actualLength) {
            long diff = expectedLength - actualLength;
            strategies.add(appendStrategy(diff, 0x00, "to expected size"));
            strategies.add(appendStrategy(diff, 0xFF, "to expected size"));
        }

        if (kind == SourceKind.OPTICAL_DISC) {
            PaddingSpec pregap = PaddingSpec.prepend(CD_PREGAP_SIZE, 0x00);
            strategies.add(new RepairStrategy(pregap,
                    "prepend " + RepairMethod.formatBytes(CD_PREGAP_SIZE) + " CD pregap of 0x00"));
        }

        if (expectedLength == null && kind == SourceKind.CARTRIDGE && !isPowerOfTwo(actualLength)) {
            long target = nextPowerOfTwo(actualLength);
            long diff = target - actualLength;
            String suffix = "to next power-of-2 (" + RepairMethod.formatBytes(target) + ")";
            strategies.add(appendStrategy(diff, 0x00, suffix));
            strategies.add(appendStrategy(diff, 0xFF, suffix));
        }

        return strategies;
    }

    private static RepairStrategy appendStrategy(long size, int fill, String suffix) {
        PaddingSpec padding = PaddingSpec.append(size, fill);
        return new RepairStrategy(padding, padding.fillValue() == 0
                ? "append " + RepairMethod.formatBytes(size) + " of 0x00 " + suffix
                : "append " + RepairMethod.formatBytes(size) + " of 0xFF " + suffix);
    }

    static boolean isPowerOfTwo(long n) {
        return n > 0 && (n & (n - 1)) == 0;
    }

    static long nextPowerOfTwo(long n) {
        if (n <= 1) {
            return 1;
        }
        return Long.highestOneBit(n - 1) << 1;
    }
}
