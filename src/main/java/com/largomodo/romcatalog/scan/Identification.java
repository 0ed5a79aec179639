package com.largomodo.romcatalog.scan;

import com.largomodo.romcatalog.dat.FileHashes;
import com.largomodo.romcatalog.repair.RepairMatch;

import java.nio.file.Path;

/**
 * Result of identifying one file.
 *
 * @param file    the file examined
 * @param outcome what was found
 * @param hashes  hashes of the file as-is (after header skip)
 * @param mediaId catalog media id when matched against the catalog, else null
 * @param title   matched title, else null
 * @param repair  padding that makes the file match a reference, for {@link Outcome#NEEDS_REPAIR}
 */
public record Identification(Path file,
                             Outcome outcome,
                             FileHashes hashes,
                             String mediaId,
                             String title,
                             RepairMatch repair) {

    public enum Outcome {
        MATCHED,
        UNMATCHED,
        NEEDS_REPAIR
    }

    public static Identification matched(Path file, FileHashes hashes, String mediaId, String title) {
        return new Identification(file, Outcome.MATCHED, hashes, mediaId, title, null);
    }

    public static Identification unmatched(Path file, FileHashes hashes) {
        return new Identification(file, Outcome.UNMATCHED, hashes, null, null, null);
    }

    public static Identification needsRepair(Path file, FileHashes hashes, RepairMatch repair) {
        return new Identification(file, Outcome.NEEDS_REPAIR, hashes, null, repair.record().title(), repair);
    }
}
