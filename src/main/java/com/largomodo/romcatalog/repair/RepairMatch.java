package com.largomodo.romcatalog.repair;

import com.largomodo.romcatalog.dat.FileHashes;
import com.largomodo.romcatalog.dat.ReferenceRecord;

/**
 * A padding hypothesis whose resulting hash is in the index.
 *
 * @param record   matched reference record
 * @param strategy the hypothesis that matched
 * @param hashes   hashes of the padded data
 */
public record RepairMatch(ReferenceRecord record, RepairStrategy strategy, FileHashes hashes) {

    public RepairMethod method() {
        return strategy.method();
    }

    public long bytesAdded() {
        return strategy.padding().totalAdded();
    }
}
