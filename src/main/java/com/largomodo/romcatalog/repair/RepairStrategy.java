package com.largomodo.romcatalog.repair;

/**
 * One padding hypothesis to test against the hash index.
 */
public record RepairStrategy(PaddingSpec padding, String description) {

    public RepairMethod method() {
        return RepairMethod.of(padding);
    }

    /**
     * Size of the data the hypothesis produces from a file of the given length.
     */
    public long targetLength(long actualLength) {
        return actualLength + padding.totalAdded();
    }
}
