package com.largomodo.romcatalog.catalog;

/**
 * Thrown when persisted catalog data carries a schema version this build cannot use.
 */
public class SchemaVersionException extends CatalogException {

    private final int expected;
    private final int found;

    public SchemaVersionException(int expected, int found) {
        super("Catalog schema version mismatch: expected " + expected + ", found " + found);
        this.expected = expected;
        this.found = found;
    }

    public int getExpected() {
        return expected;
    }

    public int getFound() {
        return found;
    }
}
