package com.largomodo.romcatalog.catalog;

/**
 * Thrown when a write references a row that does not exist (a release pointing at a
 * missing work or platform, media pointing at a missing release). The offending write is
 * rejected; no other row is touched.
 */
public class ReferentialIntegrityException extends CatalogException {

    public ReferentialIntegrityException(String entityType, String id, String missingType, String missingId) {
        super(entityType + " '" + id + "' references missing " + missingType + " '" + missingId + "'");
    }
}
