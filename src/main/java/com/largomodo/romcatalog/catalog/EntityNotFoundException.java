package com.largomodo.romcatalog.catalog;

/**
 * Thrown when an operation targets an entity id that is not in the catalog.
 */
public class EntityNotFoundException extends CatalogException {

    public EntityNotFoundException(String entityType, String id) {
        super("Entity not found: " + entityType + " with id '" + id + "'");
    }
}
