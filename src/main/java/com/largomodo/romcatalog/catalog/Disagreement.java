package com.largomodo.romcatalog.catalog;

import java.time.Instant;

/**
 * Two sources' conflicting values for one field of one entity, awaiting a human decision.
 * <p>
 * {@code valueA} is the value already in the catalog; it stays authoritative until the
 * disagreement is resolved.
 */
public record Disagreement(long id,
                           String entityType,
                           String entityId,
                           String field,
                           String sourceA,
                           String valueA,
                           String sourceB,
                           String valueB,
                           boolean resolved,
                           String resolution,
                           Instant resolvedAt) {

    public static Disagreement unresolved(String entityType, String entityId, String field,
                                          String sourceA, String valueA, String sourceB, String valueB) {
        return new Disagreement(0, entityType, entityId, field, sourceA, valueA, sourceB, valueB,
                false, null, null);
    }

    public Disagreement withId(long newId) {
        return new Disagreement(newId, entityType, entityId, field, sourceA, valueA, sourceB, valueB,
                resolved, resolution, resolvedAt);
    }

    public Disagreement withEntityId(String newEntityId) {
        return new Disagreement(id, entityType, newEntityId, field, sourceA, valueA, sourceB, valueB,
                resolved, resolution, resolvedAt);
    }

    public Disagreement resolve(String text, Instant at) {
        return new Disagreement(id, entityType, entityId, field, sourceA, valueA, sourceB, valueB,
                true, text, at);
    }
}
