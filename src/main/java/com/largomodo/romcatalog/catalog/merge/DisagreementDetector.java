package com.largomodo.romcatalog.catalog.merge;

import com.largomodo.romcatalog.catalog.Disagreement;
import com.largomodo.romcatalog.catalog.EntityNotFoundException;
import com.largomodo.romcatalog.catalog.Release;
import com.largomodo.romcatalog.catalog.store.CatalogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Combines facts from several sources without silently overwriting any of them.
 * <p>
 * The value already in the catalog keeps authority. A differing value from a later source is
 * recorded as an unresolved {@link Disagreement} for a human to settle; the catalog row is
 * not changed.
 */
public class DisagreementDetector {

    private static final Logger log = LoggerFactory.getLogger(DisagreementDetector.class);

    private final CatalogStore store;

    public DisagreementDetector(CatalogStore store) {
        this.store = store;
    }

    /**
     * Compares one field's existing value with a newly proposed one.
     * <p>
     * Nothing is recorded when either value is absent or empty, or when the two are equal.
     *
     * @return true if a disagreement row was inserted
     */
    public boolean checkField(String entityType,
                              String entityId,
                              String field,
                              String sourceA,
                              String existing,
                              String sourceB,
                              String proposed) {
        if (isEmpty(existing) || isEmpty(proposed) || existing.equals(proposed)) {
            return false;
        }
        Disagreement stored = store.addDisagreement(
                Disagreement.unresolved(entityType, entityId, field, sourceA, existing, sourceB, proposed));
        log.debug("Disagreement #{} on {} {}.{}: {}='{}' vs {}='{}'", stored.id(), entityType, entityId, field,
                sourceA, existing, sourceB, proposed);
        return true;
    }

    /**
     * Merges one source's proposed release fields into an existing release.
     * <p>
     * Fields the release does not have yet are filled in; fields it already has are only
     * compared. Runs as one transaction.
     *
     * @return number of fields that produced a disagreement
     * @throws EntityNotFoundException if the release does not exist
     */
    public int mergeReleaseFields(String releaseId,
                                  String existingSource,
                                  ReleaseFieldValues proposed,
                                  String newSource) {
        return store.inTransaction(() -> {
            Release release = store.findRelease(releaseId)
                    .orElseThrow(() -> new EntityNotFoundException("release", releaseId));

            int disagreements = 0;
            Release updated = release;
            for (Map.Entry<String, String> entry : proposed.byFieldName().entrySet()) {
                String field = entry.getKey();
                String value = entry.getValue();
                String current = release.field(field);
                if (isEmpty(current)) {
                    if (!isEmpty(value)) {
                        updated = updated.withField(field, value);
                    }
                } else if (checkField("release", releaseId, field, existingSource, current, newSource, value)) {
                    disagreements++;
                }
            }

            if (!updated.equals(release)) {
                store.upsertRelease(updated);
            }
            return disagreements;
        });
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
