package com.largomodo.romcatalog.catalog.merge;

import com.largomodo.romcatalog.catalog.FieldOverride;
import com.largomodo.romcatalog.catalog.Media;
import com.largomodo.romcatalog.catalog.Release;
import com.largomodo.romcatalog.catalog.store.CatalogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Writes curated corrections onto imported releases and media.
 * <p>
 * Pattern overrides match media by dat name (optionally within one platform) and target
 * either the media or its release. Overrides with an entity id target that entity directly.
 * Only a fixed set of descriptive fields may be overridden; anything else is skipped with a
 * warning.
 */
public class OverrideApplier {

    private static final Logger log = LoggerFactory.getLogger(OverrideApplier.class);

    static final Set<String> WRITABLE_FIELDS = Set.of(
            "title", "alt_title", "release_date", "game_serial", "genre", "players", "description",
            "media_serial", "revision", "status");

    private final CatalogStore store;

    public OverrideApplier(CatalogStore store) {
        this.store = store;
    }

    /**
     * @return number of entity updates made
     */
    public int apply(List<FieldOverride> overrides) {
        return store.inTransaction(() -> {
            int applied = 0;
            for (FieldOverride override : overrides) {
                if (override.datNamePattern() != null) {
                    applied += applyPattern(override);
                }
                if (override.entityId() != null && applyTo(override, override.entityId())) {
                    applied++;
                }
            }
            log.info("Applied {} override(s) from {} definition(s)", applied, overrides.size());
            return applied;
        });
    }

    private int applyPattern(FieldOverride override) {
        GlobPattern pattern = GlobPattern.compile(override.datNamePattern());
        int applied = 0;
        for (Media media : store.media()) {
            if (!pattern.matches(media.datName())) {
                continue;
            }
            Optional<Release> release = store.findRelease(media.releaseId());
            if (release.isEmpty()) {
                continue;
            }
            if (override.platformId() != null && !override.platformId().equals(release.get().platformId())) {
                continue;
            }
            String target = "media".equals(override.entityType()) ? media.id() : release.get().id();
            if (applyTo(override, target)) {
                applied++;
            }
        }
        if (applied == 0) {
            log.debug("Override pattern '{}' matched nothing", pattern);
        }
        return applied;
    }

    private boolean applyTo(FieldOverride override, String entityId) {
        if (!WRITABLE_FIELDS.contains(override.field())) {
            log.warn("Skipping override for unsafe field '{}' on {} {}", override.field(),
                    override.entityType(), entityId);
            return false;
        }
        switch (override.entityType()) {
            case "release": {
                Optional<Release> release = store.findRelease(entityId);
                if (release.isEmpty()) {
                    log.warn("Override target release {} not found", entityId);
                    return false;
                }
                if (!Release.TEXT_FIELDS.contains(override.field())) {
                    log.warn("Field '{}' does not exist on releases, skipping", override.field());
                    return false;
                }
                store.upsertRelease(release.get().withField(override.field(), override.value()));
                return true;
            }
            case "media": {
                Optional<Media> media = store.findMedia(entityId);
                if (media.isEmpty()) {
                    log.warn("Override target media {} not found", entityId);
                    return false;
                }
                if (!Media.TEXT_FIELDS.contains(override.field())) {
                    log.warn("Field '{}' does not exist on media, skipping", override.field());
                    return false;
                }
                store.upsertMedia(media.get().withField(override.field(), override.value()));
                return true;
            }
            default:
                log.warn("Skipping override for unknown entity type '{}'", override.entityType());
                return false;
        }
    }
}
