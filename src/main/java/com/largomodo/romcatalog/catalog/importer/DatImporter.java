package com.largomodo.romcatalog.catalog.importer;

import com.largomodo.romcatalog.catalog.ImportLog;
import com.largomodo.romcatalog.catalog.Media;
import com.largomodo.romcatalog.catalog.MediaStatus;
import com.largomodo.romcatalog.catalog.ReferentialIntegrityException;
import com.largomodo.romcatalog.catalog.Release;
import com.largomodo.romcatalog.catalog.Work;
import com.largomodo.romcatalog.catalog.store.CatalogStore;
import com.largomodo.romcatalog.dat.DatFile;
import com.largomodo.romcatalog.dat.DatGame;
import com.largomodo.romcatalog.dat.DatRom;
import com.largomodo.romcatalog.naming.DumpStatus;
import com.largomodo.romcatalog.naming.NameTagParser;
import com.largomodo.romcatalog.naming.ParsedName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns the games of a DAT file into catalog rows.
 * <p>
 * Each game name is parsed into a title and tags. The title becomes a {@link Work}
 * ({@code platform:title-slug}), the first region a {@link Release} of that work, and every ROM
 * of the game a {@link Media}. Ids are derived from names, so re-importing the same DAT finds
 * the rows it created before. Bad dumps are skipped.
 * <p>
 * The whole DAT is written in one store transaction and recorded in the import log.
 */
public class DatImporter {

    private static final Logger log = LoggerFactory.getLogger(DatImporter.class);

    static final String SOURCE_TYPE = "dat";

    private final CatalogStore store;
    private final Clock clock;

    public DatImporter(CatalogStore store) {
        this(store, Clock.systemUTC());
    }

    public DatImporter(CatalogStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * @param dat        parsed DAT
     * @param platformId catalog platform the DAT describes; must already exist
     * @param datSource  "no-intro" or "redump"
     * @param listener   progress callback
     * @throws ReferentialIntegrityException if the platform is not in the catalog
     */
    public ImportStats importDat(DatFile dat, String platformId, String datSource, ImportListener listener) {
        Objects.requireNonNull(listener, "listener");
        if (store.findPlatform(platformId).isEmpty()) {
            throw new ReferentialIntegrityException("dat", dat.name(), "platform", platformId);
        }

        ImportStats stats = store.inTransaction(() -> {
            Counters counters = new Counters();
            int total = dat.games().size();
            int current = 0;
            for (DatGame game : dat.games()) {
                importGame(game, platformId, datSource, counters);
                listener.onGame(++current, total, game.name());
            }
            ImportStats result = counters.toStats(total);
            store.appendImportLog(new ImportLog(0, SOURCE_TYPE, dat.name(), dat.version(), clock.instant(),
                    result.mediaCreated(), result.mediaUpdated(), result.mediaUnchanged(), 0));
            return result;
        });

        log.info("Imported {} ({} games): {} works, {} releases, {} media created, {} updated, {} unchanged, {} bad dumps skipped",
                dat.name(), stats.totalGames(), stats.worksCreated(), stats.releasesCreated(),
                stats.mediaCreated(), stats.mediaUpdated(), stats.mediaUnchanged(), stats.skippedBad());
        listener.onComplete(stats);
        return stats;
    }

    private void importGame(DatGame game, String platformId, String datSource, Counters counters) {
        ParsedName parsed = NameTagParser.parse(game.name());
        if (parsed.dumpStatus() == DumpStatus.BAD_DUMP) {
            counters.skippedBad++;
            return;
        }
        if (parsed.title().isEmpty()) {
            log.warn("Skipping DAT entry with empty title: {}", game.name());
            return;
        }

        String workId = Slugs.workId(platformId, parsed.title());
        if (store.findWork(workId).isPresent()) {
            counters.worksExisting++;
        } else {
            store.upsertWork(new Work(workId, parsed.title()));
            counters.worksCreated++;
        }

        String region = primaryRegionSlug(parsed, game);
        Optional<Release> existingRelease = store.findRelease(workId, platformId, region);
        String releaseId;
        if (existingRelease.isPresent()) {
            releaseId = existingRelease.get().id();
            counters.releasesExisting++;
        } else {
            releaseId = Slugs.releaseId(workId, platformId, region);
            store.upsertRelease(Release.of(releaseId, workId, platformId, region, parsed.title()));
            counters.releasesCreated++;
        }

        MediaStatus status = statusOf(parsed);
        for (DatRom rom : game.roms()) {
            String mediaId = Slugs.mediaId(releaseId, rom.name());
            Optional<Media> existing = store.findMedia(mediaId);
            if (existing.isPresent()) {
                if (sameDump(existing.get(), rom)) {
                    counters.mediaUnchanged++;
                    continue;
                }
                counters.mediaUpdated++;
            } else {
                counters.mediaCreated++;
            }
            store.upsertMedia(new Media(mediaId, releaseId, rom.serial(), parsed.discNumber(), parsed.discLabel(),
                    parsed.revision(), status, game.name(), datSource, rom.size(),
                    rom.crc(), rom.sha1(), rom.md5()));
        }
    }

    private static String primaryRegionSlug(ParsedName parsed, DatGame game) {
        if (!parsed.regions().isEmpty()) {
            return NameTagParser.regionToSlug(parsed.primaryRegion());
        }
        if (game.region() != null && !game.region().isBlank()) {
            return NameTagParser.regionToSlug(game.region());
        }
        return "unknown";
    }

    static MediaStatus statusOf(ParsedName parsed) {
        switch (parsed.dumpStatus()) {
            case BAD_DUMP:
                return MediaStatus.BAD;
            case OVERDUMP:
                return MediaStatus.OVERDUMP;
            default:
                if (parsed.hasFlag("Proto", "Prototype")) {
                    return MediaStatus.PROTOTYPE;
                }
                if (parsed.hasFlag("Beta")) {
                    return MediaStatus.BETA;
                }
                if (parsed.hasFlag("Sample")) {
                    return MediaStatus.SAMPLE;
                }
                return MediaStatus.VERIFIED;
        }
    }

    private static boolean sameDump(Media media, DatRom rom) {
        return Objects.equals(media.crc32(), rom.crc())
                && Objects.equals(media.sha1(), rom.sha1())
                && Objects.equals(media.fileSize(), rom.size());
    }

    private static final class Counters {
        int worksCreated;
        int worksExisting;
        int releasesCreated;
        int releasesExisting;
        int mediaCreated;
        int mediaUpdated;
        int mediaUnchanged;
        int skippedBad;

        ImportStats toStats(int totalGames) {
            return new ImportStats(totalGames, worksCreated, worksExisting, releasesCreated, releasesExisting,
                    mediaCreated, mediaUpdated, mediaUnchanged, skippedBad);
        }
    }
}
