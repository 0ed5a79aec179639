package com.largomodo.romcatalog.scan;

import com.largomodo.romcatalog.catalog.Media;
import com.largomodo.romcatalog.catalog.Release;
import com.largomodo.romcatalog.catalog.store.CatalogStore;
import com.largomodo.romcatalog.dat.FileHashes;
import com.largomodo.romcatalog.dat.HashIndex;
import com.largomodo.romcatalog.dat.ReferenceRecord;
import com.largomodo.romcatalog.dat.SourceKind;
import com.largomodo.romcatalog.repair.HeaderSkip;
import com.largomodo.romcatalog.repair.PaddedHasher;
import com.largomodo.romcatalog.repair.PaddingSpec;
import com.largomodo.romcatalog.repair.RepairEngine;
import com.largomodo.romcatalog.repair.RepairMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Identifies a single file.
 * <p>
 * Lookup order:
 * <ol>
 *   <li>catalog media by SHA-1</li>
 *   <li>catalog media by CRC32, when the stored size agrees</li>
 *   <li>the reference {@link HashIndex}</li>
 *   <li>padding repair hypotheses against the index</li>
 * </ol>
 * Stateless apart from its collaborators, which are all safe for concurrent readers, so one
 * instance serves every worker of a batch.
 */
public class FileIdentifier {

    private static final Logger log = LoggerFactory.getLogger(FileIdentifier.class);

    private final CatalogStore catalog;
    private final HashIndex index;
    private final SourceKind sourceKind;
    private final HeaderSkip headerSkip;
    private final PaddedHasher hasher;
    private final RepairEngine repairEngine;

    public FileIdentifier(CatalogStore catalog,
                          HashIndex index,
                          SourceKind sourceKind,
                          HeaderSkip headerSkip,
                          PaddedHasher hasher) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.index = Objects.requireNonNull(index, "index");
        this.sourceKind = Objects.requireNonNull(sourceKind, "sourceKind");
        this.headerSkip = Objects.requireNonNull(headerSkip, "headerSkip");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.repairEngine = new RepairEngine(hasher);
    }

    /**
     * @throws IOException if the file cannot be read
     */
    public Identification identify(Path file) throws IOException {
        FileHashes hashes = hasher.hash(file, headerSkip, PaddingSpec.NONE);

        Optional<Media> media = catalog.findMediaBySha1(hashes.sha1()).stream().findFirst();
        if (media.isEmpty()) {
            media = catalog.findMediaByCrc32(hashes.crc32()).stream()
                    .filter(m -> m.fileSize() == null || m.fileSize() == hashes.dataSize())
                    .findFirst();
        }
        if (media.isPresent()) {
            String title = catalog.findRelease(media.get().releaseId())
                    .map(Release::title)
                    .orElse(media.get().datName());
            log.debug("{} matched catalog media {}", file.getFileName(), media.get().id());
            return Identification.matched(file, hashes, media.get().id(), title);
        }

        Optional<ReferenceRecord> reference = index.match(hashes);
        if (reference.isPresent()) {
            log.debug("{} matched reference '{}'", file.getFileName(), reference.get().title());
            return Identification.matched(file, hashes, null, reference.get().title());
        }

        Optional<RepairMatch> repair = repairEngine.tryRepair(file, index, sourceKind, headerSkip, null);
        if (repair.isPresent()) {
            return Identification.needsRepair(file, hashes, repair.get());
        }

        log.debug("{} is unknown (crc32 {}, {} bytes)", file.getFileName(), hashes.crc32(), hashes.dataSize());
        return Identification.unmatched(file, hashes);
    }
}
