package com.largomodo.romcatalog.catalog.store;

import com.largomodo.romcatalog.catalog.CatalogException;
import com.largomodo.romcatalog.catalog.CatalogSchema;
import com.largomodo.romcatalog.catalog.CatalogStats;
import com.largomodo.romcatalog.catalog.Company;
import com.largomodo.romcatalog.catalog.Disagreement;
import com.largomodo.romcatalog.catalog.EntityNotFoundException;
import com.largomodo.romcatalog.catalog.FieldOverride;
import com.largomodo.romcatalog.catalog.ImportLog;
import com.largomodo.romcatalog.catalog.Media;
import com.largomodo.romcatalog.catalog.Platform;
import com.largomodo.romcatalog.catalog.ReferentialIntegrityException;
import com.largomodo.romcatalog.catalog.Release;
import com.largomodo.romcatalog.catalog.Work;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link CatalogStore} kept entirely in memory.
 * <p>
 * Tables are insertion-ordered maps guarded by one {@link ReentrantLock}, so all access is
 * serialised. A transaction copies the table maps up front (rows are immutable records, so
 * a shallow copy is a full snapshot) and puts the copies back if the work throws.
 */
public class InMemoryCatalogStore implements CatalogStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCatalogStore.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;

    private Tables tables;

    public InMemoryCatalogStore() {
        this(CatalogSnapshot.empty(), Clock.systemUTC());
    }

    public InMemoryCatalogStore(CatalogSnapshot snapshot) {
        this(snapshot, Clock.systemUTC());
    }

    public InMemoryCatalogStore(CatalogSnapshot snapshot, Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.tables = Tables.from(Objects.requireNonNull(snapshot, "snapshot"));
    }

    // Platforms

    @Override
    public void upsertPlatform(Platform platform) {
        withLock(() -> tables.platforms.put(platform.id(), platform));
    }

    @Override
    public Optional<Platform> findPlatform(String id) {
        return locked(() -> Optional.ofNullable(tables.platforms.get(id)));
    }

    @Override
    public List<Platform> platforms() {
        return locked(() -> List.copyOf(tables.platforms.values()));
    }

    // Companies

    @Override
    public void upsertCompany(Company company) {
        withLock(() -> tables.companies.put(company.id(), company));
    }

    @Override
    public Optional<Company> findCompany(String id) {
        return locked(() -> Optional.ofNullable(tables.companies.get(id)));
    }

    @Override
    public Optional<Company> findCompanyByAlias(String text) {
        return locked(() -> tables.companies.values().stream().filter(c -> c.answersTo(text)).findFirst());
    }

    @Override
    public List<Company> companies() {
        return locked(() -> List.copyOf(tables.companies.values()));
    }

    // Works

    @Override
    public void upsertWork(Work work) {
        withLock(() -> tables.works.put(work.id(), work));
    }

    @Override
    public Optional<Work> findWork(String id) {
        return locked(() -> Optional.ofNullable(tables.works.get(id)));
    }

    @Override
    public List<Work> works() {
        return locked(() -> List.copyOf(tables.works.values()));
    }

    @Override
    public void deleteWork(String id) {
        withLock(() -> {
            if (!tables.works.containsKey(id)) {
                throw new EntityNotFoundException("work", id);
            }
            if (tables.releases.values().stream().anyMatch(r -> r.workId().equals(id))) {
                throw new CatalogException("Cannot delete work '" + id + "': releases still attached");
            }
            tables.works.remove(id);
        });
    }

    // Releases

    @Override
    public void upsertRelease(Release release) {
        withLock(() -> {
            if (!tables.works.containsKey(release.workId())) {
                throw new ReferentialIntegrityException("release", release.id(), "work", release.workId());
            }
            if (!tables.platforms.containsKey(release.platformId())) {
                throw new ReferentialIntegrityException("release", release.id(), "platform", release.platformId());
            }
            tables.releases.put(release.id(), release);
        });
    }

    @Override
    public Optional<Release> findRelease(String id) {
        return locked(() -> Optional.ofNullable(tables.releases.get(id)));
    }

    @Override
    public Optional<Release> findRelease(String workId, String platformId, String region) {
        return locked(() -> tables.releases.values().stream()
                .filter(r -> r.workId().equals(workId)
                        && r.platformId().equals(platformId)
                        && r.region().equals(region))
                .findFirst());
    }

    @Override
    public List<Release> releasesForWork(String workId) {
        return filterReleases(r -> r.workId().equals(workId));
    }

    @Override
    public List<Release> releasesForPlatform(String platformId) {
        return filterReleases(r -> r.platformId().equals(platformId));
    }

    @Override
    public List<Release> releases() {
        return locked(() -> List.copyOf(tables.releases.values()));
    }

    @Override
    public List<Release> searchReleases(String titleSubstring) {
        String needle = titleSubstring.toLowerCase(Locale.ROOT);
        return filterReleases(r -> r.title().toLowerCase(Locale.ROOT).contains(needle));
    }

    @Override
    public void deleteRelease(String id) {
        withLock(() -> {
            if (!tables.releases.containsKey(id)) {
                throw new EntityNotFoundException("release", id);
            }
            if (tables.media.values().stream().anyMatch(m -> m.releaseId().equals(id))) {
                throw new CatalogException("Cannot delete release '" + id + "': media still attached");
            }
            tables.releases.remove(id);
        });
    }

    // Media

    @Override
    public void upsertMedia(Media media) {
        withLock(() -> {
            if (!tables.releases.containsKey(media.releaseId())) {
                throw new ReferentialIntegrityException("media", media.id(), "release", media.releaseId());
            }
            tables.media.put(media.id(), media);
        });
    }

    @Override
    public Optional<Media> findMedia(String id) {
        return locked(() -> Optional.ofNullable(tables.media.get(id)));
    }

    @Override
    public List<Media> mediaForRelease(String releaseId) {
        return filterMedia(m -> m.releaseId().equals(releaseId));
    }

    @Override
    public List<Media> findMediaByCrc32(String crc32) {
        return filterMedia(m -> m.crc32() != null && m.crc32().equalsIgnoreCase(crc32));
    }

    @Override
    public List<Media> findMediaBySha1(String sha1) {
        return filterMedia(m -> m.sha1() != null && m.sha1().equalsIgnoreCase(sha1));
    }

    @Override
    public List<Media> findMediaByMd5(String md5) {
        return filterMedia(m -> m.md5() != null && m.md5().equalsIgnoreCase(md5));
    }

    @Override
    public List<Media> findMediaBySerial(String serial) {
        return filterMedia(m -> m.mediaSerial() != null && m.mediaSerial().equalsIgnoreCase(serial));
    }

    @Override
    public List<Media> findMediaByDatName(String datName) {
        return filterMedia(m -> Objects.equals(m.datName(), datName));
    }

    @Override
    public List<Media> media() {
        return locked(() -> List.copyOf(tables.media.values()));
    }

    @Override
    public void deleteMedia(String id) {
        withLock(() -> {
            if (tables.media.remove(id) == null) {
                throw new EntityNotFoundException("media", id);
            }
        });
    }

    // Overrides

    @Override
    public boolean addOverride(FieldOverride override) {
        return locked(() -> {
            if (tables.overrides.contains(override)) {
                return false;
            }
            tables.overrides.add(override);
            return true;
        });
    }

    @Override
    public List<FieldOverride> overrides() {
        return locked(() -> List.copyOf(tables.overrides));
    }

    // Disagreements

    @Override
    public Disagreement addDisagreement(Disagreement disagreement) {
        return locked(() -> {
            Disagreement stored = disagreement.withId(tables.nextDisagreementId++);
            tables.disagreements.put(stored.id(), stored);
            return stored;
        });
    }

    @Override
    public Optional<Disagreement> findDisagreement(long id) {
        return locked(() -> Optional.ofNullable(tables.disagreements.get(id)));
    }

    @Override
    public List<Disagreement> disagreements() {
        return locked(() -> List.copyOf(tables.disagreements.values()));
    }

    @Override
    public List<Disagreement> unresolvedDisagreements() {
        return locked(() -> tables.disagreements.values().stream()
                .filter(d -> !d.resolved())
                .collect(Collectors.toList()));
    }

    @Override
    public Disagreement resolveDisagreement(long id, String resolution) {
        return locked(() -> {
            Disagreement existing = tables.disagreements.get(id);
            if (existing == null) {
                throw new EntityNotFoundException("disagreement", String.valueOf(id));
            }
            Disagreement resolved = existing.resolve(resolution, clock.instant());
            tables.disagreements.put(id, resolved);
            return resolved;
        });
    }

    @Override
    public int repointDisagreements(String entityType, String fromId, String toId) {
        return locked(() -> {
            int moved = 0;
            for (Map.Entry<Long, Disagreement> entry : tables.disagreements.entrySet()) {
                Disagreement d = entry.getValue();
                if (d.entityType().equals(entityType) && d.entityId().equals(fromId)) {
                    entry.setValue(d.withEntityId(toId));
                    moved++;
                }
            }
            return moved;
        });
    }

    // Import log

    @Override
    public ImportLog appendImportLog(ImportLog entry) {
        return locked(() -> {
            ImportLog stored = entry.withId(tables.nextImportLogId++);
            tables.importLogs.add(stored);
            return stored;
        });
    }

    @Override
    public List<ImportLog> importLogs() {
        return locked(() -> List.copyOf(tables.importLogs));
    }

    // Store-wide

    @Override
    public CatalogStats stats() {
        return locked(() -> new CatalogStats(
                tables.platforms.size(),
                tables.companies.size(),
                tables.works.size(),
                tables.releases.size(),
                tables.media.size(),
                tables.overrides.size(),
                tables.disagreements.size(),
                (int) tables.disagreements.values().stream().filter(d -> !d.resolved()).count(),
                tables.importLogs.size()));
    }

    @Override
    public int schemaVersion() {
        return CatalogSchema.CURRENT_VERSION;
    }

    @Override
    public CatalogSnapshot snapshot() {
        return locked(() -> new CatalogSnapshot(
                CatalogSchema.CURRENT_VERSION,
                new ArrayList<>(tables.platforms.values()),
                new ArrayList<>(tables.companies.values()),
                new ArrayList<>(tables.works.values()),
                new ArrayList<>(tables.releases.values()),
                new ArrayList<>(tables.media.values()),
                tables.overrides,
                new ArrayList<>(tables.disagreements.values()),
                tables.importLogs));
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        lock.lock();
        try {
            if (lock.getHoldCount() > 1) {
                return work.get();
            }
            Tables saved = tables.copy();
            try {
                return work.get();
            } catch (RuntimeException e) {
                log.debug("Rolling back catalog transaction: {}", e.getMessage());
                tables = saved;
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    private List<Release> filterReleases(Predicate<Release> filter) {
        return locked(() -> tables.releases.values().stream().filter(filter).collect(Collectors.toList()));
    }

    private List<Media> filterMedia(Predicate<Media> filter) {
        return locked(() -> tables.media.values().stream().filter(filter).collect(Collectors.toList()));
    }

    private <T> T locked(Supplier<T> body) {
        lock.lock();
        try {
            return body.get();
        } finally {
            lock.unlock();
        }
    }

    private void withLock(Runnable body) {
        lock.lock();
        try {
            body.run();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Mutable table set. Only touched while holding {@link #lock}.
     */
    private static final class Tables {
        final Map<String, Platform> platforms = new LinkedHashMap<>();
        final Map<String, Company> companies = new LinkedHashMap<>();
        final Map<String, Work> works = new LinkedHashMap<>();
        final Map<String, Release> releases = new LinkedHashMap<>();
        final Map<String, Media> media = new LinkedHashMap<>();
        final List<FieldOverride> overrides = new ArrayList<>();
        final Map<Long, Disagreement> disagreements = new LinkedHashMap<>();
        final List<ImportLog> importLogs = new ArrayList<>();
        long nextDisagreementId = 1;
        long nextImportLogId = 1;

        static Tables from(CatalogSnapshot snapshot) {
            Tables t = new Tables();
            snapshot.platforms().forEach(p -> t.platforms.put(p.id(), p));
            snapshot.companies().forEach(c -> t.companies.put(c.id(), c));
            snapshot.works().forEach(w -> t.works.put(w.id(), w));
            snapshot.releases().forEach(r -> t.releases.put(r.id(), r));
            snapshot.media().forEach(m -> t.media.put(m.id(), m));
            t.overrides.addAll(snapshot.overrides());
            for (Disagreement d : snapshot.disagreements()) {
                t.disagreements.put(d.id(), d);
                t.nextDisagreementId = Math.max(t.nextDisagreementId, d.id() + 1);
            }
            for (ImportLog entry : snapshot.importLogs()) {
                t.importLogs.add(entry);
                t.nextImportLogId = Math.max(t.nextImportLogId, entry.id() + 1);
            }
            return t;
        }

        Tables copy() {
            Tables t = new Tables();
            t.platforms.putAll(platforms);
            t.companies.putAll(companies);
            t.works.putAll(works);
            t.releases.putAll(releases);
            t.media.putAll(media);
            t.overrides.addAll(overrides);
            t.disagreements.putAll(disagreements);
            t.importLogs.addAll(importLogs);
            t.nextDisagreementId = nextDisagreementId;
            t.nextImportLogId = nextImportLogId;
            return t;
        }
    }
}
