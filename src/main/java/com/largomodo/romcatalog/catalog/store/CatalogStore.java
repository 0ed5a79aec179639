package com.largomodo.romcatalog.catalog.store;

import com.largomodo.romcatalog.catalog.CatalogStats;
import com.largomodo.romcatalog.catalog.Company;
import com.largomodo.romcatalog.catalog.Disagreement;
import com.largomodo.romcatalog.catalog.FieldOverride;
import com.largomodo.romcatalog.catalog.ImportLog;
import com.largomodo.romcatalog.catalog.Media;
import com.largomodo.romcatalog.catalog.Platform;
import com.largomodo.romcatalog.catalog.Release;
import com.largomodo.romcatalog.catalog.Work;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Persistence seam for the catalog.
 * <p>
 * <b>Contract Guarantees:</b>
 * <ul>
 *   <li>Upserts replace the row with the same id, or insert it</li>
 *   <li>Releases must reference an existing work and platform, media an existing release;
 *       violations throw {@link com.largomodo.romcatalog.catalog.ReferentialIntegrityException}
 *       and leave every row untouched</li>
 *   <li>Rows with dependants cannot be deleted (works with releases, releases with media)</li>
 *   <li>Disagreements are only ever marked resolved, never deleted</li>
 *   <li>Import log rows are append-only</li>
 * </ul>
 * <p>
 * <b>Transactions:</b> {@link #inTransaction(Supplier)} is all-or-nothing. A
 * {@link RuntimeException} thrown by the work restores every table to its state before the
 * call and is rethrown. Calls nested inside a running transaction join it.
 * <p>
 * Lookups return {@link Optional#empty()} or an empty list on a miss; they never throw.
 */
public interface CatalogStore {

    // Platforms

    void upsertPlatform(Platform platform);

    Optional<Platform> findPlatform(String id);

    List<Platform> platforms();

    // Companies

    void upsertCompany(Company company);

    Optional<Company> findCompany(String id);

    /**
     * Resolves a free-text publisher or developer to a company by name or alias, ignoring case.
     */
    Optional<Company> findCompanyByAlias(String text);

    List<Company> companies();

    // Works

    void upsertWork(Work work);

    Optional<Work> findWork(String id);

    List<Work> works();

    void deleteWork(String id);

    // Releases

    void upsertRelease(Release release);

    Optional<Release> findRelease(String id);

    Optional<Release> findRelease(String workId, String platformId, String region);

    List<Release> releasesForWork(String workId);

    List<Release> releasesForPlatform(String platformId);

    List<Release> releases();

    /**
     * Releases whose title contains the given text, ignoring case.
     */
    List<Release> searchReleases(String titleSubstring);

    void deleteRelease(String id);

    // Media

    void upsertMedia(Media media);

    Optional<Media> findMedia(String id);

    List<Media> mediaForRelease(String releaseId);

    List<Media> findMediaByCrc32(String crc32);

    List<Media> findMediaBySha1(String sha1);

    List<Media> findMediaByMd5(String md5);

    List<Media> findMediaBySerial(String serial);

    List<Media> findMediaByDatName(String datName);

    List<Media> media();

    void deleteMedia(String id);

    // Overrides

    /**
     * Adds the override unless an equal one is already stored.
     *
     * @return true if the override was added
     */
    boolean addOverride(FieldOverride override);

    List<FieldOverride> overrides();

    // Disagreements

    /**
     * Stores a new disagreement and returns it with its assigned id.
     */
    Disagreement addDisagreement(Disagreement disagreement);

    Optional<Disagreement> findDisagreement(long id);

    List<Disagreement> disagreements();

    List<Disagreement> unresolvedDisagreements();

    /**
     * Marks a disagreement resolved with the given resolution text.
     *
     * @throws com.largomodo.romcatalog.catalog.EntityNotFoundException if no disagreement has this id
     */
    Disagreement resolveDisagreement(long id, String resolution);

    /**
     * Moves every disagreement about {@code fromId} to {@code toId}.
     *
     * @return number of disagreements re-pointed
     */
    int repointDisagreements(String entityType, String fromId, String toId);

    // Import log

    ImportLog appendImportLog(ImportLog entry);

    List<ImportLog> importLogs();

    // Store-wide

    CatalogStats stats();

    int schemaVersion();

    /**
     * Detached copy of every row, used for persistence and for simulating changes.
     */
    CatalogSnapshot snapshot();

    <T> T inTransaction(Supplier<T> work);
}
