package com.largomodo.romcatalog.catalog.reconcile;

import com.largomodo.romcatalog.catalog.Media;
import com.largomodo.romcatalog.catalog.Release;
import com.largomodo.romcatalog.catalog.Work;
import com.largomodo.romcatalog.catalog.store.CatalogStore;
import com.largomodo.romcatalog.catalog.store.InMemoryCatalogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Collapses works that are the same game imported under slightly different names.
 * <p>
 * Releases are grouped by platform and {@link TitleNormalizer#key normalised work name}. Every
 * group that spans more than one work is folded into a single survivor: the work with the most
 * releases, ties going to the lowest id. Each group is applied in its own store transaction.
 * <p>
 * A dry run executes the same steps against a detached copy of the catalog, so its statistics
 * are exactly those of a real run while the store itself is left untouched.
 */
public class WorkReconciler {

    private static final Logger log = LoggerFactory.getLogger(WorkReconciler.class);

    private final CatalogStore store;

    public WorkReconciler(CatalogStore store) {
        this.store = store;
    }

    public ReconcileResult reconcile(ReconcileOptions options) {
        CatalogStore target = options.dryRun() ? new InMemoryCatalogStore(store.snapshot()) : store;

        List<Group> groups = findDuplicateGroups(target, options);
        Counters counters = new Counters();
        counters.groupsFound = groups.size();
        List<MergeDetail> details = new ArrayList<>();

        for (Group group : groups) {
            Optional<MergeDetail> detail = target.inTransaction(() -> reconcileGroup(target, group, counters));
            detail.ifPresent(details::add);
        }

        ReconcileStats stats = counters.toStats();
        log.info("{}Reconciled {} group(s): {} work(s) merged, {} release(s) reassigned, {} release(s) merged, {} media moved",
                options.dryRun() ? "[dry run] " : "", stats.groupsFound(), stats.worksMerged(),
                stats.releasesReassigned(), stats.releasesMerged(), stats.mediaMoved());
        return new ReconcileResult(stats, details);
    }

    /**
     * Works sharing a (platform, title key), keeping only groups with more than one work.
     */
    private List<Group> findDuplicateGroups(CatalogStore target, ReconcileOptions options) {
        Map<String, Group> byKey = new LinkedHashMap<>();
        for (Release release : target.releases()) {
            if (!options.includes(release.platformId())) {
                continue;
            }
            Optional<Work> work = target.findWork(release.workId());
            if (work.isEmpty()) {
                continue;
            }
            String key = release.platformId() + "\u0000" + TitleNormalizer.key(work.get().canonicalName());
            byKey.computeIfAbsent(key, k -> new Group(release.platformId(), new LinkedHashSet<>()))
                    .workIds().add(work.get().id());
        }
        List<Group> groups = new ArrayList<>();
        for (Group group : byKey.values()) {
            if (group.workIds().size() > 1) {
                groups.add(group);
            }
        }
        return groups;
    }

    private Optional<MergeDetail> reconcileGroup(CatalogStore target, Group group, Counters counters) {
        // A work can sit in groups on several platforms; an earlier group may already have absorbed it
        List<Candidate> candidates = new ArrayList<>();
        for (String workId : group.workIds()) {
            target.findWork(workId).ifPresent(work ->
                    candidates.add(new Candidate(work, target.releasesForWork(workId).size())));
        }
        if (candidates.size() < 2) {
            return Optional.empty();
        }
        candidates.sort(Comparator.comparingInt(Candidate::releaseCount).reversed()
                .thenComparing(c -> c.work().id()));

        Candidate surviving = candidates.get(0);
        List<Candidate> absorbed = candidates.subList(1, candidates.size());

        List<String> absorbedNames = new ArrayList<>();
        int totalReleases = 0;
        for (Candidate candidate : candidates) {
            totalReleases += candidate.releaseCount();
        }
        for (Candidate candidate : absorbed) {
            absorbedNames.add(candidate.work().canonicalName());
            mergeWorkInto(target, candidate.work().id(), surviving.work().id(), counters);
            target.deleteWork(candidate.work().id());
            counters.worksMerged++;
            counters.worksDeleted++;
        }

        String survivingName = surviving.work().canonicalName();
        Optional<String> better = pickCanonicalName(target, surviving.work().id());
        if (better.isPresent() && !better.get().equals(survivingName)) {
            target.upsertWork(surviving.work().withCanonicalName(better.get()));
            survivingName = better.get();
        }

        log.debug("Merged {} into '{}' ({})", absorbedNames, survivingName, surviving.work().id());
        return Optional.of(new MergeDetail(group.platformId(), absorbedNames, survivingName, totalReleases));
    }

    private void mergeWorkInto(CatalogStore target, String absorbedWorkId, String survivingWorkId, Counters counters) {
        for (Release release : target.releasesForWork(absorbedWorkId)) {
            Optional<Release> collision = target.findRelease(survivingWorkId, release.platformId(), release.region());
            if (collision.isPresent()) {
                String survivingReleaseId = collision.get().id();
                for (Media media : target.mediaForRelease(release.id())) {
                    target.upsertMedia(media.withReleaseId(survivingReleaseId));
                    counters.mediaMoved++;
                }
                target.repointDisagreements("release", release.id(), survivingReleaseId);
                target.deleteRelease(release.id());
                counters.releasesMerged++;
            } else {
                target.upsertRelease(release.withWorkId(survivingWorkId));
                counters.releasesReassigned++;
            }
        }
    }

    /**
     * Alternate title supplied by enrichment, preferring a USA release.
     */
    private static Optional<String> pickCanonicalName(CatalogStore target, String workId) {
        List<Release> releases = target.releasesForWork(workId);
        Optional<String> usa = releases.stream()
                .filter(r -> "usa".equals(r.region()) && r.altTitle() != null && !r.altTitle().isBlank())
                .map(Release::altTitle)
                .findFirst();
        if (usa.isPresent()) {
            return usa;
        }
        return releases.stream()
                .map(Release::altTitle)
                .filter(alt -> alt != null && !alt.isBlank())
                .findFirst();
    }

    private record Group(String platformId, Set<String> workIds) {
    }

    private record Candidate(Work work, int releaseCount) {
    }

    private static final class Counters {
        int groupsFound;
        int worksMerged;
        int worksDeleted;
        int releasesReassigned;
        int releasesMerged;
        int mediaMoved;

        ReconcileStats toStats() {
            return new ReconcileStats(groupsFound, worksMerged, worksDeleted,
                    releasesReassigned, releasesMerged, mediaMoved);
        }
    }
}
