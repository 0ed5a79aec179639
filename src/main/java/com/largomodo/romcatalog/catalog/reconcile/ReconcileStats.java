package com.largomodo.romcatalog.catalog.reconcile;

/**
 * Totals for one reconciliation run.
 *
 * @param groupsFound        title groups spanning more than one work
 * @param worksMerged        works folded into a survivor
 * @param worksDeleted       works removed afterwards
 * @param releasesReassigned releases moved to the surviving work as-is
 * @param releasesMerged     releases that collided with a survivor release and were folded into it
 * @param mediaMoved         media moved off merged releases
 */
public record ReconcileStats(int groupsFound,
                             int worksMerged,
                             int worksDeleted,
                             int releasesReassigned,
                             int releasesMerged,
                             int mediaMoved) {
}
