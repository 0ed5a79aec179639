package com.largomodo.romcatalog.catalog.reconcile;

import java.util.List;

/**
 * @param platformIds platforms to reconcile; empty means all
 * @param dryRun      report what would change without touching the store
 */
public record ReconcileOptions(List<String> platformIds, boolean dryRun) {

    public ReconcileOptions {
        platformIds = platformIds == null ? List.of() : List.copyOf(platformIds);
    }

    public static ReconcileOptions all() {
        return new ReconcileOptions(List.of(), false);
    }

    boolean includes(String platformId) {
        return platformIds.isEmpty() || platformIds.contains(platformId);
    }
}
