package com.largomodo.romcatalog.catalog.reconcile;

import java.util.List;

/**
 * What happened to one duplicate group.
 */
public record MergeDetail(String platformId,
                          List<String> absorbedNames,
                          String survivingName,
                          int totalReleases) {

    public MergeDetail {
        absorbedNames = List.copyOf(absorbedNames);
    }
}
