package com.largomodo.romcatalog.catalog.reconcile;

import java.util.List;

public record ReconcileResult(ReconcileStats stats, List<MergeDetail> details) {

    public ReconcileResult {
        details = List.copyOf(details);
    }
}
