package com.largomodo.romcatalog.cli;

import com.largomodo.romcatalog.CatalogConfig;
import com.largomodo.romcatalog.RomCatalog;
import com.largomodo.romcatalog.catalog.reconcile.MergeDetail;
import com.largomodo.romcatalog.catalog.reconcile.ReconcileOptions;
import com.largomodo.romcatalog.catalog.reconcile.ReconcileResult;
import com.largomodo.romcatalog.catalog.reconcile.ReconcileStats;
import com.largomodo.romcatalog.catalog.reconcile.WorkReconciler;
import com.largomodo.romcatalog.catalog.store.InMemoryCatalogStore;
import com.largomodo.romcatalog.catalog.store.JsonCatalogRepository;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "reconcile", mixinStandardHelpOptions = true,
        description = "Merges works that are the same game under slightly different names.")
public class ReconcileCommand implements Callable<Integer> {

    @ParentCommand
    RomCatalog parent;

    @Spec
    CommandSpec spec;

    @Option(names = {"-p", "--platform"}, paramLabel = "ID",
            description = "Only reconcile this platform (repeatable; default: all)")
    List<String> platforms = new ArrayList<>();

    @Option(names = "--dry-run", description = "Report what would be merged without changing the catalog")
    boolean dryRun;

    @Override
    public Integer call() throws Exception {
        CatalogConfig config = parent.config();
        JsonCatalogRepository repository = new JsonCatalogRepository(config.catalogFile());
        InMemoryCatalogStore store = repository.load();

        ReconcileResult result = new WorkReconciler(store).reconcile(new ReconcileOptions(platforms, dryRun));
        if (!dryRun) {
            repository.save(store);
        }

        PrintWriter out = spec.commandLine().getOut();
        for (MergeDetail detail : result.details()) {
            out.printf("[%s] %s <- %s (%d releases)%n", detail.platformId(), detail.survivingName(),
                    String.join(", ", detail.absorbedNames()), detail.totalReleases());
        }
        ReconcileStats stats = result.stats();
        out.printf("%s%d group(s): %d work(s) merged, %d deleted, %d release(s) reassigned, %d merged, %d media moved%n",
                dryRun ? "[dry run] " : "", stats.groupsFound(), stats.worksMerged(), stats.worksDeleted(),
                stats.releasesReassigned(), stats.releasesMerged(), stats.mediaMoved());
        out.flush();
        return 0;
    }
}
