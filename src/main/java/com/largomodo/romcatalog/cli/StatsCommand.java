package com.largomodo.romcatalog.cli;

import com.largomodo.romcatalog.CatalogConfig;
import com.largomodo.romcatalog.RomCatalog;
import com.largomodo.romcatalog.catalog.CatalogStats;
import com.largomodo.romcatalog.catalog.store.JsonCatalogRepository;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "stats", mixinStandardHelpOptions = true, description = "Prints catalog row counts.")
public class StatsCommand implements Callable<Integer> {

    @ParentCommand
    RomCatalog parent;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        CatalogConfig config = parent.config();
        CatalogStats stats = new JsonCatalogRepository(config.catalogFile()).load().stats();

        PrintWriter out = spec.commandLine().getOut();
        out.printf("Platforms:     %d%n", stats.platforms());
        out.printf("Companies:     %d%n", stats.companies());
        out.printf("Works:         %d%n", stats.works());
        out.printf("Releases:      %d%n", stats.releases());
        out.printf("Media:         %d%n", stats.media());
        out.printf("Overrides:     %d%n", stats.overrides());
        out.printf("Disagreements: %d (%d unresolved)%n", stats.disagreements(), stats.unresolvedDisagreements());
        out.printf("Imports:       %d%n", stats.importLogs());
        out.flush();
        return 0;
    }
}
