package com.largomodo.romcatalog.cli;

import com.largomodo.romcatalog.CatalogConfig;
import com.largomodo.romcatalog.RomCatalog;
import com.largomodo.romcatalog.catalog.merge.OverrideApplier;
import com.largomodo.romcatalog.catalog.store.CatalogSeeder;
import com.largomodo.romcatalog.catalog.store.CuratedDefinitions;
import com.largomodo.romcatalog.catalog.store.InMemoryCatalogStore;
import com.largomodo.romcatalog.catalog.store.JsonCatalogRepository;
import com.largomodo.romcatalog.catalog.store.SeedStats;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "seed", mixinStandardHelpOptions = true,
        description = "Loads curated platforms, companies and overrides into the catalog.")
public class SeedCommand implements Callable<Integer> {

    @ParentCommand
    RomCatalog parent;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "DEFINITIONS", description = "Curated definitions file (JSON)")
    File definitionsFile;

    @Option(names = "--apply-overrides", description = "Apply every stored override to imported media afterwards")
    boolean applyOverrides;

    @Override
    public Integer call() throws Exception {
        CatalogConfig config = parent.config();
        if (!definitionsFile.isFile()) {
            throw new ParameterException(spec.commandLine(),
                    "Definitions file does not exist: " + definitionsFile.getAbsolutePath());
        }
        JsonCatalogRepository repository = new JsonCatalogRepository(config.catalogFile());
        InMemoryCatalogStore store = repository.load();

        CuratedDefinitions definitions = CuratedDefinitions.read(definitionsFile.toPath(),
                JsonCatalogRepository.defaultMapper());
        SeedStats stats = new CatalogSeeder(store).seed(definitions);
        int applied = applyOverrides ? new OverrideApplier(store).apply(store.overrides()) : 0;
        repository.save(store);

        PrintWriter out = spec.commandLine().getOut();
        out.printf("Seeded %d platform(s), %d company(ies), %d new override(s)%n",
                stats.platforms(), stats.companies(), stats.overrides());
        if (applyOverrides) {
            out.printf("Applied %d override(s)%n", applied);
        }
        out.flush();
        return 0;
    }
}
