package com.largomodo.romcatalog.cli;

import com.largomodo.romcatalog.CatalogConfig;
import com.largomodo.romcatalog.RomCatalog;
import com.largomodo.romcatalog.catalog.Disagreement;
import com.largomodo.romcatalog.catalog.store.InMemoryCatalogStore;
import com.largomodo.romcatalog.catalog.store.JsonCatalogRepository;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "disagreements", mixinStandardHelpOptions = true,
        description = "Lists unresolved disagreements between sources, or resolves one.")
public class DisagreementsCommand implements Callable<Integer> {

    @ParentCommand
    RomCatalog parent;

    @Spec
    CommandSpec spec;

    @ArgGroup(exclusive = false)
    Resolve resolve;

    static class Resolve {
        @Option(names = "--resolve", paramLabel = "ID", required = true, description = "Disagreement to resolve")
        long id;

        @Option(names = "--resolution", paramLabel = "TEXT", required = true,
                description = "How it was resolved (e.g. the value kept)")
        String resolution;
    }

    @Override
    public Integer call() throws Exception {
        CatalogConfig config = parent.config();
        JsonCatalogRepository repository = new JsonCatalogRepository(config.catalogFile());
        InMemoryCatalogStore store = repository.load();
        PrintWriter out = spec.commandLine().getOut();

        if (resolve != null) {
            Disagreement resolved = store.resolveDisagreement(resolve.id, resolve.resolution);
            repository.save(store);
            out.printf("Resolved #%d (%s %s.%s): %s%n", resolved.id(), resolved.entityType(),
                    resolved.entityId(), resolved.field(), resolved.resolution());
            out.flush();
            return 0;
        }

        List<Disagreement> open = store.unresolvedDisagreements();
        for (Disagreement d : open) {
            out.printf("#%d %s %s.%s: %s='%s' vs %s='%s'%n", d.id(), d.entityType(), d.entityId(), d.field(),
                    d.sourceA(), d.valueA(), d.sourceB(), d.valueB());
        }
        out.printf("%d unresolved disagreement(s)%n", open.size());
        out.flush();
        return 0;
    }
}
