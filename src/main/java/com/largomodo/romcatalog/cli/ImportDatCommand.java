package com.largomodo.romcatalog.cli;

import com.largomodo.romcatalog.CatalogConfig;
import com.largomodo.romcatalog.RomCatalog;
import com.largomodo.romcatalog.catalog.importer.DatImporter;
import com.largomodo.romcatalog.catalog.importer.ImportListener;
import com.largomodo.romcatalog.catalog.importer.ImportStats;
import com.largomodo.romcatalog.catalog.store.InMemoryCatalogStore;
import com.largomodo.romcatalog.catalog.store.JsonCatalogRepository;
import com.largomodo.romcatalog.dat.DatFile;
import com.largomodo.romcatalog.dat.LogiqxDatReader;
import com.largomodo.romcatalog.dat.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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

@Command(name = "import-dat", mixinStandardHelpOptions = true,
        description = "Imports a Logiqx XML DAT file into the catalog.")
public class ImportDatCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ImportDatCommand.class);

    @ParentCommand
    RomCatalog parent;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "DAT", description = "No-Intro or Redump DAT file (XML)")
    File datFile;

    @Option(names = {"-p", "--platform"}, required = true,
            description = "Catalog platform id the DAT describes (must be seeded first)")
    String platformId;

    @Option(names = "--source", defaultValue = "no-intro",
            description = "DAT source: no-intro or redump (default: ${DEFAULT-VALUE})")
    String source;

    @Override
    public Integer call() throws Exception {
        CatalogConfig config = parent.config();
        if (!datFile.isFile()) {
            throw new ParameterException(spec.commandLine(), "DAT file does not exist: " + datFile.getAbsolutePath());
        }
        SourceKind kind;
        try {
            kind = SourceKind.fromDatSource(source);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }

        JsonCatalogRepository repository = new JsonCatalogRepository(config.catalogFile());
        InMemoryCatalogStore store = repository.load();
        DatFile dat = new LogiqxDatReader().read(datFile.toPath());

        ImportListener progress = new ImportListener() {
            @Override
            public void onGame(int current, int total, String name) {
                log.debug("[{}/{}] {}", current, total, name);
            }
        };
        ImportStats stats = new DatImporter(store).importDat(dat, platformId, kind.getDatSource(), progress);
        repository.save(store);

        PrintWriter out = spec.commandLine().getOut();
        out.printf("Imported %s into %s%n", dat.name(), platformId);
        out.printf("  games:    %d (%d bad dumps skipped)%n", stats.totalGames(), stats.skippedBad());
        out.printf("  works:    %d created, %d existing%n", stats.worksCreated(), stats.worksExisting());
        out.printf("  releases: %d created, %d existing%n", stats.releasesCreated(), stats.releasesExisting());
        out.printf("  media:    %d created, %d updated, %d unchanged%n",
                stats.mediaCreated(), stats.mediaUpdated(), stats.mediaUnchanged());
        out.flush();
        return 0;
    }
}
