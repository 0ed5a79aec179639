package com.largomodo.romcatalog;

import com.largomodo.romcatalog.cli.DisagreementsCommand;
import com.largomodo.romcatalog.cli.IdentifyCommand;
import com.largomodo.romcatalog.cli.ImportDatCommand;
import com.largomodo.romcatalog.cli.ReconcileCommand;
import com.largomodo.romcatalog.cli.SeedCommand;
import com.largomodo.romcatalog.cli.StatsCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

/**
 * CLI entry point for ROM identification and catalog maintenance.
 * <p>
 * Uses Picocli subcommands. Global options (catalog location, verbosity, worker threads) live
 * here and are turned into a {@link CatalogConfig} by {@link #config()}, which every
 * subcommand calls first.
 */
@Command(
        name = "romcatalog",
        mixinStandardHelpOptions = true,
        resourceBundle = "romcatalog.romcatalog",
        version = "${bundle:application.version}",
        header = "Identifies ROM dumps and maintains a multi-source game catalog.",
        description = {
                "Imports No-Intro / Redump DAT files into a catalog of works, releases and media,",
                "identifies ROM files by hash (detecting dumps that only differ by padding),",
                "and reconciles duplicate works created by inconsistent naming."
        },
        subcommands = {
                ImportDatCommand.class,
                IdentifyCommand.class,
                ReconcileCommand.class,
                StatsCommand.class,
                DisagreementsCommand.class,
                SeedCommand.class
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion",
                "1:General execution error (I/O, invalid catalog, etc.)",
                "2:Invalid command line arguments"
        },
        footerHeading = "%nSee Also:%n",
        footer = {
                "Project home: ${bundle:application.url}"
        }
)
public class RomCatalog implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RomCatalog.class);

    static final String DEFAULT_CATALOG = "romcatalog.json";

    @Spec
    CommandSpec spec;

    @Option(names = {"-c", "--catalog"}, defaultValue = DEFAULT_CATALOG,
            description = {
                    "Catalog file (JSON). Created on first write.",
                    "Default: ${DEFAULT-VALUE}"
            })
    File catalogFile;

    @Option(names = {"-t", "--threads"},
            description = "Worker threads for identification (default: number of CPU cores)")
    Integer threads;

    @Option(names = "--chunk-size", defaultValue = "65536",
            description = "Read buffer size for hashing, in bytes (default: ${DEFAULT-VALUE})")
    int chunkSize;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    boolean verbose;

    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    public static CommandLine newCommandLine() {
        CommandLine cmd = new CommandLine(new RomCatalog());
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        return cmd;
    }

    /**
     * Applies verbosity and validates global options.
     *
     * @throws ParameterException on an invalid global option
     */
    public CatalogConfig config() {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }
        int workers = threads == null ? Runtime.getRuntime().availableProcessors() : threads;
        if (workers < 1) {
            throw new ParameterException(spec.commandLine(), "--threads must be at least 1, got: " + workers);
        }
        if (chunkSize < 1) {
            throw new ParameterException(spec.commandLine(), "--chunk-size must be positive, got: " + chunkSize);
        }
        if (catalogFile.exists() && catalogFile.isDirectory()) {
            throw new ParameterException(spec.commandLine(),
                    "Catalog path must be a file, not a directory: " + catalogFile.getAbsolutePath());
        }
        CatalogConfig config = new CatalogConfig(catalogFile.toPath(), workers, chunkSize);
        log.debug("Using {}", config);
        return config;
    }

    /**
     * Without a subcommand, print usage.
     */
    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }
}
