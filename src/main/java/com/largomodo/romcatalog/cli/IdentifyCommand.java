package com.largomodo.romcatalog.cli;

import com.largomodo.romcatalog.CatalogConfig;
import com.largomodo.romcatalog.RomCatalog;
import com.largomodo.romcatalog.catalog.store.CatalogStore;
import com.largomodo.romcatalog.catalog.store.JsonCatalogRepository;
import com.largomodo.romcatalog.dat.DatFile;
import com.largomodo.romcatalog.dat.HashIndex;
import com.largomodo.romcatalog.dat.LogiqxDatReader;
import com.largomodo.romcatalog.dat.SourceKind;
import com.largomodo.romcatalog.repair.HeaderSkipRule;
import com.largomodo.romcatalog.repair.PaddedHasher;
import com.largomodo.romcatalog.scan.BatchIdentifier;
import com.largomodo.romcatalog.scan.FileIdentifier;
import com.largomodo.romcatalog.scan.Identification;
import com.largomodo.romcatalog.scan.RomFileMatcher;
import com.largomodo.romcatalog.scan.ScanListener;
import com.largomodo.romcatalog.scan.ScanSummary;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "identify", mixinStandardHelpOptions = true,
        description = {
                "Identifies ROM files against a DAT file and the catalog.",
                "Files that only match after padding are reported with the repair that would fix them;",
                "files on disk are never modified."
        })
public class IdentifyCommand implements Callable<Integer> {

    @ParentCommand
    RomCatalog parent;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "DAT", description = "Reference DAT file (XML)")
    File datFile;

    @Parameters(index = "1", paramLabel = "PATH", description = "ROM file, or directory scanned recursively")
    File input;

    @Option(names = "--disc", description = "Treat the DAT as an optical-disc (Redump) set")
    boolean disc;

    @Option(names = "--header", defaultValue = "none",
            description = "Header rule: none, ines, snes-copier, lynx (default: ${DEFAULT-VALUE})")
    String header;

    @Override
    public Integer call() throws Exception {
        CatalogConfig config = parent.config();
        if (!datFile.isFile()) {
            throw new ParameterException(spec.commandLine(), "DAT file does not exist: " + datFile.getAbsolutePath());
        }
        if (!input.exists()) {
            throw new ParameterException(spec.commandLine(), "Input path does not exist: " + input.getAbsolutePath());
        }
        HeaderSkipRule headerRule;
        try {
            headerRule = HeaderSkipRule.fromCliArgument(header);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }

        SourceKind kind = disc ? SourceKind.OPTICAL_DISC : SourceKind.CARTRIDGE;
        DatFile dat = new LogiqxDatReader().read(datFile.toPath());
        HashIndex index = new HashIndex(dat.toReferenceRecords(kind));
        CatalogStore catalog = new JsonCatalogRepository(config.catalogFile()).load();

        FileIdentifier identifier = new FileIdentifier(catalog, index, kind, headerRule,
                new PaddedHasher(config.hashChunkSize()));
        List<Path> files = RomFileMatcher.findRoms(input.toPath());

        PrintWriter out = spec.commandLine().getOut();
        ScanListener printer = new ScanListener() {
            @Override
            public void onMatched(Identification result) {
                print("OK      ", result.file(), result.title());
            }

            @Override
            public void onNeedsRepair(Identification result) {
                print("REPAIR  ", result.file(),
                        result.title() + " (" + result.repair().method().description() + ")");
            }

            @Override
            public void onUnmatched(Identification result) {
                print("UNKNOWN ", result.file(), "crc32 " + result.hashes().crc32());
            }

            @Override
            public void onError(Path file, Exception e) {
                print("ERROR   ", file, e.getMessage());
            }

            private void print(String tag, Path file, String detail) {
                synchronized (out) {
                    out.println(tag + file.getFileName() + " -> " + detail);
                }
            }
        };

        ScanSummary summary = new BatchIdentifier(identifier, config.workerThreads()).identifyAll(files, printer);
        out.printf("%d file(s): %d matched, %d need repair, %d unknown, %d error(s)%n",
                summary.total(), summary.matched(), summary.needsRepair(), summary.unmatched(), summary.errors());
        out.flush();
        return 0;
    }
}
