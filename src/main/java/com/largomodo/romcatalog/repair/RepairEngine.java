package com.largomodo.romcatalog.repair;

import com.largomodo.romcatalog.dat.FileHashes;
import com.largomodo.romcatalog.dat.HashIndex;
import com.largomodo.romcatalog.dat.ReferenceRecord;
import com.largomodo.romcatalog.dat.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Tests padding hypotheses for a dump whose exact hash is absent from the index.
 * <p>
 * Hypotheses are tried in generation order and the first whose padded hash is indexed is
 * returned. No match is a normal outcome ({@link Optional#empty()}), not an error. The
 * file on disk is never modified; applying the repair is left to the caller.
 */
public class RepairEngine {

    private static final Logger log = LoggerFactory.getLogger(RepairEngine.class);

    private final PaddedHasher hasher;

    public RepairEngine(PaddedHasher hasher) {
        this.hasher = hasher;
    }

    /**
     * @param file           dump to examine
     * @param index          reference index
     * @param kind           source kind of the reference set
     * @param headerSkip     header rule for the platform
     * @param expectedLength declared data length (after header), or null when unknown
     * @throws IOException if the file cannot be read
     */
    public Optional<RepairMatch> tryRepair(Path file,
                                           HashIndex index,
                                           SourceKind kind,
                                           HeaderSkip headerSkip,
                                           Long expectedLength) throws IOException {
        long dataLength = Files.size(file) - HeaderSkipRule.headerSkipOf(file, headerSkip);
        List<RepairStrategy> strategies = RepairStrategyPlanner.buildStrategies(dataLength, expectedLength, kind);

        for (RepairStrategy strategy : strategies) {
            long target = strategy.targetLength(dataLength);
            if (!index.mayHaveLength(target)) {
                log.debug("Skipping '{}' for {}: no reference of {} bytes", strategy.description(),
                        file.getFileName(), target);
                continue;
            }

            log.debug("Trying '{}' for {}", strategy.description(), file.getFileName());
            FileHashes hashes = hasher.hash(file, headerSkip, strategy.padding());
            Optional<ReferenceRecord> match = index.match(hashes);
            if (match.isPresent()) {
                log.info("Repair match for {}: {} -> {}", file.getFileName(),
                        strategy.method().description(), match.get().title());
                return Optional.of(new RepairMatch(match.get(), strategy, hashes));
            }
        }
        return Optional.empty();
    }
}
