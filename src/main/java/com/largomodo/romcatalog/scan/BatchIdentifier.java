package com.largomodo.romcatalog.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Identifies many files in parallel with fail-soft error handling.
 * <p>
 * Fixed pool of worker threads, bounded queue ({@code 2 * threads}) and
 * {@link ThreadPoolExecutor.CallerRunsPolicy}: when the queue is full the submitting thread
 * hashes a file itself, which throttles submission. A failure on one file is reported to
 * {@link ScanListener#onError} and the rest of the batch carries on.
 */
public class BatchIdentifier {

    private static final Logger log = LoggerFactory.getLogger(BatchIdentifier.class);

    private final FileIdentifier identifier;
    private final int threads;

    public BatchIdentifier(FileIdentifier identifier) {
        this(identifier, Runtime.getRuntime().availableProcessors());
    }

    public BatchIdentifier(FileIdentifier identifier, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got: " + threads);
        }
        this.identifier = identifier;
        this.threads = threads;
    }

    public ScanSummary identifyAll(List<Path> files, ScanListener listener) {
        int total = files.size();
        AtomicInteger position = new AtomicInteger(0);
        AtomicInteger matched = new AtomicInteger(0);
        AtomicInteger unmatched = new AtomicInteger(0);
        AtomicInteger needsRepair = new AtomicInteger(0);
        AtomicInteger errors = new AtomicInteger(0);

        ExecutorService executor = new ThreadPoolExecutor(
                threads,
                threads,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(2 * threads),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        try {
            for (Path file : files) {
                executor.submit(() -> {
                    try {
                        MDC.put("rom", file.getFileName().toString());
                        listener.onFile(position.incrementAndGet(), total, file.getFileName().toString());
                        Identification result = identifier.identify(file);
                        switch (result.outcome()) {
                            case MATCHED:
                                matched.incrementAndGet();
                                listener.onMatched(result);
                                break;
                            case NEEDS_REPAIR:
                                needsRepair.incrementAndGet();
                                listener.onNeedsRepair(result);
                                break;
                            default:
                                unmatched.incrementAndGet();
                                listener.onUnmatched(result);
                                break;
                        }
                    } catch (Exception e) {
                        // Worker threads must survive so the batch continues
                        errors.incrementAndGet();
                        log.error("FAILED: {} - {}", file, e.getMessage());
                        listener.onError(file, e);
                    } finally {
                        MDC.remove("rom");
                    }
                    return null;
                });
            }
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.MINUTES)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        ScanSummary summary = new ScanSummary(total, matched.get(), unmatched.get(), needsRepair.get(), errors.get());
        log.info("Scan complete: {} files, {} matched, {} need repair, {} unmatched, {} failed",
                summary.total(), summary.matched(), summary.needsRepair(), summary.unmatched(), summary.errors());
        listener.onComplete(summary);
        return summary;
    }
}
