package com.largomodo.romcatalog;

import java.nio.file.Path;

/**
 * Settings resolved once from the command line and handed to every component that needs them.
 *
 * @param catalogFile   JSON catalog location
 * @param workerThreads identification worker count
 * @param hashChunkSize read buffer size for hashing, in bytes
 */
public record CatalogConfig(Path catalogFile, int workerThreads, int hashChunkSize) {

    public CatalogConfig {
        if (catalogFile == null) {
            throw new IllegalArgumentException("catalogFile must not be null");
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1, got: " + workerThreads);
        }
        if (hashChunkSize < 1) {
            throw new IllegalArgumentException("hashChunkSize must be positive, got: " + hashChunkSize);
        }
    }
}
