package com.largomodo.romcatalog.catalog.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.largomodo.romcatalog.catalog.CatalogSchema;
import com.largomodo.romcatalog.catalog.SchemaVersionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Loads and saves a whole catalog as one JSON document.
 * <p>
 * The document's {@code schemaVersion} is checked before anything else is bound; a
 * mismatch raises {@link SchemaVersionException} and nothing is loaded. Saves write a
 * sibling temp file and move it over the target, so a crash mid-write leaves the previous
 * catalog intact.
 */
public class JsonCatalogRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonCatalogRepository.class);

    private final Path file;
    private final ObjectMapper mapper;

    public JsonCatalogRepository(Path file) {
        this(file, defaultMapper());
    }

    public JsonCatalogRepository(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    public static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public Path getFile() {
        return file;
    }

    /**
     * Reads the catalog file into a new in-memory store. A missing file yields an empty store.
     *
     * @throws SchemaVersionException if the file was written with another schema version
     * @throws IOException            if the file cannot be read or is not valid JSON
     */
    public InMemoryCatalogStore load() throws IOException {
        if (!Files.exists(file)) {
            log.debug("No catalog at {}, starting empty", file);
            return new InMemoryCatalogStore();
        }
        JsonNode root = mapper.readTree(file.toFile());
        JsonNode version = root == null ? null : root.get("schemaVersion");
        int found = version == null ? 0 : version.asInt();
        if (found != CatalogSchema.CURRENT_VERSION) {
            throw new SchemaVersionException(CatalogSchema.CURRENT_VERSION, found);
        }
        CatalogSnapshot snapshot = mapper.treeToValue(root, CatalogSnapshot.class);
        log.debug("Loaded catalog from {}: {} works, {} releases, {} media", file,
                snapshot.works().size(), snapshot.releases().size(), snapshot.media().size());
        return new InMemoryCatalogStore(snapshot);
    }

    public void save(CatalogStore store) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), store.snapshot());
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.debug("Saved catalog to {}", file);
    }
}
