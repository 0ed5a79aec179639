package com.largomodo.romcatalog.catalog.store;

import com.largomodo.romcatalog.catalog.Disagreement;
import com.largomodo.romcatalog.catalog.FieldOverride;
import com.largomodo.romcatalog.catalog.ImportLog;
import com.largomodo.romcatalog.catalog.Media;
import com.largomodo.romcatalog.catalog.MediaStatus;
import com.largomodo.romcatalog.catalog.MediaType;
import com.largomodo.romcatalog.catalog.Platform;
import com.largomodo.romcatalog.catalog.PlatformRegion;
import com.largomodo.romcatalog.catalog.PlatformRelationship;
import com.largomodo.romcatalog.catalog.Release;
import com.largomodo.romcatalog.catalog.SchemaVersionException;
import com.largomodo.romcatalog.catalog.Work;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonCatalogRepositoryTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileLoadsEmptyStore() throws IOException {
        JsonCatalogRepository repository = new JsonCatalogRepository(tempDir.resolve("absent.json"));

        InMemoryCatalogStore store = repository.load();

        assertEquals(0, store.stats().works());
        assertEquals(0, store.stats().platforms());
    }

    @Test
    void savedCatalogLoadsBackIdentically() throws IOException {
        InMemoryCatalogStore store = new InMemoryCatalogStore();
        store.upsertPlatform(new Platform("nes", "Nintendo Entertainment System", "NES", "Nintendo",
                MediaType.CARTRIDGE, 1985, List.of(new PlatformRegion("usa", "1985-10-18")),
                List.of(new PlatformRelationship("fds", PlatformRelationship.Type.ADDON))));
        store.upsertWork(new Work("nes:metroid", "Metroid"));
        store.upsertRelease(Release.of("nes:metroid:usa", "nes:metroid", "nes", "usa", "Metroid")
                .withRating(4.5));
        store.upsertMedia(new Media("nes:metroid:usa:metroid-usa", "nes:metroid:usa", null, null, null, null,
                MediaStatus.PROTOTYPE, "Metroid (USA) (Proto)", "no-intro", 131072L, "a7f4ae55", null, null));
        store.addOverride(new FieldOverride("media", null, "nes", "Metroid*", "status", "verified", "curated"));
        store.addDisagreement(Disagreement.unresolved("release", "nes:metroid:usa", "release_date",
                "dat", "1986-08-15", "screenscraper", "1987-08-15"));
        store.resolveDisagreement(1, "dat wins");
        store.appendImportLog(new ImportLog(0, "dat", "Nintendo - NES", "20240101",
                Instant.parse("2024-01-01T00:00:00Z"), 1, 0, 0, 0));

        Path file = tempDir.resolve("nested/catalog.json");
        JsonCatalogRepository repository = new JsonCatalogRepository(file);
        repository.save(store);

        assertTrue(Files.exists(file));
        assertFalse(Files.exists(tempDir.resolve("nested/catalog.json.tmp")));
        assertEquals(store.snapshot(), repository.load().snapshot());
    }

    @Test
    void otherSchemaVersionIsRejected() throws IOException {
        Path file = tempDir.resolve("old.json");
        Files.writeString(file, "{\"schemaVersion\": 1, \"works\": []}");

        SchemaVersionException e = assertThrows(SchemaVersionException.class,
                () -> new JsonCatalogRepository(file).load());

        assertEquals(2, e.getExpected());
        assertEquals(1, e.getFound());
    }

    @Test
    void missingSchemaVersionIsRejected() throws IOException {
        Path file = tempDir.resolve("unversioned.json");
        Files.writeString(file, "{\"works\": []}");

        SchemaVersionException e = assertThrows(SchemaVersionException.class,
                () -> new JsonCatalogRepository(file).load());
        assertEquals(0, e.getFound());
    }

    @Test
    void malformedJsonIsAnIOException() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{ not json");

        assertThrows(IOException.class, () -> new JsonCatalogRepository(file).load());
    }
}
