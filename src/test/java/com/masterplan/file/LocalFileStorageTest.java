package com.masterplan.file;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalFileStorageTest {

    @TempDir
    File storageDir;

    private LocalFileStorage storage;

    @BeforeEach
    void setUp () {
        storage = new LocalFileStorage(storageDir.getPath(), "http://localhost:7070/files");
    }

    @Test
    void storedFilesAreNeverOverwritten () throws Exception {
        FileStorageKey key = new FileStorageKey("harbor", FileCategory.RELEASES, "rel_20240101000000_0123abcd/release.json");
        storage.moveIntoStorage(key, FileUtils.createScratchFile("{}".getBytes(StandardCharsets.UTF_8), ".json"));
        assertTrue(storage.exists(key));
        File replacement = FileUtils.createScratchFile("{\"x\":1}".getBytes(StandardCharsets.UTF_8), ".json");
        assertThrows(StorageException.class, () -> storage.moveIntoStorage(key, replacement));
        try (InputStream in = storage.getInputStream(key)) {
            assertEquals("{}", new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    @Test
    void keysMapToProjectCategoryPath () {
        FileStorageKey key = new FileStorageKey("harbor", FileCategory.RELEASES, "rel_1/tiles/0/0_0.png");
        assertEquals("harbor/releases/rel_1/tiles/0/0_0.png", key.fullPath());
        assertEquals("http://localhost:7070/files/harbor/releases/rel_1/tiles/0/0_0.png", storage.getURL(key));
        FileStorageKey root = new FileStorageKey("harbor", FileCategory.RELEASES, "");
        assertEquals("harbor/releases", root.fullPath());
        assertEquals(key, root.resolve("rel_1/tiles/0/0_0.png"));
    }

    @Test
    void traversalIsRejected () {
        assertThrows(IllegalArgumentException.class,
            () -> new FileStorageKey("harbor", FileCategory.UPLOADS, "../../etc/passwd"));
        assertThrows(IllegalArgumentException.class,
            () -> new FileStorageKey("..", FileCategory.UPLOADS, "draft.json"));
        assertThrows(IllegalArgumentException.class,
            () -> new FileStorageKey("harbor/other", FileCategory.UPLOADS, "draft.json"));
    }

    @Test
    void listingAndDeletion () {
        FileStorageKey release = new FileStorageKey("harbor", FileCategory.RELEASES, "rel_1");
        for (String path : List.of("tiles/1/0_0.png", "tiles/0/0_0.png", "release.json")) {
            storage.moveIntoStorage(release.resolve(path), FileUtils.createScratchFile(new byte[]{1}, ".bin"));
        }
        List<String> paths = storage.list(release).stream().map(k -> k.path).collect(Collectors.toList());
        assertEquals(List.of("rel_1/release.json", "rel_1/tiles/0/0_0.png", "rel_1/tiles/1/0_0.png"), paths);
        assertEquals(List.of("release.json", "tiles"), storage.listChildren(release));
        assertEquals(List.of("rel_1"), storage.listChildren(new FileStorageKey("harbor", FileCategory.RELEASES, "")));

        storage.deleteRecursively(release);
        assertFalse(storage.exists(release));
        assertTrue(storage.list(release).isEmpty());
    }

}
