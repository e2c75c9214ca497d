package com.masterplan.release;

import com.masterplan.file.FileCategory;
import com.masterplan.file.FileStorageKey;
import com.masterplan.file.LocalFileStorage;
import com.masterplan.file.StorageException;
import com.masterplan.progress.TestingProgressListener;
import com.masterplan.tiles.TilePyramid;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ReleaseAssemblerTest {

    private static final String PROJECT = "harbour-view";

    @TempDir
    Path tempDir;

    private LocalFileStorage storage;
    private ReleasePointerStore pointerStore;
    private ReleaseAssembler assembler;
    private ReleaseCatalog catalog;

    @BeforeEach
    public void setUp () {
        File root = tempDir.resolve("storage").toFile();
        storage = new LocalFileStorage(root.getPath(), "http://localhost:7070/files");
        pointerStore = new ReleasePointerStore(root);
        assembler = new ReleaseAssembler(storage, pointerStore);
        catalog = new ReleaseCatalog(storage, pointerStore);
    }

    private PublishedRelease publishOnce (String scratchName, Instant when) {
        TilePyramid pyramid = ReleaseFixtures.pyramid(tempDir.resolve(scratchName).toFile());
        ReleaseManifest manifest = assembler.assemble(PROJECT, PROJECT + "/1", ReleaseIds.newReleaseId(when), when,
            pyramid, ReleaseFixtures.overlays(), ReleaseFixtures.config());
        TestingProgressListener progress = new TestingProgressListener();
        PublishedRelease release = assembler.publish(manifest, pyramid, progress);
        progress.assertUsedCorrectly();
        return release;
    }

    @Test
    public void validationReportsEveryProblem () {
        ReleaseConfig config = ReleaseFixtures.config();
        config.defaultZoom = new ZoomConfig(1, 2, 3);
        config.defaultLocale = "fr";
        List<String> errors = assembler.validate(null, List.of(), config);
        assertEquals(4, errors.size(), errors.toString());
        // Validation has no side effects, so asking again gives the same answer.
        assertEquals(errors, assembler.validate(null, List.of(), config));
        assertEquals(1, assembler.validate(null, ReleaseFixtures.overlays(), ReleaseFixtures.config()).size());

        ReleaseConfig noLocales = ReleaseFixtures.config();
        noLocales.supportedLocales = List.of();
        assertEquals(1, noLocales.validate().size());
        ReleaseConfig badViewBox = ReleaseFixtures.config();
        badViewBox.defaultViewBox = "0 0 300";
        assertEquals(1, badViewBox.validate().size());

        // A stored release always carries a view box, though a draft configuration may leave it out.
        ReleaseConfig noViewBox = ReleaseFixtures.config();
        noViewBox.defaultViewBox = null;
        assertTrue(noViewBox.validate().isEmpty());
        assertEquals(List.of("Release configuration has no default view box."),
            assembler.validate(null, ReleaseFixtures.overlays(), noViewBox).subList(1, 2));
        assertTrue(ReleaseConfig.isViewBox("0,0, 300 200.5"));
        assertFalse(ReleaseConfig.isViewBox("0 0 300 NaN"));
    }

    @Test
    public void assembleRejectsInvalidInputs () {
        ReleaseValidationException e = assertThrows(ReleaseValidationException.class, () -> assembler.assemble(
            PROJECT, PROJECT + "/1", ReleaseIds.newReleaseId(Instant.now()), Instant.now(),
            null, List.of(), null));
        assertEquals(3, e.errors.size());
    }

    @Test
    public void publishWritesCompleteReleaseAndMovesPointer () throws Exception {
        PublishedRelease release = publishOnce("scratch", Instant.parse("2024-03-01T12:00:00Z"));
        assertTrue(ReleaseIds.isReleaseId(release.releaseId));
        FileStorageKey releaseKey = ReleaseAssembler.releaseKey(PROJECT, release.releaseId);
        assertTrue(storage.exists(releaseKey.resolve("release.json")));
        assertTrue(storage.exists(releaseKey.resolve("tiles.dzi")));
        assertTrue(storage.exists(releaseKey.resolve("tiles/0/0_0.png")));
        // 300x200 at 128 px: 3x2 tiles at full size, 2x1 at half size, 1 at quarter size
        assertEquals(9, release.tileCount);
        assertEquals(9, storage.list(releaseKey.resolve("tiles")).size());
        assertEquals("http://localhost:7070/files/harbour-view/releases/" + release.releaseId,
            release.releaseUrl);

        ReleasePointer pointer = catalog.getCurrent(PROJECT);
        assertEquals(release.releaseId, pointer.releaseId);
        assertNull(pointer.previousReleaseId);

        ReleaseManifest stored = catalog.getManifest(PROJECT, release.releaseId);
        assertEquals(release.checksum, stored.checksum);
        assertTrue(stored.verifyChecksum());
        assertEquals(3, stored.tiles.levels);
        assertEquals("png", stored.tiles.format);
    }

    @Test
    public void republishingLeavesEarlierReleaseUntouched () throws Exception {
        PublishedRelease first = publishOnce("first", Instant.parse("2024-03-01T12:00:00Z"));
        File firstManifest = storage.getFile(
            ReleaseAssembler.releaseKey(PROJECT, first.releaseId).resolve("release.json"));
        byte[] before = Files.readAllBytes(firstManifest.toPath());

        PublishedRelease second = publishOnce("second", Instant.parse("2024-03-02T12:00:00Z"));
        assertNotEquals(first.releaseId, second.releaseId);
        assertArrayEquals(before, Files.readAllBytes(firstManifest.toPath()));
        assertEquals(List.of(first.releaseId, second.releaseId), catalog.listReleases(PROJECT));

        ReleasePointer pointer = catalog.getCurrent(PROJECT);
        assertEquals(second.releaseId, pointer.releaseId);
        assertEquals(first.releaseId, pointer.previousReleaseId);

        // Rollback only moves the pointer
        ReleasePointer rolledBack = catalog.activate(PROJECT, first.releaseId);
        assertEquals(first.releaseId, rolledBack.releaseId);
        assertEquals(second.releaseId, rolledBack.previousReleaseId);
        assertEquals(first.releaseId, catalog.getCurrent(PROJECT).releaseId);
        assertEquals(2, catalog.listReleases(PROJECT).size());
        assertArrayEquals(before, Files.readAllBytes(firstManifest.toPath()));
    }

    @Test
    public void existingReleasePathIsNeverReused () {
        Instant when = Instant.parse("2024-03-01T12:00:00Z");
        String releaseId = ReleaseIds.newReleaseId(when);
        File existing = storage.getFile(ReleaseAssembler.releaseKey(PROJECT, releaseId));
        assertTrue(existing.mkdirs());

        TilePyramid pyramid = ReleaseFixtures.pyramid(tempDir.resolve("scratch").toFile());
        ReleaseManifest manifest = assembler.assemble(PROJECT, PROJECT + "/1", releaseId, when,
            pyramid, ReleaseFixtures.overlays(), ReleaseFixtures.config());
        assertThrows(StorageException.class,
            () -> assembler.publish(manifest, pyramid, new TestingProgressListener()));
        assertNull(catalog.getCurrent(PROJECT));
        // The directory that was already there is left alone
        assertTrue(existing.exists());
    }

    @Test
    public void failedPublishRemovesPartialRelease () {
        Instant when = Instant.parse("2024-03-01T12:00:00Z");
        TilePyramid pyramid = ReleaseFixtures.pyramid(tempDir.resolve("scratch").toFile());
        ReleaseManifest manifest = assembler.assemble(PROJECT, PROJECT + "/1", ReleaseIds.newReleaseId(when), when,
            pyramid, ReleaseFixtures.overlays(), ReleaseFixtures.config());
        // Lose one tile between assembly and publish
        assertTrue(pyramid.tileFile(pyramid.finestLevel().tiles().get(5)).delete());
        assertThrows(StorageException.class,
            () -> assembler.publish(manifest, pyramid, new TestingProgressListener()));
        assertFalse(storage.exists(ReleaseAssembler.releaseKey(PROJECT, manifest.releaseId)));
        assertNull(catalog.getCurrent(PROJECT));
        assertTrue(catalog.listReleases(PROJECT).isEmpty());
    }

    @Test
    public void activatingUnknownReleaseFails () {
        assertThrows(IllegalArgumentException.class,
            () -> catalog.activate(PROJECT, "rel_20240101000000_00000000"));
        assertThrows(IllegalArgumentException.class, () -> catalog.activate(PROJECT, "../../etc"));
        assertTrue(storage.listChildren(new FileStorageKey(PROJECT, FileCategory.RELEASES, "")).isEmpty());
    }

}
