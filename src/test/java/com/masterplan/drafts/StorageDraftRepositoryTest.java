package com.masterplan.drafts;

import com.masterplan.file.FileStorageKey;
import com.masterplan.file.LocalFileStorage;
import com.masterplan.file.SourceAssetException;
import com.masterplan.geometry.VectorDocument;
import com.masterplan.tiles.SourceImage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StorageDraftRepositoryTest {

    @TempDir
    File storageDir;

    private LocalFileStorage storage;
    private StorageDraftRepository repository;

    @BeforeEach
    void setUp () {
        storage = new LocalFileStorage(storageDir.getPath(), "http://localhost/files");
        repository = new StorageDraftRepository(storage);
    }

    @Test
    void readsDraftDescriptorAndAssets () throws Exception {
        DraftFixtures.writeDraft(storage, "harbor", "v2");
        Draft draft = repository.findDraft("harbor/v2");
        assertNotNull(draft);
        assertEquals("harbor", draft.projectSlug);
        assertEquals("v2", draft.version);
        assertEquals("harbor/v2", draft.getDraftId());
        assertEquals("harbor/uploads/v2/base.png", draft.getBaseImageKey().fullPath());
        assertEquals("unit", draft.overlayType);
        assertEquals("en", draft.config.defaultLocale);
        assertEquals(2, draft.config.supportedLocales.size());
        assertTrue(repository.assetsExist(draft));

        SourceImage image = repository.readBaseImage(draft, 1_000_000);
        assertEquals(300, image.width);
        assertEquals(200, image.height);
        VectorDocument document = repository.readOverlayDocument(draft);
        assertTrue(new String(document.content, StandardCharsets.UTF_8).contains("unit-a1"));
    }

    @Test
    void missingDraftIsNull () {
        assertNull(repository.findDraft("harbor/v9"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"harbor", "harbor/v1/extra", "/v1", "harbor/", "../harbor/v1", "harbor/.."})
    void malformedDraftIdsAreRejected (String draftId) {
        assertThrows(IllegalArgumentException.class, () -> repository.findDraft(draftId));
    }

    @Test
    void missingAssetsAreReported () throws Exception {
        Draft draft = DraftFixtures.writeDraft(storage, "harbor", "v3");
        File image = storage.getFile(draft.getBaseImageKey());
        assertTrue(image.delete());
        Draft reloaded = repository.findDraft("harbor/v3");
        assertFalse(repository.assetsExist(reloaded));
        assertThrows(SourceAssetException.class, () -> repository.readBaseImage(reloaded, 1_000_000));
        // The overlay document is still there.
        assertNotNull(repository.readOverlayDocument(reloaded));
    }

    @Test
    void unreadableDescriptorIsASourceAssetError () throws Exception {
        FileStorageKey key = Draft.directoryKey("harbor", "v4").resolve(Draft.DESCRIPTOR_FILE_NAME);
        File descriptor = storage.getFile(key);
        descriptor.getParentFile().mkdirs();
        Files.write(descriptor.toPath(), "{ not json".getBytes(StandardCharsets.UTF_8));
        assertThrows(SourceAssetException.class, () -> repository.findDraft("harbor/v4"));
    }

    @Test
    void oversizedBaseImageIsRefused () throws Exception {
        Draft draft = DraftFixtures.writeDraft(storage, "harbor", "v5");
        assertThrows(SourceAssetException.class, () -> repository.readBaseImage(draft, 100));
    }

}
