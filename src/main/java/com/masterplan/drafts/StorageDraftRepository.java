package com.masterplan.drafts;

import com.masterplan.file.FileStorage;
import com.masterplan.file.FileStorageKey;
import com.masterplan.file.SourceAssetException;
import com.masterplan.geometry.VectorDocument;
import com.masterplan.tiles.SourceImage;
import com.masterplan.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/** Reads drafts from the uploads category of a FileStorage. */
public class StorageDraftRepository implements DraftRepository {

    private static final Logger LOG = LoggerFactory.getLogger(StorageDraftRepository.class);

    private final FileStorage fileStorage;

    public StorageDraftRepository (FileStorage fileStorage) {
        this.fileStorage = fileStorage;
    }

    @Override
    public Draft findDraft (String draftId) {
        String[] parts = Draft.parseDraftId(draftId);
        FileStorageKey descriptorKey = Draft.directoryKey(parts[0], parts[1]).resolve(Draft.DESCRIPTOR_FILE_NAME);
        if (!fileStorage.exists(descriptorKey)) {
            LOG.debug("No draft descriptor at {}", descriptorKey.fullPath());
            return null;
        }
        Draft draft;
        try (InputStream in = fileStorage.getInputStream(descriptorKey)) {
            draft = JsonUtil.objectMapper.readValue(in, Draft.class);
        } catch (IOException e) {
            throw new SourceAssetException("Draft descriptor " + descriptorKey.fullPath() + " is unreadable.", e);
        }
        draft.projectSlug = parts[0];
        draft.version = parts[1];
        return draft;
    }

    @Override
    public SourceImage readBaseImage (Draft draft, long maxPixels) {
        FileStorageKey key = draft.getBaseImageKey();
        if (key == null || !fileStorage.exists(key)) {
            throw new SourceAssetException("Base image of " + draft + " is missing.");
        }
        return SourceImage.read(fileStorage.getFile(key), maxPixels);
    }

    @Override
    public VectorDocument readOverlayDocument (Draft draft) {
        FileStorageKey key = draft.getOverlayDocumentKey();
        if (key == null || !fileStorage.exists(key)) {
            throw new SourceAssetException("Overlay document of " + draft + " is missing.");
        }
        return VectorDocument.fromFile(fileStorage.getFile(key));
    }

    @Override
    public boolean assetsExist (Draft draft) {
        FileStorageKey image = draft.getBaseImageKey();
        FileStorageKey overlays = draft.getOverlayDocumentKey();
        return image != null && overlays != null && fileStorage.exists(image) && fileStorage.exists(overlays);
    }

}
