package com.masterplan.release;

import com.masterplan.file.FileCategory;
import com.masterplan.file.FileStorage;
import com.masterplan.file.FileStorageKey;
import com.masterplan.file.StorageException;
import com.masterplan.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * Read access to the published releases of a project, and rollback. Rolling back never touches a release directory:
 * it only moves the current-release pointer to an older, still complete release.
 */
public class ReleaseCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(ReleaseCatalog.class);

    private final FileStorage fileStorage;
    private final ReleasePointerStore pointerStore;

    public ReleaseCatalog (FileStorage fileStorage, ReleasePointerStore pointerStore) {
        this.fileStorage = fileStorage;
        this.pointerStore = pointerStore;
    }

    /** Ids of all complete releases of the project, oldest first. */
    public List<String> listReleases (String projectSlug) {
        FileStorageKey releasesKey = new FileStorageKey(projectSlug, FileCategory.RELEASES, "");
        return fileStorage.listChildren(releasesKey).stream()
                .filter(ReleaseIds::isReleaseId)
                .filter(id -> fileStorage.exists(manifestKey(projectSlug, id)))
                .collect(Collectors.toList());
    }

    /** @return the manifest, or null if there is no such release. */
    @Nullable
    public ReleaseManifest getManifest (String projectSlug, String releaseId) {
        if (!ReleaseIds.isReleaseId(releaseId)) {
            return null;
        }
        FileStorageKey key = manifestKey(projectSlug, releaseId);
        if (!fileStorage.exists(key)) {
            return null;
        }
        try (InputStream in = fileStorage.getInputStream(key)) {
            return JsonUtil.objectMapper.readValue(in, ReleaseManifest.class);
        } catch (IOException e) {
            throw new StorageException("Could not read manifest " + key.fullPath(), e);
        }
    }

    public ReleasePointer getCurrent (String projectSlug) {
        return pointerStore.getCurrent(projectSlug);
    }

    /**
     * Make an existing release current again.
     * @throws IllegalArgumentException if the release does not exist.
     * @throws StorageException if its stored manifest fails checksum verification.
     */
    public ReleasePointer activate (String projectSlug, String releaseId) {
        ReleaseManifest manifest = getManifest(projectSlug, releaseId);
        if (manifest == null) {
            throw new IllegalArgumentException("No release " + releaseId + " in project " + projectSlug);
        }
        if (!manifest.verifyChecksum()) {
            throw new StorageException("Refusing to activate release " + releaseId + " with a bad checksum.");
        }
        LOG.info("Activating release {} of project {}.", releaseId, projectSlug);
        return pointerStore.setCurrent(projectSlug, releaseId);
    }

    private static FileStorageKey manifestKey (String projectSlug, String releaseId) {
        return ReleaseAssembler.releaseKey(projectSlug, releaseId).resolve(ReleaseAssembler.MANIFEST_FILE_NAME);
    }

}
