package com.masterplan.release;

import com.masterplan.file.FileCategory;
import com.masterplan.file.FileStorage;
import com.masterplan.file.FileStorageKey;
import com.masterplan.file.FileUtils;
import com.masterplan.file.StorageException;
import com.masterplan.geometry.Overlay;
import com.masterplan.geometry.OverlayGeometry;
import com.masterplan.progress.ProgressListener;
import com.masterplan.tiles.TilePyramid;
import com.masterplan.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Combines a tile pyramid, imported overlays and the project configuration into a checksummed manifest, and publishes
 * the result as an immutable release.
 *
 * Publishing writes everything under {project}/releases/{release_id}/, a path that must not exist beforehand and is
 * never written again afterward. Only once every tile and the manifest are stored and verified does the project's
 * current-release pointer move, which is the single mutable write of the whole operation. If anything fails before
 * that, the partly written release directory is removed, since nothing can refer to it yet.
 */
public class ReleaseAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(ReleaseAssembler.class);

    public static final String MANIFEST_FILE_NAME = "release.json";
    public static final String DZI_FILE_NAME = "tiles.dzi";
    public static final String TILES_DIRECTORY = "tiles";

    private final FileStorage fileStorage;
    private final ReleasePointerStore pointerStore;

    public ReleaseAssembler (FileStorage fileStorage, ReleasePointerStore pointerStore) {
        this.fileStorage = fileStorage;
        this.pointerStore = pointerStore;
    }

    /**
     * Check the inputs of a release without side effects.
     * @return every problem found, or an empty list if the release can be assembled.
     */
    public List<String> validate (TilePyramid pyramid, List<Overlay> overlays, ReleaseConfig config) {
        List<String> errors = new ArrayList<>();
        if (pyramid == null || pyramid.outputDirectory == null || !pyramid.outputDirectory.isDirectory()) {
            errors.add("Tile pyramid output does not exist.");
        } else if (pyramid.tileCount() == 0 || !pyramid.tileFile(pyramid.levels.get(0).tiles().get(0)).exists()) {
            errors.add("Tile pyramid output contains no tiles.");
        }
        if (overlays == null || overlays.isEmpty()) {
            errors.add("At least one overlay is required.");
        } else {
            for (Overlay overlay : overlays) {
                if (overlay.geometry == null || overlay.geometry.accept(new EmptyGeometryCheck())) {
                    errors.add("Overlay " + overlay.ref + " has no geometry.");
                }
            }
        }
        if (config == null) {
            errors.add("Release configuration is missing.");
        } else {
            if (config.defaultViewBox == null) {
                errors.add("Release configuration has no default view box.");
            }
            errors.addAll(config.validate());
        }
        return errors;
    }

    /**
     * Build the manifest for a new release. Overlays are ordered by their position in the source document.
     * @throws ReleaseValidationException if validate() reports any problem.
     */
    public ReleaseManifest assemble (
            String projectSlug, String draftId, String releaseId, Instant publishedAt,
            TilePyramid pyramid, List<Overlay> overlays, ReleaseConfig config
    ) {
        List<String> errors = validate(pyramid, overlays, config);
        if (!errors.isEmpty()) {
            throw new ReleaseValidationException(errors);
        }
        if (!ReleaseIds.isReleaseId(releaseId)) {
            throw new IllegalArgumentException("Malformed release id: " + releaseId);
        }
        ReleaseManifest manifest = new ReleaseManifest();
        manifest.releaseId = releaseId;
        manifest.projectSlug = projectSlug;
        manifest.draftId = draftId;
        manifest.publishedAt = publishedAt;
        manifest.config = config;
        manifest.tiles = TileConfig.forPyramid(pyramid);
        manifest.overlays = overlays.stream()
                .sorted(Comparator.comparingInt((Overlay o) -> o.sortOrder).thenComparing(o -> o.ref))
                .map(ManifestOverlay::from)
                .collect(Collectors.toList());
        manifest.checksum = manifest.computeChecksum();
        return manifest;
    }

    /**
     * Store the pyramid and manifest as a new immutable release and make it the project's current release.
     * Tiles are moved out of the pyramid's scratch directory, so the pyramid cannot be used afterward.
     */
    public PublishedRelease publish (ReleaseManifest manifest, TilePyramid pyramid, ProgressListener progress) {
        String project = manifest.projectSlug;
        FileStorageKey releaseKey = releaseKey(project, manifest.releaseId);
        ReentrantLock lock = pointerStore.lockFor(project);
        lock.lock();
        try {
            if (fileStorage.exists(releaseKey)) {
                throw new StorageException("Release path already exists: " + releaseKey.fullPath());
            }
            try {
                storeTiles(releaseKey, pyramid, progress);
                storeManifest(releaseKey, manifest);
                progress.increment();
            } catch (RuntimeException e) {
                LOG.warn("Publishing {} failed, removing partial release directory.", manifest.releaseId);
                try {
                    fileStorage.deleteRecursively(releaseKey);
                } catch (StorageException cleanupFailure) {
                    e.addSuppressed(cleanupFailure);
                }
                throw e;
            }
            // Everything is in place and verified. This is the only step that changes what readers see.
            pointerStore.setCurrent(project, manifest.releaseId);
            progress.increment();
        } finally {
            lock.unlock();
        }
        String url = fileStorage.getURL(releaseKey);
        LOG.info("Published release {} of project {} at {}", manifest.releaseId, project, url);
        return new PublishedRelease(manifest.releaseId, url, pyramid.tileCount(), manifest.checksum);
    }

    private void storeTiles (FileStorageKey releaseKey, TilePyramid pyramid, ProgressListener progress) {
        // One unit per tile, plus the manifest and the pointer update.
        progress.beginTask("Storing release files", pyramid.tileCount() + 2);
        pyramid.moveIntoStorage(fileStorage, releaseKey.resolve(TILES_DIRECTORY), progress);
        File dzi = FileUtils.createScratchFile(".dzi");
        pyramid.writeDziDescriptor(dzi);
        fileStorage.moveIntoStorage(releaseKey.resolve(DZI_FILE_NAME), dzi);
    }

    private void storeManifest (FileStorageKey releaseKey, ReleaseManifest manifest) {
        FileStorageKey manifestKey = releaseKey.resolve(MANIFEST_FILE_NAME);
        File scratch = FileUtils.createScratchFile(JsonUtil.toPrettyJsonBytes(manifest), ".json");
        fileStorage.moveIntoStorage(manifestKey, scratch);
        ReleaseManifest stored = readManifest(manifestKey);
        if (!manifest.checksum.equals(stored.checksum) || !stored.verifyChecksum()) {
            throw new StorageException("Stored manifest does not match its checksum: " + manifestKey.fullPath());
        }
    }

    ReleaseManifest readManifest (FileStorageKey manifestKey) {
        try (InputStream in = fileStorage.getInputStream(manifestKey)) {
            return JsonUtil.objectMapper.readValue(in, ReleaseManifest.class);
        } catch (IOException e) {
            throw new StorageException("Could not read manifest " + manifestKey.fullPath(), e);
        }
    }

    public static FileStorageKey releaseKey (String projectSlug, String releaseId) {
        return new FileStorageKey(projectSlug, FileCategory.RELEASES, releaseId);
    }

    /** True for geometry that gives the viewer nothing to draw. */
    private static class EmptyGeometryCheck implements OverlayGeometry.Visitor<Boolean> {
        @Override
        public Boolean visitPath (OverlayGeometry.Path path) {
            return path.d == null || path.d.trim().isEmpty();
        }

        @Override
        public Boolean visitPolygon (OverlayGeometry.Polygon polygon) {
            return polygon.points == null || polygon.points.length == 0;
        }

        @Override
        public Boolean visitPoint (OverlayGeometry.Point point) {
            return !Double.isFinite(point.x) || !Double.isFinite(point.y);
        }
    }

}
