package com.masterplan.jobs;

import com.masterplan.components.eventbus.ErrorEvent;
import com.masterplan.components.eventbus.EventBus;
import com.masterplan.drafts.Draft;
import com.masterplan.drafts.DraftRepository;
import com.masterplan.file.FileStorage;
import com.masterplan.file.FileStorageKey;
import com.masterplan.file.FileUtils;
import com.masterplan.file.SourceAssetException;
import com.masterplan.file.StorageException;
import com.masterplan.progress.CancelledException;
import com.masterplan.release.ReleaseAssembler;
import com.masterplan.release.ReleaseValidationException;
import com.masterplan.tiles.SourceImage;
import com.masterplan.tiles.TileOptions;
import com.masterplan.tiles.TilePyramid;
import com.masterplan.tiles.TilePyramidGenerator;
import com.masterplan.util.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one tile generation job, which cuts a draft's base image into a pyramid stored next to the draft so editors
 * can preview it before publishing:
 *
 * validate 0-10, tiles 10-80, store 80-100.
 *
 * The tiles go to {project}/uploads/{version}/tiles/ with a tiles.dzi beside them, replacing whatever an earlier run
 * left there. Nothing is ever written under releases.
 */
public class TileGenerationPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(TileGenerationPipeline.class);

    private final DraftRepository drafts;
    private final TilePyramidGenerator tileGenerator;
    private final FileStorage fileStorage;
    private final JobStore jobStore;
    private final EventBus eventBus;
    private final TileOptions.Config config;
    private final TileOptions tileOptions;

    public TileGenerationPipeline (
            DraftRepository drafts,
            TilePyramidGenerator tileGenerator,
            FileStorage fileStorage,
            JobStore jobStore,
            EventBus eventBus,
            TileOptions.Config config
    ) {
        this.drafts = drafts;
        this.tileGenerator = tileGenerator;
        this.fileStorage = fileStorage;
        this.jobStore = jobStore;
        this.eventBus = eventBus;
        this.config = config;
        this.tileOptions = TileOptions.fromConfig(config);
    }

    /** Where the tiles of a draft are kept between generation and publishing. */
    public static FileStorageKey tilesKey (Draft draft) {
        return Draft.directoryKey(draft.projectSlug, draft.version).resolve(ReleaseAssembler.TILES_DIRECTORY);
    }

    /** Problems that would stop tiles being generated for this draft. Has no side effects. */
    public List<String> validate (String draftId) {
        List<String> errors = new ArrayList<>();
        Draft draft;
        try {
            draft = drafts.findDraft(draftId);
        } catch (IllegalArgumentException | SourceAssetException e) {
            errors.add(e.getMessage());
            return errors;
        }
        if (draft == null) {
            errors.add("No draft found with id " + draftId + ".");
        } else if (draft.baseImage == null) {
            errors.add("Draft does not name a base image.");
        }
        return errors;
    }

    /** Execute the queued job with the given id. Never throws: every outcome is recorded on the job. */
    public void run (String jobId) {
        JobState job;
        try {
            job = jobStore.start(jobId);
        } catch (IllegalStateException e) {
            LOG.info("Not running job {}: {}", jobId, e.getMessage());
            return;
        }
        LOG.info("Generating tiles for {} in job {}.", job.draftId, jobId);
        File scratch = null;
        try {
            StageProgress.checkCancelled(jobStore, jobId);
            jobStore.progress(jobId, 0, "Validating draft");
            List<String> errors = validate(job.draftId);
            if (!errors.isEmpty()) {
                throw new ReleaseValidationException(errors);
            }
            Draft draft = drafts.findDraft(job.draftId);
            jobStore.progress(jobId, 10, "Draft is valid");

            StageProgress.checkCancelled(jobStore, jobId);
            scratch = FileUtils.createScratchDirectory();
            SourceImage source = drafts.readBaseImage(draft, config.maxSourcePixels());
            info(jobId, String.format("Read base image %s.", source));
            TilePyramid pyramid = tileGenerator.generate(
                source, tileOptions, new File(scratch, ReleaseAssembler.TILES_DIRECTORY),
                new StageProgress(jobStore, jobId, 10, 80)
            );
            info(jobId, String.format("Generated %d tiles in %d levels.", pyramid.tileCount(), pyramid.levels.size()));
            jobStore.progress(jobId, 80, "Tiles ready");

            StageProgress.checkCancelled(jobStore, jobId);
            FileStorageKey tilesKey = tilesKey(draft);
            store(draft, pyramid, new StageProgress(jobStore, jobId, 80, 100));
            info(jobId, "Stored tiles at " + tilesKey.fullPath() + ".");

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("tiles_path", tilesKey.fullPath());
            result.put("tile_count", pyramid.tileCount());
            result.put("levels", pyramid.levels.size());
            result.put("width", pyramid.width);
            result.put("height", pyramid.height);
            result.put("format", pyramid.format.extension);
            jobStore.complete(jobId, result);
        } catch (CancelledException e) {
            LOG.info("Job {} cancelled: {}", jobId, e.getMessage());
            jobStore.cancel(jobId);
        } catch (Throwable t) {
            eventBus.send(ErrorEvent.forJob(t, jobId));
            jobStore.fail(jobId, t instanceof ReleaseValidationException
                    ? t.getMessage() : ExceptionUtils.shortCauseString(t));
        } finally {
            try {
                FileUtils.deleteRecursively(scratch);
            } catch (StorageException e) {
                LOG.warn("Scratch directory {} was not deleted: {}", scratch, e.toString());
            }
        }
    }

    /** Replace the draft's previous tiles, if any, with the new pyramid and its DZI descriptor. */
    private void store (Draft draft, TilePyramid pyramid, StageProgress progress) {
        FileStorageKey tilesKey = tilesKey(draft);
        FileStorageKey dziKey = Draft.directoryKey(draft.projectSlug, draft.version)
                .resolve(ReleaseAssembler.DZI_FILE_NAME);
        // One unit per tile, plus the descriptor.
        progress.beginTask("Storing tiles", pyramid.tileCount() + 1);
        if (fileStorage.exists(tilesKey)) {
            fileStorage.deleteRecursively(tilesKey);
        }
        if (fileStorage.exists(dziKey)) {
            fileStorage.deleteRecursively(dziKey);
        }
        pyramid.moveIntoStorage(fileStorage, tilesKey, progress);
        File dzi = FileUtils.createScratchFile(".dzi");
        pyramid.writeDziDescriptor(dzi);
        fileStorage.moveIntoStorage(dziKey, dzi);
        progress.increment();
    }

    private void info (String jobId, String message) {
        jobStore.appendLog(jobId, JobLogEntry.Level.INFO, message);
    }

}
