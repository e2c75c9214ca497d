package com.masterplan.jobs;

import com.masterplan.components.eventbus.ErrorEvent;
import com.masterplan.components.eventbus.EventBus;
import com.masterplan.drafts.Draft;
import com.masterplan.drafts.DraftRepository;
import com.masterplan.file.FileUtils;
import com.masterplan.file.SourceAssetException;
import com.masterplan.file.StorageException;
import com.masterplan.geometry.GeometryError;
import com.masterplan.geometry.GeometryImportException;
import com.masterplan.geometry.GeometryImportResult;
import com.masterplan.geometry.GeometryImporter;
import com.masterplan.geometry.ImportOptions;
import com.masterplan.progress.CancelledException;
import com.masterplan.release.PublishedRelease;
import com.masterplan.release.ReleaseAssembler;
import com.masterplan.release.ReleaseConfig;
import com.masterplan.release.ReleaseIds;
import com.masterplan.release.ReleaseManifest;
import com.masterplan.release.ReleaseValidationException;
import com.masterplan.tiles.SourceImage;
import com.masterplan.tiles.TileOptions;
import com.masterplan.tiles.TilePyramid;
import com.masterplan.tiles.TilePyramidGenerator;
import com.masterplan.util.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Runs one publish job from start to finish, recording every step in the JobStore. The stages and the share of the
 * progress range each one owns:
 *
 * validate 0-10, tiles and geometry 10-70, assemble 70-80, store and publish 80-100.
 *
 * Tile generation runs in the job's own thread while the geometry import runs on the light pool, and both must be
 * finished before the manifest is assembled. Cancellation is checked between stages, and within the tile and
 * storage stages between levels. Whatever the outcome, the scratch directory holding the pyramid is deleted.
 */
public class PublishPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(PublishPipeline.class);

    public interface Config extends TileOptions.Config, ImportOptions.Config { }

    private final DraftRepository drafts;
    private final TilePyramidGenerator tileGenerator;
    private final GeometryImporter geometryImporter;
    private final ReleaseAssembler assembler;
    private final JobStore jobStore;
    private final EventBus eventBus;
    private final Executor geometryExecutor;
    private final Config config;
    private final TileOptions tileOptions;

    public PublishPipeline (
            DraftRepository drafts,
            TilePyramidGenerator tileGenerator,
            GeometryImporter geometryImporter,
            ReleaseAssembler assembler,
            JobStore jobStore,
            EventBus eventBus,
            Executor geometryExecutor,
            Config config
    ) {
        this.drafts = drafts;
        this.tileGenerator = tileGenerator;
        this.geometryImporter = geometryImporter;
        this.assembler = assembler;
        this.jobStore = jobStore;
        this.eventBus = eventBus;
        this.geometryExecutor = geometryExecutor;
        this.config = config;
        // Fail at startup rather than in the first job if the configured tile settings are unusable.
        this.tileOptions = TileOptions.fromConfig(config);
    }

    /**
     * Check everything about a draft that can be checked before any work is done. Has no side effects.
     * @return every problem found, empty if a publish may start.
     */
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
            return errors;
        }
        if (draft.baseImage == null) {
            errors.add("Draft does not name a base image.");
        }
        if (draft.overlays == null) {
            errors.add("Draft does not name an overlay document.");
        }
        boolean assetsPresent = false;
        if (draft.baseImage != null && draft.overlays != null) {
            try {
                assetsPresent = drafts.assetsExist(draft);
                if (!assetsPresent) {
                    errors.add("The base image or overlay document of " + draftId + " is missing from storage.");
                }
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        boolean patternValid = true;
        if (draft.idPattern != null) {
            try {
                Pattern.compile(draft.idPattern);
            } catch (PatternSyntaxException e) {
                errors.add("Invalid overlay id pattern: " + e.getDescription());
                patternValid = false;
            }
        }
        if (assetsPresent && patternValid) {
            // A dry import, so a document without a single usable overlay is caught before any tiles are made.
            try {
                geometryImporter.importDocument(drafts.readOverlayDocument(draft), importOptions(draft));
            } catch (GeometryImportException | SourceAssetException e) {
                errors.add(e.getMessage());
            }
        }
        if (draft.config == null) {
            errors.add("Draft has no release configuration.");
        } else {
            errors.addAll(draft.config.validate());
        }
        return errors;
    }

    /** Execute the queued job with the given id. Never throws: every outcome is recorded on the job. */
    public void run (String jobId) {
        JobState job;
        try {
            job = jobStore.start(jobId);
        } catch (IllegalStateException e) {
            // Cancelled while still queued.
            LOG.info("Not running job {}: {}", jobId, e.getMessage());
            return;
        }
        LOG.info("Publishing {} in job {}.", job.draftId, jobId);
        File scratch = null;
        try {
            // Validate
            checkCancelled(jobId);
            jobStore.progress(jobId, 0, "Validating draft");
            List<String> errors = validate(job.draftId);
            if (!errors.isEmpty()) {
                throw new ReleaseValidationException(errors);
            }
            Draft draft = drafts.findDraft(job.draftId);
            jobStore.progress(jobId, 10, "Draft is valid");
            info(jobId, "Validated draft " + job.draftId + ".");

            // Tiles and geometry
            checkCancelled(jobId);
            scratch = FileUtils.createScratchDirectory();
            ImportOptions importOptions = importOptions(draft);
            CompletableFuture<GeometryImportResult> geometry = CompletableFuture.supplyAsync(
                () -> geometryImporter.importDocument(drafts.readOverlayDocument(draft), importOptions),
                geometryExecutor
            );
            SourceImage source = drafts.readBaseImage(draft, config.maxSourcePixels());
            info(jobId, String.format("Read base image %s.", source));
            TilePyramid pyramid = tileGenerator.generate(
                source, tileOptions, new File(scratch, ReleaseAssembler.TILES_DIRECTORY),
                new StageProgress(jobStore, jobId, 10, 70)
            );
            info(jobId, String.format("Generated %d tiles in %d levels.", pyramid.tileCount(), pyramid.levels.size()));
            GeometryImportResult imported = await(geometry);
            info(jobId, String.format("Imported %d overlays.", imported.overlays.size()));
            for (GeometryError error : imported.errors) {
                jobStore.appendLog(jobId, JobLogEntry.Level.WARN, "Skipped element: " + error);
            }
            jobStore.progress(jobId, 70, "Tiles and geometry ready");

            // Assemble
            checkCancelled(jobId);
            Instant publishedAt = Instant.now();
            ReleaseConfig releaseConfig = draft.config;
            if (releaseConfig.defaultViewBox == null) {
                releaseConfig = releaseConfig.withDefaultViewBox(defaultViewBox(imported, pyramid));
                info(jobId, "Using view box " + releaseConfig.defaultViewBox + ".");
            }
            ReleaseManifest manifest = assembler.assemble(
                draft.projectSlug, draft.getDraftId(), ReleaseIds.newReleaseId(publishedAt), publishedAt,
                pyramid, imported.overlays, releaseConfig
            );
            jobStore.progress(jobId, 80, "Manifest assembled");
            info(jobId, "Assembled release " + manifest.releaseId + ".");

            // Store and publish
            checkCancelled(jobId);
            PublishedRelease published = assembler.publish(
                manifest, pyramid, new StageProgress(jobStore, jobId, 80, 100));
            info(jobId, "Published release " + published.releaseId + ".");

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("release_id", published.releaseId);
            result.put("release_url", published.releaseUrl);
            result.put("overlay_count", manifest.overlays.size());
            result.put("tile_count", published.tileCount);
            result.put("checksum", published.checksum);
            result.put("geometry_errors", imported.errors);
            jobStore.complete(jobId, result);
        } catch (CancelledException e) {
            LOG.info("Job {} cancelled: {}", jobId, e.getMessage());
            jobStore.cancel(jobId);
        } catch (Throwable t) {
            eventBus.send(ErrorEvent.forJob(t, jobId));
            jobStore.fail(jobId, errorMessage(t));
        } finally {
            deleteScratch(scratch);
        }
    }

    private void checkCancelled (String jobId) {
        StageProgress.checkCancelled(jobStore, jobId);
    }

    private ImportOptions importOptions (Draft draft) {
        String locale = draft.config == null ? null : draft.config.defaultLocale;
        return ImportOptions.fromConfig(config, draft.overlayType, draft.idPattern, locale);
    }

    /**
     * The view box for a draft that does not set one. Overlay coordinates are in the overlay document's frame, so
     * its viewBox is used, then its width and height, and only then the size of the base image.
     */
    static String defaultViewBox (GeometryImportResult imported, TilePyramid pyramid) {
        if (ReleaseConfig.isViewBox(imported.viewBox)) {
            return imported.viewBox.trim();
        }
        if (imported.width != null && imported.height != null) {
            return "0 0 " + number(imported.width) + " " + number(imported.height);
        }
        return "0 0 " + pyramid.width + " " + pyramid.height;
    }

    private static String number (double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private void info (String jobId, String message) {
        jobStore.appendLog(jobId, JobLogEntry.Level.INFO, message);
    }

    private static <T> T await (CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw e;
        }
    }

    private static String errorMessage (Throwable t) {
        if (t instanceof ReleaseValidationException || t instanceof GeometryImportException) {
            return t.getMessage();
        }
        return ExceptionUtils.shortCauseString(t);
    }

    private static void deleteScratch (File scratch) {
        try {
            FileUtils.deleteRecursively(scratch);
        } catch (StorageException e) {
            LOG.warn("Scratch directory {} was not deleted: {}", scratch, e.toString());
        }
    }

}
