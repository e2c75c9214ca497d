package com.masterplan.jobs;

import com.masterplan.components.TaskScheduler;
import com.masterplan.components.eventbus.EventBus;
import com.masterplan.drafts.Draft;
import com.masterplan.drafts.DraftFixtures;
import com.masterplan.drafts.DraftRepository;
import com.masterplan.drafts.StorageDraftRepository;
import com.masterplan.file.FileStorageKey;
import com.masterplan.file.LocalFileStorage;
import com.masterplan.geometry.GeometryImportResult;
import com.masterplan.geometry.GeometryImporter;
import com.masterplan.geometry.Overlay;
import com.masterplan.geometry.VectorDocument;
import com.masterplan.release.ReleaseAssembler;
import com.masterplan.release.ReleaseCatalog;
import com.masterplan.release.ReleaseFixtures;
import com.masterplan.release.ReleaseIds;
import com.masterplan.release.ReleaseManifest;
import com.masterplan.release.ReleasePointerStore;
import com.masterplan.tiles.SourceImage;
import com.masterplan.tiles.TilePyramid;
import com.masterplan.tiles.TilePyramidGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Whole publish jobs, from a draft in storage to a current release. */
class JobOrchestratorTest {

    @TempDir
    File storageDir;

    @TempDir
    File journalDir;

    private TaskScheduler taskScheduler;
    private LocalFileStorage storage;
    private JobStore jobStore;
    private ReleaseCatalog catalog;
    private PausingDraftRepository drafts;
    private JobOrchestrator orchestrator;

    @BeforeEach
    void setUp () throws Exception {
        TestConfig config = new TestConfig();
        taskScheduler = new TaskScheduler(config);
        EventBus eventBus = new EventBus(taskScheduler);
        storage = new LocalFileStorage(storageDir.getPath(), "http://localhost:7070/files");
        ReleasePointerStore pointerStore = new ReleasePointerStore(storageDir);
        catalog = new ReleaseCatalog(storage, pointerStore);
        jobStore = new JobStore(journalDir, eventBus);
        drafts = new PausingDraftRepository(new StorageDraftRepository(storage));
        TilePyramidGenerator tileGenerator = new TilePyramidGenerator(taskScheduler.tileExecutor());
        PublishPipeline pipeline = new PublishPipeline(
            drafts,
            tileGenerator,
            new GeometryImporter(),
            new ReleaseAssembler(storage, pointerStore),
            jobStore,
            eventBus,
            taskScheduler.lightExecutor(),
            config
        );
        TileGenerationPipeline tileGeneration =
            new TileGenerationPipeline(drafts, tileGenerator, storage, jobStore, eventBus, config);
        orchestrator = new JobOrchestrator(jobStore, taskScheduler, pipeline, tileGeneration);
        DraftFixtures.writeDraft(storage, "harbor", "v1");
    }

    @AfterEach
    void tearDown () {
        drafts.proceed.countDown();
        taskScheduler.shutdown();
    }

    @Test
    void publishesDraftAsCurrentRelease () {
        String jobId = orchestrator.startPublish("harbor/v1");
        List<JobState> states = follow(jobId);

        JobState last = states.get(states.size() - 1);
        assertEquals(JobStatus.COMPLETED, last.status, () -> "Job ended with error: " + last.error);
        assertEquals(100, last.progress);
        assertNotNull(last.startedAt);
        assertNotNull(last.completedAt);
        for (int i = 1; i < states.size(); i++) {
            assertTrue(states.get(i).progress >= states.get(i - 1).progress);
        }

        String releaseId = (String) last.result.get("release_id");
        assertTrue(ReleaseIds.isReleaseId(releaseId));
        assertEquals("http://localhost:7070/files/harbor/releases/" + releaseId, last.result.get("release_url"));
        assertEquals(2, last.result.get("overlay_count"));
        assertEquals(9, last.result.get("tile_count"));
        assertEquals(1, ((List<?>) last.result.get("geometry_errors")).size());
        assertTrue(last.logs.stream().anyMatch(entry -> entry.level == JobLogEntry.Level.WARN));

        assertEquals(releaseId, catalog.getCurrent("harbor").releaseId);
        ReleaseManifest manifest = catalog.getManifest("harbor", releaseId);
        assertTrue(manifest.verifyChecksum());
        assertEquals(last.result.get("checksum"), manifest.checksum);
        assertEquals("harbor/v1", manifest.draftId);
        assertEquals("0 0 300 200", manifest.config.defaultViewBox);
        assertTrue(storage.exists(ReleaseAssembler.releaseKey("harbor", releaseId).resolve("tiles/2/2_1.png")));
    }

    @Test
    void secondPublishOfSameDraftIsRejectedWithoutCreatingAJob () throws Exception {
        drafts.pause();
        String first = orchestrator.startPublish("harbor/v1");
        assertTrue(drafts.reached.await(10, TimeUnit.SECONDS));

        PublishInFlightException e =
            assertThrows(PublishInFlightException.class, () -> orchestrator.startPublish("harbor/v1"));
        assertEquals(first, e.activeJobId);
        assertEquals(JobOrchestrator.PUBLISH_JOB_TYPE, e.jobType);
        assertEquals(1, orchestrator.getJobs().size());

        drafts.proceed.countDown();
        assertEquals(JobStatus.COMPLETED, finalState(first).status);

        // Once the first job has finished, the draft can be published again, as a new release.
        String second = orchestrator.startPublish("harbor/v1");
        JobState secondState = finalState(second);
        assertEquals(JobStatus.COMPLETED, secondState.status);
        assertEquals(2, catalog.listReleases("harbor").size());
        assertEquals(secondState.result.get("release_id"), catalog.getCurrent("harbor").releaseId);
    }

    @Test
    void validationIsIdempotentAndHasNoSideEffects () throws Exception {
        assertTrue(orchestrator.validatePublish("harbor/v1").isEmpty());
        assertTrue(orchestrator.validatePublish("harbor/v1").isEmpty());

        Draft broken = new Draft();
        broken.baseImage = DraftFixtures.BASE_IMAGE;
        broken.overlays = DraftFixtures.OVERLAYS;
        broken.config = DraftFixtures.invalidConfig();
        broken.config.supportedLocales = List.of("fr");
        DraftFixtures.writeDraft(storage, "harbor", "v2", broken);
        Files.delete(storage.getFile(broken.getBaseImageKey()).toPath());

        List<String> firstErrors = orchestrator.validatePublish("harbor/v2");
        List<String> secondErrors = orchestrator.validatePublish("harbor/v2");
        assertEquals(3, firstErrors.size(), firstErrors::toString);
        assertEquals(firstErrors, secondErrors);

        assertEquals(List.of("No draft found with id harbor/v9."), orchestrator.validatePublish("harbor/v9"));
        assertEquals(1, orchestrator.validatePublish("not-a-draft-id").size());

        assertTrue(orchestrator.getJobs().isEmpty());
        assertTrue(catalog.listReleases("harbor").isEmpty());
    }

    @Test
    void invalidDraftFailsAtValidation () throws Exception {
        Draft broken = new Draft();
        broken.baseImage = DraftFixtures.BASE_IMAGE;
        broken.overlays = DraftFixtures.OVERLAYS;
        broken.config = DraftFixtures.invalidConfig();
        DraftFixtures.writeDraft(storage, "harbor", "v3", broken);

        JobState failed = finalState(orchestrator.startPublish("harbor/v3"));
        assertEquals(JobStatus.FAILED, failed.status);
        assertTrue(failed.error.startsWith("Validation failed"), failed.error);
        assertTrue(failed.progress <= 10);
        assertFalse(failed.logs.isEmpty());
        assertNull(catalog.getCurrent("harbor"));
    }

    @Test
    void corruptBaseImageFailsTheJob () throws Exception {
        Draft draft = drafts.findDraft("harbor/v1");
        Files.write(storage.getFile(draft.getBaseImageKey()).toPath(),
            "not an image".getBytes(StandardCharsets.UTF_8));

        JobState failed = finalState(orchestrator.startPublish("harbor/v1"));
        assertEquals(JobStatus.FAILED, failed.status);
        assertNotNull(failed.error);
        assertNull(catalog.getCurrent("harbor"));
        assertTrue(catalog.listReleases("harbor").isEmpty());
    }

    @Test
    void cancellingRunningJobLeavesNoRelease () throws Exception {
        drafts.pause();
        String jobId = orchestrator.startPublish("harbor/v1");
        assertTrue(drafts.reached.await(10, TimeUnit.SECONDS));
        assertTrue(orchestrator.cancel(jobId));
        drafts.proceed.countDown();

        JobState cancelled = finalState(jobId);
        assertEquals(JobStatus.CANCELLED, cancelled.status);
        assertTrue(catalog.listReleases("harbor").isEmpty());
        assertNull(catalog.getCurrent("harbor"));
        assertFalse(orchestrator.cancel(jobId));
    }

    @Test
    void cancellingQueuedJobNeverRunsIt () throws Exception {
        CountDownLatch blocker = new CountDownLatch(1);
        // Occupy the single heavy thread so the publish stays queued.
        taskScheduler.enqueueHeavyTask(() -> {
            try {
                blocker.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        String jobId = orchestrator.startPublish("harbor/v1");
        assertEquals(JobStatus.QUEUED, orchestrator.getJob(jobId).status);
        assertTrue(orchestrator.cancel(jobId));
        assertEquals(JobStatus.CANCELLED, orchestrator.getJob(jobId).status);
        blocker.countDown();

        // A new publish may start straight away and runs to completion after the cancelled one is skipped.
        JobState next = finalState(orchestrator.startPublish("harbor/v1"));
        assertEquals(JobStatus.COMPLETED, next.status);
        assertNull(orchestrator.getJob(jobId).startedAt);
    }

    @Test
    void overlayDocumentWithoutGeometryFailsValidationBeforeTiling () throws Exception {
        writeDraftWithOverlays("v4", "<svg xmlns=\"http://www.w3.org/2000/svg\"><g id=\"units\"/></svg>");
        List<String> errors = orchestrator.validatePublish("harbor/v4");
        assertEquals(1, errors.size(), errors::toString);
        assertTrue(errors.get(0).startsWith("No importable geometry"), errors.get(0));
        assertEquals(errors, orchestrator.validatePublish("harbor/v4"));

        writeDraftWithOverlays("v5", "<svg><path d=");
        List<String> malformed = orchestrator.validatePublish("harbor/v5");
        assertEquals(1, malformed.size(), malformed::toString);
        assertTrue(malformed.get(0).contains("not well-formed"), malformed.get(0));

        JobState failed = finalState(orchestrator.startPublish("harbor/v4"));
        assertEquals(JobStatus.FAILED, failed.status);
        assertTrue(failed.error.contains("No importable geometry"), failed.error);
        assertTrue(failed.progress <= 10, () -> "Failed at " + failed.progress);
        assertTrue(catalog.listReleases("harbor").isEmpty());
    }

    @Test
    void manifestViewBoxDefaultsToOverlayDocumentFrame () throws Exception {
        Draft draft = new Draft();
        draft.baseImage = DraftFixtures.BASE_IMAGE;
        draft.overlays = DraftFixtures.OVERLAYS;
        draft.config = ReleaseFixtures.config();
        draft.config.defaultViewBox = null;
        DraftFixtures.writeDraft(storage, "harbor", "v6", draft);

        JobState done = finalState(orchestrator.startPublish("harbor/v6"));
        assertEquals(JobStatus.COMPLETED, done.status, () -> "Job ended with error: " + done.error);
        ReleaseManifest manifest = catalog.getManifest("harbor", (String) done.result.get("release_id"));
        assertEquals("0 0 300 200", manifest.config.defaultViewBox);
        assertTrue(manifest.verifyChecksum());
        // The draft itself is left as it was.
        assertNull(drafts.findDraft("harbor/v6").config.defaultViewBox);
    }

    @Test
    void viewBoxFallsBackToDocumentSizeThenImageSize (@TempDir File tilesDir) {
        TilePyramid pyramid = ReleaseFixtures.pyramid(tilesDir);
        List<Overlay> overlays = ReleaseFixtures.overlays();
        assertEquals("0 0 4096 2048", PublishPipeline.defaultViewBox(
            new GeometryImportResult(overlays, List.of(), " 0 0 4096 2048 ", null, null), pyramid));
        assertEquals("0 0 1200.5 800", PublishPipeline.defaultViewBox(
            new GeometryImportResult(overlays, List.of(), null, 1200.5, 800.0), pyramid));
        assertEquals("0 0 300 200", PublishPipeline.defaultViewBox(
            new GeometryImportResult(overlays, List.of(), "0 0 wide", null, null), pyramid));
    }

    @Test
    void tileGenerationWritesIntoDraftDirectoryOnly () throws Exception {
        String jobId = orchestrator.startTileGeneration("harbor/v1");
        List<JobState> states = follow(jobId);
        JobState done = states.get(states.size() - 1);
        assertEquals(JobStatus.COMPLETED, done.status, () -> "Job ended with error: " + done.error);
        assertEquals(JobOrchestrator.TILE_GENERATION_JOB_TYPE, done.type);
        assertEquals(9, done.result.get("tile_count"));
        assertEquals(3, done.result.get("levels"));
        assertEquals("harbor/uploads/v1/tiles", done.result.get("tiles_path"));
        // The tile stage reports within its own slice, before storing starts at 80.
        assertTrue(states.stream().anyMatch(state -> state.progress > 10 && state.progress < 80));
        for (int i = 1; i < states.size(); i++) {
            assertTrue(states.get(i).progress >= states.get(i - 1).progress);
        }

        FileStorageKey draftDirectory = Draft.directoryKey("harbor", "v1");
        assertTrue(storage.exists(draftDirectory.resolve("tiles/2/2_1.png")));
        assertTrue(storage.exists(draftDirectory.resolve("tiles.dzi")));
        assertTrue(catalog.listReleases("harbor").isEmpty());
        assertNull(catalog.getCurrent("harbor"));

        // Running it again replaces the earlier tiles.
        JobState again = finalState(orchestrator.startTileGeneration("harbor/v1"));
        assertEquals(JobStatus.COMPLETED, again.status, () -> "Job ended with error: " + again.error);
        assertEquals(9, storage.list(draftDirectory.resolve("tiles")).size());

        JobState missing = finalState(orchestrator.startTileGeneration("harbor/v9"));
        assertEquals(JobStatus.FAILED, missing.status);
        assertTrue(missing.error.contains("No draft found"), missing.error);
    }

    @Test
    void secondTileGenerationOfSameDraftIsRejected () throws Exception {
        drafts.pause();
        String first = orchestrator.startTileGeneration("harbor/v1");
        assertTrue(drafts.reached.await(10, TimeUnit.SECONDS));

        PublishInFlightException e =
            assertThrows(PublishInFlightException.class, () -> orchestrator.startTileGeneration("harbor/v1"));
        assertEquals(first, e.activeJobId);
        assertEquals(JobOrchestrator.TILE_GENERATION_JOB_TYPE, e.jobType);
        // A publish of the same draft is a different job type and is queued normally.
        String publish = orchestrator.startPublish("harbor/v1");
        assertEquals(2, orchestrator.getJobs().size());

        drafts.proceed.countDown();
        assertEquals(JobStatus.COMPLETED, finalState(first).status);
        assertEquals(JobStatus.COMPLETED, finalState(publish).status);
    }

    @Test
    void unknownJobs () {
        assertNull(orchestrator.getJob("missing"));
        assertNull(orchestrator.streamJob("missing"));
        assertThrows(IllegalArgumentException.class, () -> orchestrator.cancel("missing"));
        assertThrows(IllegalArgumentException.class, () -> orchestrator.startPublish("harbor"));
    }

    private void writeDraftWithOverlays (String version, String svg) throws Exception {
        Draft draft = DraftFixtures.writeDraft(storage, "harbor", version);
        Files.write(storage.getFile(draft.getOverlayDocumentKey()).toPath(), svg.getBytes(StandardCharsets.UTF_8));
    }

    private List<JobState> follow (String jobId) {
        List<JobState> states = new ArrayList<>();
        try (JobSubscription subscription = orchestrator.streamJob(jobId)) {
            subscription.forEachRemaining(states::add);
        }
        return states;
    }

    private JobState finalState (String jobId) {
        List<JobState> states = follow(jobId);
        return states.get(states.size() - 1);
    }

    /** Lets a test hold a publish inside its tile stage, after validation and before any tile is written. */
    private static class PausingDraftRepository implements DraftRepository {

        private final DraftRepository delegate;
        final CountDownLatch reached = new CountDownLatch(1);
        final CountDownLatch proceed = new CountDownLatch(1);
        private volatile boolean paused;

        PausingDraftRepository (DraftRepository delegate) {
            this.delegate = delegate;
        }

        void pause () {
            paused = true;
        }

        @Override
        public Draft findDraft (String draftId) {
            return delegate.findDraft(draftId);
        }

        @Override
        public SourceImage readBaseImage (Draft draft, long maxPixels) {
            if (paused) {
                paused = false;
                reached.countDown();
                try {
                    proceed.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return delegate.readBaseImage(draft, maxPixels);
        }

        @Override
        public VectorDocument readOverlayDocument (Draft draft) {
            return delegate.readOverlayDocument(draft);
        }

        @Override
        public boolean assetsExist (Draft draft) {
            return delegate.assetsExist(draft);
        }

    }

}
