package com.masterplan.components;

import com.masterplan.ReleaseServerConfig;
import com.masterplan.components.eventbus.ErrorLogger;
import com.masterplan.components.eventbus.EventBus;
import com.masterplan.components.eventbus.JobEventLogger;
import com.masterplan.controllers.HttpController;
import com.masterplan.controllers.LocalFilesController;
import com.masterplan.drafts.StorageDraftRepository;
import com.masterplan.file.LocalFileStorage;
import com.masterplan.geometry.GeometryImporter;
import com.masterplan.jobs.JobOrchestrator;
import com.masterplan.jobs.JobStore;
import com.masterplan.jobs.PublishPipeline;
import com.masterplan.jobs.TileGenerationPipeline;
import com.masterplan.release.ReleaseAssembler;
import com.masterplan.release.ReleaseCatalog;
import com.masterplan.release.ReleasePointerStore;
import com.masterplan.tiles.TilePyramidGenerator;

import java.io.File;
import java.util.List;

/**
 * Wires up the components for a release server keeping all files on the local filesystem.
 * No conditional logic should be present here.
 */
public class LocalReleaseServerComponents extends ReleaseServerComponents {

    public LocalReleaseServerComponents (ReleaseServerConfig config) {
        this.config = config;
        taskScheduler = new TaskScheduler(config);
        eventBus = new EventBus(taskScheduler);
        LocalFileStorage localFileStorage = new LocalFileStorage(config);
        fileStorage = localFileStorage;
        draftRepository = new StorageDraftRepository(fileStorage);
        releasePointerStore = new ReleasePointerStore(new File(localFileStorage.directory));
        releaseAssembler = new ReleaseAssembler(fileStorage, releasePointerStore);
        releaseCatalog = new ReleaseCatalog(fileStorage, releasePointerStore);
        jobStore = new JobStore(config, eventBus);
        TilePyramidGenerator tilePyramidGenerator = new TilePyramidGenerator(taskScheduler.tileExecutor());
        PublishPipeline publishPipeline = new PublishPipeline(
            draftRepository,
            tilePyramidGenerator,
            new GeometryImporter(),
            releaseAssembler,
            jobStore,
            eventBus,
            taskScheduler.lightExecutor(),
            config
        );
        TileGenerationPipeline tileGenerationPipeline = new TileGenerationPipeline(
            draftRepository, tilePyramidGenerator, fileStorage, jobStore, eventBus, config);
        jobOrchestrator = new JobOrchestrator(jobStore, taskScheduler, publishPipeline, tileGenerationPipeline);
        // Instantiate the HttpControllers last, when all the components except the HttpApi are already created.
        List<HttpController> httpControllers = standardHttpControllers();
        httpControllers.add(new LocalFilesController(localFileStorage));
        httpApi = new HttpApi(eventBus, config, httpControllers);
        eventBus.addHandlers(new ErrorLogger(), new JobEventLogger());
    }

}
