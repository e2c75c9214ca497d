package com.masterplan.components;

import com.masterplan.ReleaseServerConfig;
import com.masterplan.components.eventbus.EventBus;
import com.masterplan.controllers.HttpController;
import com.masterplan.controllers.JobController;
import com.masterplan.controllers.PublishController;
import com.masterplan.controllers.ReleaseController;
import com.masterplan.drafts.DraftRepository;
import com.masterplan.file.FileStorage;
import com.masterplan.jobs.JobOrchestrator;
import com.masterplan.jobs.JobStore;
import com.masterplan.release.ReleaseAssembler;
import com.masterplan.release.ReleaseCatalog;
import com.masterplan.release.ReleasePointerStore;
import com.google.common.collect.Lists;

import java.util.List;

/**
 * We manually wire up our components instead of relying on a dependency injection framework. For our simple case the
 * approach is almost identical but we have to manage the order in which the components are instantiated, a manual
 * depth-first traversal of the dependency graph.
 *
 * This class keeps references to all components of the system in one place. Outside code should never reference
 * these fields: each component holds final references to the other components it needs, passed into its constructor
 * by the wiring-up code in a subclass.
 */
public abstract class ReleaseServerComponents {

    public ReleaseServerConfig config;
    public TaskScheduler taskScheduler;
    public EventBus eventBus;
    public FileStorage fileStorage;
    public DraftRepository draftRepository;
    public ReleasePointerStore releasePointerStore;
    public ReleaseAssembler releaseAssembler;
    public ReleaseCatalog releaseCatalog;
    public JobStore jobStore;
    public JobOrchestrator jobOrchestrator;
    public HttpApi httpApi;

    /**
     * Create the standard list of HttpControllers. This instance should already be initialized with all components
     * except the HttpApi.
     */
    public List<HttpController> standardHttpControllers () {
        return Lists.newArrayList(
            new PublishController(jobOrchestrator),
            new JobController(jobOrchestrator),
            new ReleaseController(releaseCatalog)
        );
    }

}
