package com.masterplan.jobs;

import com.masterplan.components.Component;
import com.masterplan.components.TaskScheduler;
import com.masterplan.drafts.Draft;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import javax.annotation.Nullable;

/**
 * Entry point for publishing drafts, generating their tiles, and following the resulting jobs. Every job runs as a
 * heavy task on the TaskScheduler, so HTTP request threads only create and query jobs and never do the work
 * themselves.
 *
 * At most one job of each type per draft is queued or running at any time. A second request of the same type for
 * the same draft is rejected without creating a job.
 */
public class JobOrchestrator implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(JobOrchestrator.class);

    public static final String PUBLISH_JOB_TYPE = "publish";

    public static final String TILE_GENERATION_JOB_TYPE = "tile-generation";

    private final JobStore jobStore;
    private final TaskScheduler taskScheduler;
    private final PublishPipeline pipeline;
    private final TileGenerationPipeline tileGeneration;

    // Job type and draft id to the id of the last job of that type started for the draft. Guarded by itself.
    private final Map<String, String> lastJobByTypeAndDraft = new HashMap<>();

    public JobOrchestrator (
            JobStore jobStore,
            TaskScheduler taskScheduler,
            PublishPipeline pipeline,
            TileGenerationPipeline tileGeneration
    ) {
        this.jobStore = jobStore;
        this.taskScheduler = taskScheduler;
        this.pipeline = pipeline;
        this.tileGeneration = tileGeneration;
    }

    /**
     * Queue a publish of the given draft.
     * @return the id of the new job.
     * @throws PublishInFlightException if a publish of the same draft is queued or running.
     * @throws IllegalArgumentException if the draft id is malformed.
     */
    public String startPublish (String draftId) {
        return startJob(PUBLISH_JOB_TYPE, draftId, pipeline::run);
    }

    /**
     * Queue generation of the draft's tiles into its uploads directory, for previewing before a publish.
     * @return the id of the new job.
     * @throws PublishInFlightException if tiles are already being generated for the same draft.
     * @throws IllegalArgumentException if the draft id is malformed.
     */
    public String startTileGeneration (String draftId) {
        return startJob(TILE_GENERATION_JOB_TYPE, draftId, tileGeneration::run);
    }

    private String startJob (String type, String draftId, Consumer<String> runner) {
        Draft.parseDraftId(draftId);
        String key = type + " " + draftId;
        final JobState job;
        synchronized (lastJobByTypeAndDraft) {
            String previousJobId = lastJobByTypeAndDraft.get(key);
            if (previousJobId != null) {
                JobState previous = jobStore.get(previousJobId);
                if (previous != null && !previous.status.isTerminal()) {
                    throw new PublishInFlightException(type, draftId, previousJobId);
                }
            }
            job = jobStore.create(type, draftId);
            lastJobByTypeAndDraft.put(key, job.id);
        }
        LOG.info("Queued {} of {} as job {}.", type, draftId, job.id);
        taskScheduler.enqueueHeavyTask(() -> runner.accept(job.id));
        return job.id;
    }

    /** Report every problem that would make a publish of this draft fail validation. Changes nothing. */
    public List<String> validatePublish (String draftId) {
        return pipeline.validate(draftId);
    }

    /** @return the latest state of the job, or null if there is no such job. */
    @Nullable
    public JobState getJob (String jobId) {
        return jobStore.get(jobId);
    }

    public List<JobState> getJobs () {
        return jobStore.list();
    }

    /** @return an iterator over the job's states ending with its terminal state, or null if there is no such job. */
    @Nullable
    public JobSubscription streamJob (String jobId) {
        return jobStore.subscribe(jobId);
    }

    /**
     * Ask a job to stop. Has no effect on a job that has already finished.
     * @return false if the job had already finished.
     * @throws IllegalArgumentException if there is no such job.
     */
    public boolean cancel (String jobId) {
        boolean requested = jobStore.requestCancel(jobId);
        if (requested) {
            LOG.info("Cancellation requested for job {}.", jobId);
        }
        return requested;
    }

}
