package com.masterplan.jobs;

import com.masterplan.progress.CancelledException;
import com.masterplan.progress.PercentProgressListener;

/** Rescales the percentages of one stage into its slice of a job's progress, and makes the stage cancellable. */
class StageProgress extends PercentProgressListener {

    private final JobStore jobStore;
    private final String jobId;
    private final int start;
    private final int end;

    StageProgress (JobStore jobStore, String jobId, int start, int end) {
        this.jobStore = jobStore;
        this.jobId = jobId;
        this.start = start;
        this.end = end;
    }

    @Override
    protected void percentComplete (int percent, String description) {
        jobStore.progress(jobId, start + (end - start) * percent / 100, description);
    }

    @Override
    public void checkCancelled () {
        checkCancelled(jobStore, jobId);
    }

    /** Throws CancelledException once cancellation of the job has been requested. */
    static void checkCancelled (JobStore jobStore, String jobId) {
        if (jobStore.isCancelRequested(jobId)) {
            throw new CancelledException("Job " + jobId + " was cancelled.");
        }
    }

}
