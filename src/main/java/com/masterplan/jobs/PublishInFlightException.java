package com.masterplan.jobs;

/**
 * A publish or tile generation was requested for a draft that already has a job of the same type queued or running.
 * No job was created.
 */
public class PublishInFlightException extends RuntimeException {

    public final String jobType;

    public final String draftId;

    /** The job that is already working on the draft. */
    public final String activeJobId;

    public PublishInFlightException (String jobType, String draftId, String activeJobId) {
        super(String.format("A %s of %s is already in progress (job %s).",
                jobType.replace('-', ' '), draftId, activeJobId));
        this.jobType = jobType;
        this.draftId = draftId;
        this.activeJobId = activeJobId;
    }

}
