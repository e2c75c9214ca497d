package com.masterplan.jobs;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The mutable record behind a job, owned by the JobStore. Every field is guarded by the instance's monitor, which
 * the JobStore holds for the whole of each update: apply, snapshot, journal and notify.
 */
class Job {

    final String id;
    final String type;
    final String draftId;
    final Instant createdAt;

    JobStatus status = JobStatus.QUEUED;
    int progress;
    String message;
    final List<JobLogEntry> logs = new ArrayList<>();
    Map<String, Object> result;
    String error;
    Instant startedAt;
    Instant completedAt;
    long sequence;

    /** Read by the running pipeline without taking the monitor. */
    volatile boolean cancelRequested;

    /** Every snapshot taken of this job, in order. */
    final List<JobState> history = new ArrayList<>();

    final List<JobSubscription> subscribers = new ArrayList<>();

    Job (String id, String type, String draftId, Instant createdAt) {
        this.id = id;
        this.type = type;
        this.draftId = draftId;
        this.createdAt = createdAt;
    }

    /** Rebuild a job from its journaled snapshot. */
    static Job fromState (JobState state) {
        Job job = new Job(state.id, state.type, state.draftId, state.createdAt);
        job.status = state.status;
        job.progress = state.progress;
        job.message = state.message;
        job.logs.addAll(state.logs);
        job.result = state.result;
        job.error = state.error;
        job.startedAt = state.startedAt;
        job.completedAt = state.completedAt;
        job.sequence = state.sequence;
        job.history.add(state);
        return job;
    }

    JobState snapshot () {
        return new JobState(
            id, type, draftId, status, progress, message, logs, result, error, createdAt, startedAt, completedAt,
            sequence
        );
    }

}
