package com.masterplan.jobs;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * An immutable snapshot of a job, taken each time the JobStore changes it. This is what clients poll, what the
 * stream delivers, and what is journaled to disk. The sequence number increases by one with every update of a job,
 * so two snapshots of the same job are ordered by it.
 */
public class JobState {

    public final String id;
    public final String type;

    @JsonProperty("draft_id")
    public final String draftId;

    public final JobStatus status;

    /** Whole percent complete, never decreasing over the life of the job. */
    public final int progress;

    /** Description of the work in progress. */
    public final String message;

    public final List<JobLogEntry> logs;

    /** Present once the job has completed. */
    public final Map<String, Object> result;

    /** Present once the job has failed. */
    public final String error;

    @JsonProperty("created_at")
    public final Instant createdAt;

    @JsonProperty("started_at")
    public final Instant startedAt;

    @JsonProperty("completed_at")
    public final Instant completedAt;

    public final long sequence;

    @JsonCreator
    public JobState (
            @JsonProperty("id") String id,
            @JsonProperty("type") String type,
            @JsonProperty("draft_id") String draftId,
            @JsonProperty("status") JobStatus status,
            @JsonProperty("progress") int progress,
            @JsonProperty("message") String message,
            @JsonProperty("logs") List<JobLogEntry> logs,
            @JsonProperty("result") Map<String, Object> result,
            @JsonProperty("error") String error,
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("started_at") Instant startedAt,
            @JsonProperty("completed_at") Instant completedAt,
            @JsonProperty("sequence") long sequence
    ) {
        this.id = id;
        this.type = type;
        this.draftId = draftId;
        this.status = status;
        this.progress = progress;
        this.message = message;
        this.logs = logs == null ? ImmutableList.of() : ImmutableList.copyOf(logs);
        // ImmutableMap rejects null values, so results never carry them.
        this.result = result == null ? null : ImmutableMap.copyOf(result);
        this.error = error;
        this.createdAt = createdAt;
        this.startedAt = startedAt;
        this.completedAt = completedAt;
        this.sequence = sequence;
    }

    @Override
    public String toString () {
        return String.format("[job %s %s %s %d%%]", id, draftId, status.jsonName(), progress);
    }

}
