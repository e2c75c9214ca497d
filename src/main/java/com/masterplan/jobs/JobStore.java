package com.masterplan.jobs;

import com.google.common.base.Preconditions;
import com.masterplan.components.Component;
import com.masterplan.components.eventbus.EventBus;
import com.masterplan.components.eventbus.JobEvent;
import com.masterplan.file.StorageException;
import com.masterplan.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * The single owner of all job state. Every change goes through one of the mutating methods here, which under the
 * job's lock apply the change, append a snapshot to the job's history, journal that snapshot to disk, and only then
 * hand it to the job's subscribers. Everything else in the server reads immutable JobState snapshots.
 *
 * A job in a terminal state can no longer be changed: any attempt throws IllegalStateException.
 *
 * The journal holds the latest snapshot of each job as {jobsDirectory}/{id}.json. On startup, jobs that were still
 * queued or running when the previous process stopped are marked failed, since nothing will ever finish them.
 *
 * Once a job finishes only its final snapshot is kept, and only the most recently finished jobs stay in memory.
 * Older ones are read back from the journal when asked for.
 */
public class JobStore implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(JobStore.class);

    private static final String JOURNAL_EXTENSION = ".json";

    public static final String INTERRUPTED_MESSAGE = "Interrupted by a server restart before finishing.";

    public static final int DEFAULT_RETAINED_FINISHED_JOBS = 1000;

    public interface Config {
        // Directory holding one JSON snapshot per job.
        String jobsDirectory ();
    }

    /** A change to apply to a job, returning false if it turned out to change nothing. */
    private interface Mutation {
        boolean apply (Job job);
    }

    private final File journalDirectory;

    private final EventBus eventBus;

    private final int retainedFinishedJobs;

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    // Ids of the finished jobs held in memory, oldest first.
    private final Deque<String> finishedJobIds = new ConcurrentLinkedDeque<>();

    public JobStore (Config config, EventBus eventBus) {
        this(new File(config.jobsDirectory()), eventBus, DEFAULT_RETAINED_FINISHED_JOBS);
    }

    public JobStore (File journalDirectory, EventBus eventBus) {
        this(journalDirectory, eventBus, DEFAULT_RETAINED_FINISHED_JOBS);
    }

    public JobStore (File journalDirectory, EventBus eventBus, int retainedFinishedJobs) {
        Preconditions.checkArgument(retainedFinishedJobs >= 0, "Number of retained jobs must not be negative.");
        this.journalDirectory = journalDirectory;
        this.eventBus = eventBus;
        this.retainedFinishedJobs = retainedFinishedJobs;
        journalDirectory.mkdirs();
        recover();
    }

    public JobState create (String type, String draftId) {
        Job job = new Job(UUID.randomUUID().toString(), type, draftId, Instant.now());
        JobState state;
        synchronized (job) {
            jobs.put(job.id, job);
            state = record(job);
        }
        eventBus.send(new JobEvent(state));
        return state;
    }

    /** @throws IllegalStateException unless the job is queued. */
    public JobState start (String id) {
        return update(id, job -> {
            if (job.status != JobStatus.QUEUED) {
                throw new IllegalStateException("Job " + id + " cannot start, it is " + job.status.jsonName());
            }
            job.status = JobStatus.RUNNING;
            job.startedAt = Instant.now();
            return true;
        });
    }

    /**
     * Record progress. A percentage lower than the one already recorded is ignored, as is an update that would
     * change neither the percentage nor the message.
     */
    public JobState progress (String id, int percent, String message) {
        return update(id, job -> {
            int clamped = Math.max(job.progress, Math.min(100, percent));
            boolean sameMessage = message == null || message.equals(job.message);
            if (clamped == job.progress && sameMessage) return false;
            job.progress = clamped;
            if (message != null) job.message = message;
            return true;
        });
    }

    public JobState appendLog (String id, JobLogEntry.Level level, String message) {
        return update(id, job -> {
            job.logs.add(new JobLogEntry(Instant.now(), level, message));
            return true;
        });
    }

    public JobState complete (String id, Map<String, Object> result) {
        return update(id, job -> {
            job.status = JobStatus.COMPLETED;
            job.progress = 100;
            job.result = result;
            job.completedAt = Instant.now();
            return true;
        });
    }

    public JobState fail (String id, String error) {
        return update(id, job -> {
            job.status = JobStatus.FAILED;
            job.error = error;
            job.logs.add(new JobLogEntry(Instant.now(), JobLogEntry.Level.ERROR, error));
            job.completedAt = Instant.now();
            return true;
        });
    }

    /** Record that a job has stopped because it was cancelled. */
    public JobState cancel (String id) {
        return update(id, job -> {
            job.status = JobStatus.CANCELLED;
            job.logs.add(new JobLogEntry(Instant.now(), JobLogEntry.Level.WARN, "Cancelled."));
            job.completedAt = Instant.now();
            return true;
        });
    }

    /**
     * Ask for a job to stop. A queued job is cancelled on the spot. A running job is flagged, and stops at its next
     * cancellation check. A terminal job is left alone.
     * @return false if the job had already reached a terminal state.
     */
    public boolean requestCancel (String id) {
        Job job = getJobOrThrow(id);
        synchronized (job) {
            if (job.status.isTerminal()) return false;
            job.cancelRequested = true;
            if (job.status == JobStatus.QUEUED) {
                cancel(id);
            }
            return true;
        }
    }

    public boolean isCancelRequested (String id) {
        return getJobOrThrow(id).cancelRequested;
    }

    /** @return the latest snapshot of the job, or null if there is no such job. */
    @Nullable
    public JobState get (String id) {
        Job job = findJob(id);
        if (job == null) return null;
        synchronized (job) {
            return job.history.get(job.history.size() - 1);
        }
    }

    /** All snapshots of the job recorded by this process, oldest first. A finished job only has its final one. */
    public List<JobState> history (String id) {
        Job job = getJobOrThrow(id);
        synchronized (job) {
            return new ArrayList<>(job.history);
        }
    }

    /** The latest snapshot of every active job and of the most recently finished ones, newest first. */
    public List<JobState> list () {
        return jobs.keySet().stream()
                .map(this::get)
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing((JobState s) -> s.createdAt).reversed())
                .collect(Collectors.toList());
    }

    /** @return a subscription starting at the job's current state, or null if there is no such job. */
    @Nullable
    public JobSubscription subscribe (String id) {
        Job job = findJob(id);
        if (job == null) return null;
        synchronized (job) {
            JobSubscription subscription = new JobSubscription(id, this::unsubscribe);
            JobState current = job.history.get(job.history.size() - 1);
            subscription.offer(current);
            if (!current.status.isTerminal()) {
                job.subscribers.add(subscription);
            }
            return subscription;
        }
    }

    private void unsubscribe (JobSubscription subscription) {
        Job job = jobs.get(subscription.jobId);
        if (job == null) return;
        synchronized (job) {
            job.subscribers.remove(subscription);
        }
    }

    private JobState update (String id, Mutation mutation) {
        Job job = getJobOrThrow(id);
        JobState state;
        synchronized (job) {
            if (job.status.isTerminal()) {
                throw new IllegalStateException("Job " + id + " is already " + job.status.jsonName());
            }
            if (!mutation.apply(job)) {
                return job.history.get(job.history.size() - 1);
            }
            state = record(job);
        }
        if (state.status.isTerminal()) {
            retainFinished(id);
        }
        eventBus.send(new JobEvent(state));
        return state;
    }

    /** Snapshot, journal, then notify. The caller holds the job's lock. */
    private JobState record (Job job) {
        job.sequence += 1;
        JobState state = job.snapshot();
        job.history.add(state);
        journal(state);
        for (JobSubscription subscription : job.subscribers) {
            subscription.offer(state);
        }
        if (state.status.isTerminal()) {
            job.subscribers.clear();
            job.history.clear();
            job.history.add(state);
        }
        return state;
    }

    private void journal (JobState state) {
        File target = new File(journalDirectory, state.id + JOURNAL_EXTENSION);
        File temp = new File(journalDirectory, state.id + JOURNAL_EXTENSION + ".tmp");
        try {
            JsonUtil.objectMapper.writeValue(temp, state);
            try {
                Files.move(temp.toPath(), target.toPath(),
                        StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp.toPath(), target.toPath(), StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StorageException("Could not journal " + state, e);
        }
    }

    private void recover () {
        File[] journalFiles = journalDirectory.listFiles((dir, name) -> name.endsWith(JOURNAL_EXTENSION));
        if (journalFiles == null) return;
        int interrupted = 0;
        List<JobState> finished = new ArrayList<>();
        for (File file : journalFiles) {
            JobState state;
            try {
                state = JsonUtil.objectMapper.readValue(file, JobState.class);
            } catch (IOException e) {
                LOG.warn("Ignoring unreadable job journal {}: {}", file, e.toString());
                continue;
            }
            Job job = Job.fromState(state);
            synchronized (job) {
                if (!job.status.isTerminal()) {
                    job.status = JobStatus.FAILED;
                    job.error = INTERRUPTED_MESSAGE;
                    job.logs.add(new JobLogEntry(Instant.now(), JobLogEntry.Level.ERROR, INTERRUPTED_MESSAGE));
                    job.completedAt = Instant.now();
                    record(job);
                    interrupted += 1;
                }
                jobs.put(job.id, job);
                finished.add(job.snapshot());
            }
        }
        finished.sort(Comparator.comparing(
                (JobState s) -> s.completedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder())));
        for (JobState state : finished) {
            retainFinished(state.id);
        }
        LOG.info("Recovered {} jobs from {}, {} of them interrupted.", finished.size(), journalDirectory, interrupted);
    }

    /** Keep the given job in memory as the most recently finished, dropping the oldest beyond the limit. */
    private void retainFinished (String id) {
        finishedJobIds.addLast(id);
        while (finishedJobIds.size() > retainedFinishedJobs) {
            String evicted = finishedJobIds.pollFirst();
            if (evicted == null) break;
            jobs.remove(evicted);
            LOG.debug("Evicted finished job {} from memory.", evicted);
        }
    }

    /** Find a job in memory, or failing that a finished one in the journal. */
    @Nullable
    private Job findJob (String id) {
        Job job = jobs.get(id);
        if (job != null) return job;
        File file = new File(journalDirectory, id + JOURNAL_EXTENSION);
        // Ids come from HTTP paths. Only plain file names inside the journal directory are looked up.
        if (!file.getName().equals(id + JOURNAL_EXTENSION) || !file.isFile()) return null;
        try {
            return Job.fromState(JsonUtil.objectMapper.readValue(file, JobState.class));
        } catch (IOException e) {
            throw new StorageException("Could not read job journal " + file, e);
        }
    }

    private Job getJobOrThrow (String id) {
        Job job = findJob(id);
        if (job == null) {
            throw new IllegalArgumentException("No job with id " + id);
        }
        return job;
    }

}
