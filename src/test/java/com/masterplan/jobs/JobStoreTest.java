package com.masterplan.jobs;

import com.masterplan.components.TaskScheduler;
import com.masterplan.components.eventbus.Event;
import com.masterplan.components.eventbus.EventBus;
import com.masterplan.components.eventbus.EventHandler;
import com.masterplan.components.eventbus.JobEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobStoreTest {

    @TempDir
    File journalDir;

    private TaskScheduler taskScheduler;
    private EventBus eventBus;
    private final List<JobState> busEvents = new CopyOnWriteArrayList<>();
    private JobStore jobStore;

    @BeforeEach
    void setUp () {
        taskScheduler = new TaskScheduler(new TestConfig());
        eventBus = new EventBus(taskScheduler);
        eventBus.addHandlers(new EventHandler() {
            @Override
            public void handleEvent (Event event) {
                busEvents.add(((JobEvent) event).state);
            }

            @Override
            public boolean acceptEvent (Event event) {
                return event instanceof JobEvent;
            }

            @Override
            public boolean synchronous () {
                return true;
            }
        });
        jobStore = new JobStore(journalDir, eventBus);
    }

    @AfterEach
    void tearDown () {
        taskScheduler.shutdown();
    }

    @Test
    void newJobIsQueuedAndJournaled () {
        JobState job = jobStore.create("publish", "harbor/v1");
        assertEquals(JobStatus.QUEUED, job.status);
        assertEquals(0, job.progress);
        assertEquals(1, job.sequence);
        assertNotNull(job.createdAt);
        assertNull(job.startedAt);
        assertTrue(new File(journalDir, job.id + ".json").isFile());
        assertEquals(1, busEvents.size());
        assertEquals(job.id, jobStore.get(job.id).id);
        assertNull(jobStore.get("no-such-job"));
    }

    @Test
    void progressNeverRegresses () {
        String id = jobStore.create("publish", "harbor/v1").id;
        jobStore.start(id);
        assertEquals(30, jobStore.progress(id, 30, "Tiles").progress);
        JobState afterLowerValue = jobStore.progress(id, 20, "Tiles");
        assertEquals(30, afterLowerValue.progress);
        assertEquals(55, jobStore.progress(id, 55, "Tiles").progress);
        assertEquals(100, jobStore.progress(id, 250, "Tiles").progress);

        List<JobState> history = jobStore.history(id);
        int previousProgress = 0;
        long previousSequence = 0;
        for (JobState state : history) {
            assertTrue(state.progress >= previousProgress);
            assertTrue(state.sequence > previousSequence);
            previousProgress = state.progress;
            previousSequence = state.sequence;
        }
        // create, start, 30, 55, 100. The ignored update did not add an event.
        assertEquals(5, history.size());
    }

    @Test
    void terminalStatesAreFinal () {
        String id = jobStore.create("publish", "harbor/v1").id;
        jobStore.start(id);
        JobState completed = jobStore.complete(id, Map.of("release_id", "rel_20240101000000_0123abcd"));
        assertEquals(JobStatus.COMPLETED, completed.status);
        assertEquals(100, completed.progress);
        assertNotNull(completed.completedAt);

        assertThrows(IllegalStateException.class, () -> jobStore.progress(id, 100, "again"));
        assertThrows(IllegalStateException.class, () -> jobStore.fail(id, "too late"));
        assertThrows(IllegalStateException.class, () -> jobStore.cancel(id));
        assertThrows(IllegalStateException.class, () -> jobStore.appendLog(id, JobLogEntry.Level.INFO, "late"));
        assertThrows(IllegalStateException.class, () -> jobStore.start(id));
        assertFalse(jobStore.requestCancel(id));
        assertEquals(JobStatus.COMPLETED, jobStore.get(id).status);
    }

    @Test
    void jobStartsOnlyOnce () {
        String id = jobStore.create("publish", "harbor/v1").id;
        JobState running = jobStore.start(id);
        assertEquals(JobStatus.RUNNING, running.status);
        assertNotNull(running.startedAt);
        assertThrows(IllegalStateException.class, () -> jobStore.start(id));
    }

    @Test
    void failedJobKeepsItsLog () {
        String id = jobStore.create("publish", "harbor/v1").id;
        jobStore.start(id);
        jobStore.appendLog(id, JobLogEntry.Level.INFO, "Validated draft harbor/v1.");
        JobState failed = jobStore.fail(id, "Base image is corrupt.");
        assertEquals(JobStatus.FAILED, failed.status);
        assertEquals("Base image is corrupt.", failed.error);
        assertEquals(2, failed.logs.size());
        assertEquals(JobLogEntry.Level.ERROR, failed.logs.get(1).level);
    }

    @Test
    void subscriptionDeliversEveryUpdateEndingWithTerminalState () throws Exception {
        String id = jobStore.create("publish", "harbor/v1").id;
        JobSubscription subscription = jobStore.subscribe(id);
        Thread worker = new Thread(() -> {
            jobStore.start(id);
            for (int p = 10; p <= 90; p += 10) {
                jobStore.progress(id, p, "Working");
            }
            jobStore.complete(id, Map.of("tile_count", 9));
        });
        worker.start();

        List<JobState> received = new ArrayList<>();
        while (subscription.hasNext()) {
            received.add(subscription.next());
        }
        worker.join();

        assertEquals(JobStatus.QUEUED, received.get(0).status);
        assertEquals(JobStatus.COMPLETED, received.get(received.size() - 1).status);
        // queued, running, nine progress updates, completed
        assertEquals(12, received.size());
        for (int i = 1; i < received.size(); i++) {
            assertEquals(received.get(i - 1).sequence + 1, received.get(i).sequence);
            assertTrue(received.get(i).progress >= received.get(i - 1).progress);
        }
        assertTrue(subscription.isFinished());
        assertFalse(subscription.hasNext());
    }

    @Test
    void lateSubscriberSeesOnlyTheTerminalState () throws Exception {
        String id = jobStore.create("publish", "harbor/v1").id;
        jobStore.start(id);
        jobStore.fail(id, "Storage is full.");
        JobSubscription subscription = jobStore.subscribe(id);
        JobState only = subscription.poll(1, TimeUnit.SECONDS);
        assertEquals(JobStatus.FAILED, only.status);
        assertTrue(subscription.isFinished());
        assertNull(subscription.poll(10, TimeUnit.MILLISECONDS));
    }

    @Test
    void cancellingQueuedJobCancelsImmediately () {
        String id = jobStore.create("publish", "harbor/v1").id;
        assertTrue(jobStore.requestCancel(id));
        assertEquals(JobStatus.CANCELLED, jobStore.get(id).status);
        assertThrows(IllegalStateException.class, () -> jobStore.start(id));
    }

    @Test
    void cancellingRunningJobOnlySetsTheFlag () {
        String id = jobStore.create("publish", "harbor/v1").id;
        jobStore.start(id);
        assertFalse(jobStore.isCancelRequested(id));
        assertTrue(jobStore.requestCancel(id));
        assertTrue(jobStore.isCancelRequested(id));
        assertEquals(JobStatus.RUNNING, jobStore.get(id).status);
        assertEquals(JobStatus.CANCELLED, jobStore.cancel(id).status);
    }

    @Test
    void recoveryFailsInterruptedJobs () {
        String runningId = jobStore.create("publish", "harbor/v1").id;
        jobStore.start(runningId);
        jobStore.progress(runningId, 40, "Generating tiles");
        jobStore.appendLog(runningId, JobLogEntry.Level.INFO, "Validated draft harbor/v1.");
        String doneId = jobStore.create("publish", "harbor/v2").id;
        jobStore.start(doneId);
        jobStore.complete(doneId, Map.of("tile_count", 9));

        JobStore restarted = new JobStore(journalDir, eventBus);

        JobState interrupted = restarted.get(runningId);
        assertEquals(JobStatus.FAILED, interrupted.status);
        assertEquals(JobStore.INTERRUPTED_MESSAGE, interrupted.error);
        assertEquals(40, interrupted.progress);
        assertEquals("harbor/v1", interrupted.draftId);
        assertEquals("Validated draft harbor/v1.", interrupted.logs.get(0).message);
        assertNotNull(interrupted.completedAt);

        JobState completed = restarted.get(doneId);
        assertEquals(JobStatus.COMPLETED, completed.status);
        assertEquals(9, ((Number) completed.result.get("tile_count")).intValue());
        assertEquals(2, restarted.list().size());
    }

    @Test
    void finishedJobsLeaveMemoryButStayReadable () {
        JobStore store = new JobStore(journalDir, eventBus, 2);
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            String id = store.create("publish", "harbor/v" + i).id;
            store.start(id);
            store.progress(id, 50, "Generating tiles");
            store.complete(id, Map.of("tile_count", i));
            ids.add(id);
        }
        // A finished job keeps only its final snapshot, which still carries the whole log.
        List<JobState> history = store.history(ids.get(3));
        assertEquals(1, history.size());
        assertEquals(JobStatus.COMPLETED, history.get(0).status);

        // Only the two most recently finished jobs are held in memory.
        List<String> listed = new ArrayList<>();
        for (JobState state : store.list()) listed.add(state.id);
        assertEquals(2, listed.size());
        assertTrue(listed.containsAll(ids.subList(2, 4)));

        // Older ones are read back from the journal.
        JobState oldest = store.get(ids.get(0));
        assertEquals(JobStatus.COMPLETED, oldest.status);
        assertEquals(0, ((Number) oldest.result.get("tile_count")).intValue());
        assertFalse(store.requestCancel(ids.get(0)));
        assertThrows(IllegalStateException.class, () -> store.progress(ids.get(0), 60, "late"));
        JobSubscription subscription = store.subscribe(ids.get(0));
        assertEquals(JobStatus.COMPLETED, subscription.next().status);
        assertFalse(subscription.hasNext());

        assertNull(store.get("../" + ids.get(0)));
        assertNull(store.get("no-such-job"));
    }

}
