package com.masterplan.jobs;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * A blocking iterator over the successive states of one job. The first element is the job's state at the time of
 * subscription, then every later update in order. Iteration ends after the terminal state has been returned, which
 * is always the last element. A subscription is meant to be consumed by a single thread.
 */
public class JobSubscription implements Iterator<JobState>, AutoCloseable {

    public final String jobId;

    private final BlockingQueue<JobState> queue = new LinkedBlockingQueue<>();

    private final Consumer<JobSubscription> onClose;

    private JobState buffered;

    private boolean finished;

    JobSubscription (String jobId, Consumer<JobSubscription> onClose) {
        this.jobId = jobId;
        this.onClose = onClose;
    }

    /** Called by the JobStore, in update order. */
    void offer (JobState state) {
        queue.add(state);
    }

    /** Blocks until the next update arrives, unless the terminal state has already been returned. */
    @Override
    public boolean hasNext () {
        if (buffered != null) return true;
        if (finished) return false;
        try {
            buffered = queue.take();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            return false;
        }
    }

    @Override
    public JobState next () {
        if (!hasNext()) {
            throw new NoSuchElementException("Job " + jobId + " has no further updates.");
        }
        JobState state = buffered;
        buffered = null;
        if (state.status.isTerminal()) {
            close();
        }
        return state;
    }

    /**
     * Wait at most the given time for the next update.
     * @return the next state, or null if none arrived in time or the stream has ended.
     */
    public JobState poll (long timeout, TimeUnit unit) throws InterruptedException {
        if (buffered == null && !finished) {
            buffered = queue.poll(timeout, unit);
        }
        return buffered == null ? null : next();
    }

    /** True once the terminal state has been returned or the subscription was closed. */
    public boolean isFinished () {
        return finished && buffered == null;
    }

    /** Stop receiving updates. Called automatically after the terminal state. */
    @Override
    public void close () {
        if (!finished) {
            finished = true;
            onClose.accept(this);
        }
    }

}
