package com.masterplan.components.eventbus;

import com.masterplan.jobs.JobState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs the outcome of every job, leaving intermediate progress to the job's own event log. */
public class JobEventLogger implements EventHandler {

    private static final Logger LOG = LoggerFactory.getLogger(JobEventLogger.class);

    @Override
    public void handleEvent (Event event) {
        JobState state = ((JobEvent) event).state;
        switch (state.status) {
            case COMPLETED:
                LOG.info("Job {} completed: {}", state.id, state.result);
                break;
            case FAILED:
                LOG.warn("Job {} failed: {}", state.id, state.error);
                break;
            case CANCELLED:
                LOG.info("Job {} was cancelled.", state.id);
                break;
            default:
                break;
        }
    }

    @Override
    public boolean acceptEvent (Event event) {
        return event instanceof JobEvent && ((JobEvent) event).state.status.isTerminal();
    }

    @Override
    public boolean synchronous () {
        return true;
    }

}
