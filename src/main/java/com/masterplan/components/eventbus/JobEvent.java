package com.masterplan.components.eventbus;

import com.masterplan.jobs.JobState;
import com.masterplan.jobs.JobStatus;

/** Carries one snapshot of a job, sent every time the job's state is updated and journaled. */
public class JobEvent extends Event {

    public final JobState state;

    public JobEvent (JobState state) {
        this.state = state;
        this.success = state.status != JobStatus.FAILED;
    }

    @Override
    public String toString () {
        return "[JobEvent " + state + "]";
    }

}
